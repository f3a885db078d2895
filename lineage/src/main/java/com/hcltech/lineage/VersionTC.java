package com.hcltech.lineage;

/** Tags with a total order, as needed by chain hierarchies. */
public interface VersionTC<T> extends TagTC<T> {

    /** Negative, zero or positive as {@code a} is older than, the same as, or newer than {@code b}. */
    int compare(T a, T b);

    @Override
    default boolean same(T tag, T query) {
        return compare(tag, query) == 0;
    }

    default boolean notNewerThan(T tag, T query) {
        return compare(tag, query) <= 0;
    }
}
