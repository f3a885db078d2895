package com.hcltech.lineage;

import java.util.Objects;

/** How tags of a hierarchy are matched against a query. */
public interface TagTC<T> {
    /** True when {@code query} names the same specialization as {@code tag}. */
    default boolean same(T tag, T query) {
        return Objects.equals(tag, query);
    }

    /** Label for logs/messages (defaults to toString). */
    default String label(T tag) {
        return String.valueOf(tag);
    }
}
