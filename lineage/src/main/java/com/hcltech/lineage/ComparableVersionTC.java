package com.hcltech.lineage;

import java.util.Objects;

/** Natural ordering of any {@link Comparable} tag (integers, {@code Runtime.Version}, ...). */
public final class ComparableVersionTC<V extends Comparable<? super V>> implements VersionTC<V> {

    @Override
    public int compare(V a, V b) {
        Objects.requireNonNull(a, "version");
        Objects.requireNonNull(b, "version");
        return a.compareTo(b);
    }
}
