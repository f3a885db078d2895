package com.hcltech.lineage;

/** Exact, case-sensitive model identifiers. */
public final class StringTagTC implements TagTC<String> {
    public static final StringTagTC INSTANCE = new StringTagTC();

    private StringTagTC() {}
}
