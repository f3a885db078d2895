package com.hcltech.lineage;

/** What a lookup does when nothing qualifies. */
public enum Fallback {
    /** Throw the lookup's not-found exception. */
    FAIL,
    /** Return the node the search started from, so callers get the base behaviour. */
    BASE
}
