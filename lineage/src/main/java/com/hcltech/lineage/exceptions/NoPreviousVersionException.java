package com.hcltech.lineage.exceptions;

public final class NoPreviousVersionException extends LineageException {
    private final Object version;

    public NoPreviousVersionException(String hierarchy, Object version, String message) {
        super(hierarchy, message);
        this.version = version;
    }

    /** The version the climb started from, or the one it looked for. */
    public Object version() {
        return version;
    }
}
