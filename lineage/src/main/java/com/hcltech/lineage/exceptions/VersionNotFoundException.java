package com.hcltech.lineage.exceptions;

public final class VersionNotFoundException extends LineageException {
    private final Object version;

    public VersionNotFoundException(String hierarchy, Object version, String message) {
        super(hierarchy, message);
        this.version = version;
    }

    public Object version() {
        return version;
    }
}
