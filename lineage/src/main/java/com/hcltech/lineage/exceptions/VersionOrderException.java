package com.hcltech.lineage.exceptions;

public final class VersionOrderException extends LineageException {
    public VersionOrderException(String hierarchy, String parent, String rejectedChild) {
        super(hierarchy, "Chain " + hierarchy + ": version " + rejectedChild
                + " must be newer than its parent " + parent);
    }
}
