package com.hcltech.lineage.exceptions;

public final class DuplicateRootException extends LineageException {
    public DuplicateRootException(String hierarchy, String existingRoot, String rejectedRoot) {
        super(hierarchy, "Hierarchy " + hierarchy + " already has root " + existingRoot
                + "; cannot register " + rejectedRoot + " without a parent");
    }
}
