package com.hcltech.lineage.exceptions;

public final class NonLinearChainException extends LineageException {
    public NonLinearChainException(String hierarchy, String parent, String existingChild, String rejectedChild) {
        super(hierarchy, "Chain " + hierarchy + ": " + parent + " already has child " + existingChild
                + "; cannot add " + rejectedChild);
    }
}
