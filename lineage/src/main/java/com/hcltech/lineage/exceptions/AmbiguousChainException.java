package com.hcltech.lineage.exceptions;

import java.util.List;

public final class AmbiguousChainException extends LineageException {
    public AmbiguousChainException(String hierarchy, String node, List<String> children) {
        super(hierarchy, "Chain " + hierarchy + ": " + node + " has " + children.size()
                + " children " + children + "; cannot pick a version");
    }
}
