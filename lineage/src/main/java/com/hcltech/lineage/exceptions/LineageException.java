package com.hcltech.lineage.exceptions;

/** Root of everything the registry and the resolvers throw. Carries the name of the hierarchy involved. */
public abstract class LineageException extends RuntimeException {
    private final String hierarchy;

    protected LineageException(String hierarchy, String message) {
        super(message);
        this.hierarchy = hierarchy;
    }

    public String hierarchy() {
        return hierarchy;
    }
}
