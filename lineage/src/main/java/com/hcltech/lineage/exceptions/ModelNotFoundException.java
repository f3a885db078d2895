package com.hcltech.lineage.exceptions;

public final class ModelNotFoundException extends LineageException {
    private final Object model;

    public ModelNotFoundException(String hierarchy, Object model, String message) {
        super(hierarchy, message);
        this.model = model;
    }

    public Object model() {
        return model;
    }
}
