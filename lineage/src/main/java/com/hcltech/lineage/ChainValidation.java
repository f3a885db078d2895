package com.hcltech.lineage;

import com.hcltech.lineage.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Whole-hierarchy check of the chain shape. Reports every defect; never throws. */
public final class ChainValidation {
    private ChainValidation() {}

    /** Success (Boolean.TRUE) if every node has at most one child and versions increase downwards. */
    public static <T, P> ErrorsOr<Boolean> validate(Hierarchy<T, P> hierarchy) {
        Objects.requireNonNull(hierarchy);
        if (hierarchy.topology() != Topology.CHAIN)
            return ErrorsOr.error("Hierarchy " + hierarchy.name() + " is a " + hierarchy.topology() + ", not a chain");

        VersionTC<T> tc = hierarchy.versionTC();
        List<String> errors = new ArrayList<>();
        for (TypeNode<T, P> node : hierarchy.nodes()) {
            List<TypeNode<T, P>> children = node.children();
            if (children.size() > 1) {
                errors.add(node.label() + " has " + children.size() + " children "
                        + children.stream().map(TypeNode::label).toList());
            }
            node.parent().ifPresent(parent -> {
                if (tc.compare(node.tag(), parent.tag()) <= 0)
                    errors.add(node.label() + " is not newer than its parent " + parent.label());
            });
        }
        ErrorsOr<Boolean> result = errors.isEmpty() ? ErrorsOr.lift(Boolean.TRUE) : ErrorsOr.errors(errors);
        return result.addPrefixIfError("Chain " + hierarchy.name() + ": ");
    }
}
