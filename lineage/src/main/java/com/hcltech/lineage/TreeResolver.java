package com.hcltech.lineage;

import com.hcltech.lineage.exceptions.ModelNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Lookups over a {@link Topology#TREE} hierarchy, where specializations branch by model or variant.
 * <p>
 * The search is depth first, pre-order, children in declaration order. If two nodes answer to the same model
 * the first one met wins, so model identifiers should normally be unique.
 */
public final class TreeResolver {
    private static final Logger log = LoggerFactory.getLogger(TreeResolver.class);

    private TreeResolver() {}

    /**
     * The first node in the subtree of {@code root} whose tag or alias matches {@code model}.
     *
     * @throws ModelNotFoundException if none matches
     */
    public static <T, P> TypeNode<T, P> findModel(TypeNode<T, P> root, T model) {
        return findModel(root, model, Fallback.FAIL);
    }

    /** As {@link #findModel(TypeNode, Object)}, but with {@link Fallback#BASE} a miss returns {@code root}. */
    public static <T, P> TypeNode<T, P> findModel(TypeNode<T, P> root, T model, Fallback fallback) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(fallback, "fallback");
        Hierarchy<T, P> h = root.hierarchy();
        h.requireTopology(Topology.TREE, "findModel");
        h.checkReadable("findModel");
        String label = h.tagTC().label(model);

        Deque<TypeNode<T, P>> stack = new ArrayDeque<>();
        stack.push(root);
        int visited = 0;
        while (!stack.isEmpty()) {
            TypeNode<T, P> n = stack.pop();
            visited++;
            if (n.answersTo(model)) {
                log.debug("findModel({}) from {} -> {} after {} node(s)", label, root, n, visited);
                return n;
            }
            // reversed so the first declared child is popped first
            List<TypeNode<T, P>> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }

        if (fallback == Fallback.BASE) {
            log.debug("findModel({}) not found under {}; falling back to base", label, root);
            return root;
        }
        throw new ModelNotFoundException(h.name(), model, "Model " + label + " is not in hierarchy " + h.name()
                + " below " + root.label() + " (" + visited + " node(s) searched)");
    }
}
