package com.hcltech.lineage;

import com.hcltech.lineage.exceptions.AmbiguousChainException;
import com.hcltech.lineage.exceptions.NoPreviousVersionException;
import com.hcltech.lineage.exceptions.VersionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Lookups over a {@link Topology#CHAIN} hierarchy, where each node is the next version of its parent.
 * <p>
 * All methods are pure reads of the registered nodes: the same chain and query always give the same node.
 */
public final class ChainResolver {
    private static final Logger log = LoggerFactory.getLogger(ChainResolver.class);

    private ChainResolver() {}

    /**
     * The newest version not newer than {@code version}, searching downwards from {@code root}.
     * A query newer than every known version gets the newest one.
     *
     * @throws VersionNotFoundException if {@code root} itself is newer than {@code version}
     * @throws AmbiguousChainException  if the walk meets a node with more than one child
     */
    public static <T, P> TypeNode<T, P> findVersion(TypeNode<T, P> root, T version) {
        return findVersion(root, version, Fallback.FAIL);
    }

    /** As {@link #findVersion(TypeNode, Object)}, but with {@link Fallback#BASE} a too-old query gets {@code root}. */
    public static <T, P> TypeNode<T, P> findVersion(TypeNode<T, P> root, T version, Fallback fallback) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(fallback, "fallback");
        Hierarchy<T, P> h = chainOf(root, "findVersion");
        VersionTC<T> tc = h.versionTC();

        if (!tc.notNewerThan(root.tag(), version)) {
            if (fallback == Fallback.BASE) {
                log.debug("findVersion({}) older than {}; falling back to base", tc.label(version), root);
                return root;
            }
            throw new VersionNotFoundException(h.name(), version, "Version " + tc.label(version)
                    + " is older than " + root.label() + ", the first version of chain " + h.name()
                    + " searched from " + root);
        }

        TypeNode<T, P> current = root;
        TypeNode<T, P> next = onlyChild(h, current);
        while (next != null && tc.notNewerThan(next.tag(), version)) {
            current = next;
            next = onlyChild(h, current);
        }
        log.debug("findVersion({}) from {} -> {}", tc.label(version), root, current);
        return current;
    }

    /**
     * The node whose version equals {@code version}.
     *
     * @throws VersionNotFoundException if no node below (or at) {@code root} has that version
     */
    public static <T, P> TypeNode<T, P> findExactVersion(TypeNode<T, P> root, T version) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(version, "version");
        Hierarchy<T, P> h = chainOf(root, "findExactVersion");
        VersionTC<T> tc = h.versionTC();

        TypeNode<T, P> last = root;
        for (TypeNode<T, P> n = root; n != null; n = onlyChild(h, n)) {
            int c = tc.compare(n.tag(), version);
            if (c == 0) {
                log.debug("findExactVersion({}) from {} -> {}", tc.label(version), root, n);
                return n;
            }
            if (c > 0) break; // versions only increase from here
            last = n;
        }
        throw new VersionNotFoundException(h.name(), version, "Version " + tc.label(version)
                + " is not in chain " + h.name() + " (searched from " + root + ", stopped at " + last + ")");
    }

    /** The deepest node below {@code root}. */
    public static <T, P> TypeNode<T, P> latestVersion(TypeNode<T, P> root) {
        Objects.requireNonNull(root, "root");
        Hierarchy<T, P> h = chainOf(root, "latestVersion");
        TypeNode<T, P> current = root;
        for (TypeNode<T, P> next = onlyChild(h, current); next != null; next = onlyChild(h, current)) {
            current = next;
        }
        return current;
    }

    /**
     * The version {@code node} was derived from.
     *
     * @throws NoPreviousVersionException if {@code node} is the root
     */
    public static <T, P> TypeNode<T, P> findPreviousVersion(TypeNode<T, P> node) {
        Objects.requireNonNull(node, "node");
        Hierarchy<T, P> h = chainOf(node, "findPreviousVersion");
        return node.parent().orElseThrow(() -> new NoPreviousVersionException(h.name(), node.tag(),
                node.label() + " is the first version of chain " + h.name()));
    }

    /**
     * The nearest strict ancestor of {@code node} whose version equals {@code version}, for rolling an interface
     * back to an older revision.
     *
     * @throws NoPreviousVersionException if the top of the chain is reached without a match
     */
    public static <T, P> TypeNode<T, P> findPreviousVersion(TypeNode<T, P> node, T version) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(version, "version");
        Hierarchy<T, P> h = chainOf(node, "findPreviousVersion");
        VersionTC<T> tc = h.versionTC();

        for (TypeNode<T, P> p = node.parent().orElse(null); p != null; p = p.parent().orElse(null)) {
            int c = tc.compare(p.tag(), version);
            if (c == 0) {
                log.debug("findPreviousVersion({}) from {} -> {}", tc.label(version), node, p);
                return p;
            }
            if (c < 0) break; // already older than the one we want
        }
        throw new NoPreviousVersionException(h.name(), version, "No version " + tc.label(version)
                + " above " + node.label() + " in chain " + h.name());
    }

    private static <T, P> Hierarchy<T, P> chainOf(TypeNode<T, P> node, String operation) {
        Hierarchy<T, P> h = node.hierarchy();
        h.requireTopology(Topology.CHAIN, operation);
        h.checkReadable(operation);
        return h;
    }

    private static <T, P> TypeNode<T, P> onlyChild(Hierarchy<T, P> h, TypeNode<T, P> node) {
        List<TypeNode<T, P>> children = node.children();
        return switch (children.size()) {
            case 0 -> null;
            case 1 -> children.get(0);
            default -> throw new AmbiguousChainException(h.name(), node.label(),
                    children.stream().map(TypeNode::label).toList());
        };
    }
}
