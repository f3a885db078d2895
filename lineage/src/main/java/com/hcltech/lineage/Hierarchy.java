package com.hcltech.lineage;

import com.hcltech.lineage.exceptions.DuplicateRootException;
import com.hcltech.lineage.exceptions.NonLinearChainException;
import com.hcltech.lineage.exceptions.VersionOrderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One logical hierarchy of specializations: a single root and the nodes registered under it.
 * <p>
 * Nodes are kept in an append-only table in registration order; {@link TypeNode#id()} is the index into it.
 * The hierarchy is open for registration until {@link #freeze()}; afterwards it is immutable and may be read
 * from any number of threads. Registration itself is expected to happen on one thread during start-up.
 */
public final class Hierarchy<T, P> {
    private static final Logger log = LoggerFactory.getLogger(Hierarchy.class);

    private final String name;
    private final Topology topology;
    private final TagTC<T> tagTC;
    private final VersionTC<T> versionTC;
    private final LineageConfig config;

    private final List<TypeNode<T, P>> nodes = new ArrayList<>();
    private TypeNode<T, P> root;
    private volatile boolean frozen;

    private Hierarchy(String name, Topology topology, TagTC<T> tagTC, VersionTC<T> versionTC, LineageConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.topology = topology;
        this.tagTC = Objects.requireNonNull(tagTC, "tagTC");
        this.versionTC = versionTC;
        this.config = Objects.requireNonNull(config, "config");
    }

    public static <T, P> Hierarchy<T, P> chain(String name, VersionTC<T> versionTC) {
        return chain(name, versionTC, LineageConfig.defaults());
    }

    public static <T, P> Hierarchy<T, P> chain(String name, VersionTC<T> versionTC, LineageConfig config) {
        return new Hierarchy<>(name, Topology.CHAIN, versionTC, versionTC, config);
    }

    public static <T, P> Hierarchy<T, P> tree(String name, TagTC<T> tagTC) {
        return tree(name, tagTC, LineageConfig.defaults());
    }

    public static <T, P> Hierarchy<T, P> tree(String name, TagTC<T> tagTC, LineageConfig config) {
        return new Hierarchy<>(name, Topology.TREE, tagTC, null, config);
    }

    /** Registers a node under {@code parent}, or the root when {@code parent} is null. */
    public TypeNode<T, P> register(T tag, TypeNode<T, P> parent, P payload) {
        return register(tag, parent, payload, List.of());
    }

    /**
     * Registers a node that also answers to {@code aliases} in tree lookups.
     *
     * @throws DuplicateRootException  if {@code parent} is null and the root already exists
     * @throws NonLinearChainException  if this is a chain, validation is eager and {@code parent} has a child
     * @throws VersionOrderException    if this is a chain and {@code tag} is not newer than the parent's tag
     * @throws IllegalArgumentException if {@code parent} belongs to another hierarchy, or aliases are given
     *                                  for a chain
     * @throws IllegalStateException    if the hierarchy is frozen
     */
    public synchronized TypeNode<T, P> register(T tag, TypeNode<T, P> parent, P payload, Collection<? extends T> aliases) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(aliases, "aliases");
        String label = tagTC.label(tag);
        if (frozen)
            throw new IllegalStateException("Hierarchy " + name + " is frozen; cannot register " + label);
        if (topology == Topology.CHAIN && !aliases.isEmpty())
            throw new IllegalArgumentException("Chain " + name + " does not support aliases (registering " + label + ")");

        if (parent == null) {
            if (root != null) throw new DuplicateRootException(name, root.label(), label);
        } else {
            if (parent.hierarchy() != this)
                throw new IllegalArgumentException("Parent " + parent + " does not belong to hierarchy " + name);
            if (topology == Topology.CHAIN) checkChainLink(parent, tag, label);
        }

        var node = new TypeNode<T, P>(this, nodes.size(), tag, List.copyOf(aliases), parent, payload);
        nodes.add(node);
        if (parent == null) root = node;
        else parent.addChild(node);
        log.debug("Registered {} under {}", node, parent == null ? "<root>" : parent);
        return node;
    }

    private void checkChainLink(TypeNode<T, P> parent, T tag, String label) {
        if (!parent.children().isEmpty()) {
            if (config.chainValidation() == LineageConfig.ChainValidationMode.EAGER)
                throw new NonLinearChainException(name, parent.label(), parent.children().get(0).label(), label);
            log.debug("Chain {}: {} gets a second child {}; left to the resolver", name, parent, label);
        }
        if (versionTC.compare(tag, parent.tag()) <= 0)
            throw new VersionOrderException(name, parent.label(), label);
    }

    /**
     * Ends the registration phase. Idempotent. Chain defects left by deferred validation are logged, not thrown,
     * since only lookups that walk through them are affected.
     */
    public synchronized void freeze() {
        if (frozen) return;
        if (topology == Topology.CHAIN) {
            ChainValidation.validate(this).ifError(errors -> errors.forEach(e -> log.warn("{}", e)));
        }
        frozen = true;
        log.info("Froze {} hierarchy {} with {} node(s)", topology, name, nodes.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Called by the resolvers before walking; the volatile read pairs with the write in {@link #freeze()}. */
    void checkReadable(String operation) {
        if (!frozen && config.strictLifecycle())
            throw new IllegalStateException(operation + " on hierarchy " + name + " before it was frozen");
    }

    void requireTopology(Topology expected, String operation) {
        if (topology != expected)
            throw new IllegalArgumentException(operation + " needs a " + expected + " hierarchy but " + name
                    + " is a " + topology);
    }

    public String name() {
        return name;
    }

    public Topology topology() {
        return topology;
    }

    public TagTC<T> tagTC() {
        return tagTC;
    }

    /** The ordering of a chain; {@code null} for a tree. */
    public VersionTC<T> versionTC() {
        return versionTC;
    }

    public LineageConfig config() {
        return config;
    }

    public synchronized Optional<TypeNode<T, P>> root() {
        return Optional.ofNullable(root);
    }

    public synchronized TypeNode<T, P> node(int id) {
        if (id < 0 || id >= nodes.size())
            throw new IllegalArgumentException("No node " + id + " in hierarchy " + name + " (size " + nodes.size() + ")");
        return nodes.get(id);
    }

    /** Snapshot in registration order. */
    public synchronized List<TypeNode<T, P>> nodes() {
        return List.copyOf(nodes);
    }

    public synchronized int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return "Hierarchy(" + name + ", " + topology + ", " + size() + " nodes" + (frozen ? ", frozen" : "") + ")";
    }
}
