package com.hcltech.lineage;

import com.hcltech.lineage.common.IEnvGetter;
import com.hcltech.lineage.common.errorsor.ErrorsOr;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide store of named hierarchies. Declaring code asks for its hierarchy by name, registers its nodes
 * and calls {@link #freezeAll()} (or {@link Hierarchy#freeze()}) once start-up is done.
 * <p>
 * A name is bound to one topology and one tag type for the life of the process; callers sharing a name must
 * agree on the type parameters.
 */
public final class NodeRegistry {
    // name -> hierarchy
    static final ConcurrentHashMap<String, Hierarchy<?, ?>> HIERARCHIES = new ConcurrentHashMap<>();

    private NodeRegistry() {}

    public static <T, P> Hierarchy<T, P> chain(String name, VersionTC<T> versionTC) {
        return chain(name, versionTC, LineageConfig.fromEnv(IEnvGetter.env));
    }

    public static <T, P> Hierarchy<T, P> chain(String name, VersionTC<T> versionTC, LineageConfig config) {
        return declare(name, Topology.CHAIN, versionTC, config, () -> Hierarchy.chain(name, versionTC, config));
    }

    public static <T, P> Hierarchy<T, P> tree(String name, TagTC<T> tagTC) {
        return tree(name, tagTC, LineageConfig.fromEnv(IEnvGetter.env));
    }

    public static <T, P> Hierarchy<T, P> tree(String name, TagTC<T> tagTC, LineageConfig config) {
        return declare(name, Topology.TREE, tagTC, config, () -> Hierarchy.tree(name, tagTC, config));
    }

    public static <T, P> ErrorsOr<Hierarchy<T, P>> lookup(String name) {
        Hierarchy<?, ?> h = HIERARCHIES.get(name);
        if (h == null) return ErrorsOr.error("No hierarchy named " + name + "; declared: " + names());
        Hierarchy<T, P> typed = cast(h);
        return ErrorsOr.lift(typed);
    }

    public static List<String> names() {
        return HIERARCHIES.keySet().stream().sorted().toList();
    }

    /** Ends the registration phase of every hierarchy declared so far. */
    public static void freezeAll() {
        HIERARCHIES.values().forEach(Hierarchy::freeze);
    }

    /** Forgets every hierarchy. For tests. */
    public static void clear() {
        HIERARCHIES.clear();
    }

    /** A repeated declaration must agree with the first on topology, tag typeclass and config. */
    private static <T, P> Hierarchy<T, P> declare(String name, Topology topology, TagTC<T> tagTC, LineageConfig config,
                                                  Supplier<Hierarchy<T, P>> creator) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Hierarchy name must not be blank");
        Hierarchy<?, ?> h = HIERARCHIES.computeIfAbsent(name, n -> creator.get());
        if (h.topology() != topology)
            throw new IllegalStateException("Hierarchy " + name + " is already declared as a " + h.topology()
                    + ", not a " + topology);
        if (h.tagTC().getClass() != tagTC.getClass())
            throw new IllegalStateException("Hierarchy " + name + " is already declared with "
                    + h.tagTC().getClass().getSimpleName() + ", not " + tagTC.getClass().getSimpleName());
        if (!h.config().equals(config))
            throw new IllegalStateException("Hierarchy " + name + " is already declared with " + h.config()
                    + ", not " + config);
        return cast(h);
    }

    // ---- single place for the unchecked cast ----
    @SuppressWarnings("unchecked")
    private static <T, P> Hierarchy<T, P> cast(Hierarchy<?, ?> h) {
        return (Hierarchy<T, P>) h;
    }
}
