package com.hcltech.lineage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One declared specialization. Created only by {@link Hierarchy#register}; identity is the node reference
 * itself, and {@link #id()} is its stable index in the owning hierarchy.
 */
public final class TypeNode<T, P> {
    private final Hierarchy<T, P> hierarchy;
    private final int id;
    private final T tag;
    private final List<T> aliases;
    private final TypeNode<T, P> parent;
    private final int depth;
    private final P payload;
    private final List<TypeNode<T, P>> children = new ArrayList<>();
    private final List<TypeNode<T, P>> childrenView = Collections.unmodifiableList(children);

    TypeNode(Hierarchy<T, P> hierarchy, int id, T tag, List<T> aliases, TypeNode<T, P> parent, P payload) {
        this.hierarchy = hierarchy;
        this.id = id;
        this.tag = tag;
        this.aliases = List.copyOf(aliases);
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.payload = payload;
    }

    void addChild(TypeNode<T, P> child) {
        children.add(child);
    }

    public Hierarchy<T, P> hierarchy() {
        return hierarchy;
    }

    public int id() {
        return id;
    }

    public T tag() {
        return tag;
    }

    /** Further tags this node answers to in a tree lookup. */
    public List<T> aliases() {
        return aliases;
    }

    public Optional<TypeNode<T, P>> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Read-only, in declaration order. */
    public List<TypeNode<T, P>> children() {
        return childrenView;
    }

    public int depth() {
        return depth;
    }

    public P payload() {
        return payload;
    }

    /** True if {@code query} matches the tag or one of the aliases. */
    public boolean answersTo(T query) {
        TagTC<T> tc = hierarchy.tagTC();
        if (tc.same(tag, query)) return true;
        for (T alias : aliases) {
            if (tc.same(alias, query)) return true;
        }
        return false;
    }

    public String label() {
        return hierarchy.tagTC().label(tag);
    }

    @Override
    public String toString() {
        return hierarchy.name() + ":" + label() + "#" + id;
    }
}
