package com.hcltech.lineage;

/** Shape a hierarchy is declared with; decides which resolver may walk it. */
public enum Topology {
    /** At most one child per node, tags strictly increasing downwards. */
    CHAIN,
    /** Unrestricted branching, tags compared for equality only. */
    TREE
}
