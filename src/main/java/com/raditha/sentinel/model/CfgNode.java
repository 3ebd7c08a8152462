package com.raditha.sentinel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of a function's control-flow graph.
 * <p>
 * Nodes compare by identity. Successor edges are wired by {@link ModelBuilder} and the node is
 * read-only once the owning model has been built.
 */
public final class CfgNode {

    private final int id;
    private final NodeKind kind;
    private final List<IrOperation> operations;
    private final List<CfgNode> children = new ArrayList<>();
    private boolean frozen;

    CfgNode(int id, NodeKind kind, List<IrOperation> operations) {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        this.id = id;
        this.kind = kind;
        this.operations = List.copyOf(operations);
    }

    /**
     * Identity of the node within its function.
     */
    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Successor nodes in the order the analyzer reported them.
     */
    public List<CfgNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * IR operations in evaluation order.
     */
    public List<IrOperation> operations() {
        return operations;
    }

    public Optional<IrOperation> firstOperation() {
        return operations.isEmpty() ? Optional.empty() : Optional.of(operations.get(0));
    }

    void addChild(CfgNode child) {
        if (frozen) {
            throw new IllegalStateException("Node " + id + " is already part of a built model");
        }
        children.add(child);
    }

    void freeze() {
        frozen = true;
    }

    @Override
    public String toString() {
        return "Node " + id + " (" + kind + ", " + operations.size() + " ops, " + children.size() + " children)";
    }
}
