package com.ktast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 遍历路径：当前节点及其到根节点的父链
 */
public final class NodePath {
    private final Node node;
    private final NodePath parent;
    private final int depth;

    private NodePath(Node node, NodePath parent) {
        if (node == null) {
            throw new IllegalArgumentException("node is required");
        }
        this.node = node;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public static NodePath rootPath(Node root) {
        return new NodePath(root, null);
    }

    public NodePath childPath(Node child) {
        return new NodePath(child, this);
    }

    public Node getNode() {
        return node;
    }

    public NodePath getParent() {
        return parent;
    }

    public Node getParentNode() {
        return parent == null ? null : parent.node;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * 祖先节点，由近及远
     */
    public List<Node> ancestors() {
        List<Node> result = new ArrayList<Node>();
        for (NodePath p = parent; p != null; p = p.parent) {
            result.add(p.node);
        }
        return result;
    }

    /**
     * 最近的给定类型祖先，没有则返回 null
     */
    public <T extends Node> T findAncestor(Class<T> type) {
        for (NodePath p = parent; p != null; p = p.parent) {
            if (type.isInstance(p.node)) {
                return type.cast(p.node);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return parent == null ? node.getKindName() : parent + " > " + node.getKindName();
    }
}
