package com.ktast.ast;

/**
 * 只读深度优先先序遍历
 *
 * <p>子节点顺序由各节点的槽位顺序决定，列表逐个展开，缺省字段跳过。
 * Writer 与 Dumper 继承本类并覆盖 {@link #visit(NodePath)}。</p>
 */
public class Visitor {

    private final NodeCallback callback;

    protected Visitor() {
        this(null);
    }

    protected Visitor(NodeCallback callback) {
        this.callback = callback;
    }

    public static void traverse(Node root, NodeCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback is required");
        }
        new Visitor(callback).visit(NodePath.rootPath(root));
    }

    /**
     * 访问一个节点：回调后依次访问子节点
     */
    protected void visit(NodePath path) {
        if (callback != null) {
            callback.onNode(path);
        }
        visitChildren(path);
    }

    protected final void visitChildren(NodePath path) {
        for (Node child : path.getNode().getChildren()) {
            visit(path.childPath(child));
        }
    }
}
