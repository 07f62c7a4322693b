package com.ktast.ast;

/**
 * MutableVisitor 的变换钩子：返回 path 当前节点本身表示不变
 */
public interface NodeTransformer {

    NodeTransformer IDENTITY = new NodeTransformer() {
        @Override
        public Node transform(NodePath path) {
            return path.getNode();
        }
    };

    Node transform(NodePath path);
}
