package com.ktast.ast;

/**
 * 只读遍历回调
 */
public interface NodeCallback {
    void onNode(NodePath path);
}
