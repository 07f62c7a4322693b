package com.ktast.parser;

import com.ktast.ast.Node;
import com.ktast.ast.NodeExtrasMap;

/**
 * 解析结果：根节点和附加信息映射
 */
public final class Parsed<T extends Node> {
    private final T root;
    private final NodeExtrasMap extrasMap;

    public Parsed(T root, NodeExtrasMap extrasMap) {
        this.root = root;
        this.extrasMap = extrasMap;
    }

    public T getRoot() {
        return root;
    }

    public NodeExtrasMap getExtrasMap() {
        return extrasMap;
    }
}
