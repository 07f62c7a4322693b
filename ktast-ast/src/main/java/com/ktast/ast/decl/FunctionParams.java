package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 括号内的形参列表
 */
public final class FunctionParams extends Node {
    private final List<FunctionParam> elements;
    private final Keyword trailingComma;

    public FunctionParams(List<FunctionParam> elements, Keyword trailingComma) {
        this.elements = listOf(elements);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        check(trailingComma == null || !this.elements.isEmpty(), "Trailing comma requires an element");
    }

    public List<FunctionParam> getElements() {
        return elements;
    }

    public Keyword getTrailingComma() {
        return trailingComma;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{elements, trailingComma};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionParams(this, context);
    }
}
