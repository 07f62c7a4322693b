package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 括号内的实参列表
 */
public final class ValueArgs extends Node {
    private final List<ValueArg> elements;
    private final Keyword trailingComma;

    public ValueArgs(List<ValueArg> elements, Keyword trailingComma) {
        this.elements = listOf(elements);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        check(trailingComma == null || !this.elements.isEmpty(), "Trailing comma requires an element");
    }

    public List<ValueArg> getElements() {
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
        return visitor.visitValueArgs(this, context);
    }
}
