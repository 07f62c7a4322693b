package com.ktast.ast.type;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 类型实参列表：{@code <A, *, out B>}
 */
public final class TypeArgs extends Node {
    private final List<TypeArg> elements;
    private final Keyword trailingComma;

    public TypeArgs(List<TypeArg> elements, Keyword trailingComma) {
        this.elements = listOf(elements);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        check(!this.elements.isEmpty(), "Type arguments must not be empty");
    }

    public List<TypeArg> getElements() {
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
        return visitor.visitTypeArgs(this, context);
    }
}
