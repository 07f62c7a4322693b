package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 类型形参列表：{@code <T, reified U : Any>}
 */
public final class TypeParams extends Node {
    private final List<TypeParam> elements;
    private final Keyword trailingComma;

    public TypeParams(List<TypeParam> elements, Keyword trailingComma) {
        this.elements = listOf(elements);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        check(!this.elements.isEmpty(), "Type parameters must not be empty");
    }

    public List<TypeParam> getElements() {
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
        return visitor.visitTypeParams(this, context);
    }
}
