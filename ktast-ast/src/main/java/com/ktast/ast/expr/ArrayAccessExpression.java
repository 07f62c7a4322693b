package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 下标访问：{@code a[i, j]}
 */
public final class ArrayAccessExpression extends Expression {
    private final Expression expression;
    private final List<Expression> indices;
    private final Keyword trailingComma;

    public ArrayAccessExpression(Expression expression, List<? extends Expression> indices, Keyword trailingComma) {
        this.expression = required(expression, "expression");
        this.indices = listOf(indices);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        check(!this.indices.isEmpty(), "Array access requires at least one index");
    }

    public Expression getExpression() {
        return expression;
    }

    public List<Expression> getIndices() {
        return indices;
    }

    public Keyword getTrailingComma() {
        return trailingComma;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{expression, indices, trailingComma};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitArrayAccessExpression(this, context);
    }
}
