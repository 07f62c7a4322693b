package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

public final class ThrowExpression extends Expression {
    private final Expression expression;

    public ThrowExpression(Expression expression) {
        this.expression = required(expression, "expression");
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{expression};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitThrowExpression(this, context);
    }
}
