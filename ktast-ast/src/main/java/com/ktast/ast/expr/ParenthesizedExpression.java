package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

/**
 * 括号表达式
 */
public final class ParenthesizedExpression extends Expression {
    private final Expression expression;

    public ParenthesizedExpression(Expression expression) {
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
        return visitor.visitParenthesizedExpression(this, context);
    }
}
