package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

/**
 * 中缀函数调用：{@code a shl 2}
 */
public final class BinaryInfixExpression extends Expression {
    private final Expression lhs;
    private final NameExpression operator;
    private final Expression rhs;

    public BinaryInfixExpression(Expression lhs, NameExpression operator, Expression rhs) {
        this.lhs = required(lhs, "lhs");
        this.operator = required(operator, "operator");
        this.rhs = required(rhs, "rhs");
    }

    public Expression getLhs() {
        return lhs;
    }

    public NameExpression getOperator() {
        return operator;
    }

    public Expression getRhs() {
        return rhs;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{lhs, operator, rhs};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryInfixExpression(this, context);
    }
}
