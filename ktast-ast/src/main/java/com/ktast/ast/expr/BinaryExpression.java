package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * 二元运算，包括赋值与成员访问（'.'、'?.'）
 */
public final class BinaryExpression extends Expression {
    private final Expression lhs;
    private final Keyword operator;
    private final Expression rhs;

    public BinaryExpression(Expression lhs, Keyword operator, Expression rhs) {
        this.lhs = required(lhs, "lhs");
        this.operator = Keyword.requireRole(required(operator, "operator"), Keyword.Role.BINARY_OPERATOR, "operator");
        this.rhs = required(rhs, "rhs");
    }

    public Expression getLhs() {
        return lhs;
    }

    public Keyword getOperator() {
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
        return visitor.visitBinaryExpression(this, context);
    }
}
