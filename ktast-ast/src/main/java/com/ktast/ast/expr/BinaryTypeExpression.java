package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.type.TypeRef;

/**
 * 类型运算：{@code x as T}、{@code x as? T}、{@code x is T}、{@code x !is T}
 */
public final class BinaryTypeExpression extends Expression {
    private final Expression lhs;
    private final Keyword operator;
    private final TypeRef rhs;

    public BinaryTypeExpression(Expression lhs, Keyword operator, TypeRef rhs) {
        this.lhs = required(lhs, "lhs");
        this.operator = Keyword.requireRole(required(operator, "operator"), Keyword.Role.TYPE_OPERATOR, "operator");
        this.rhs = required(rhs, "rhs");
    }

    public Expression getLhs() {
        return lhs;
    }

    public Keyword getOperator() {
        return operator;
    }

    public TypeRef getRhs() {
        return rhs;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{lhs, operator, rhs};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryTypeExpression(this, context);
    }
}
