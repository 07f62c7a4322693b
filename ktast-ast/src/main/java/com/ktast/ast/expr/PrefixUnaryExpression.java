package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * 前缀一元运算：{@code -x}、{@code !flag}、{@code ++i}
 */
public final class PrefixUnaryExpression extends Expression {
    private final Keyword operator;
    private final Expression expression;

    public PrefixUnaryExpression(Keyword operator, Expression expression) {
        this.operator = Keyword.requireRole(required(operator, "operator"), Keyword.Role.PREFIX_OPERATOR, "operator");
        this.expression = required(expression, "expression");
    }

    public Keyword getOperator() {
        return operator;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{operator, expression};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitPrefixUnaryExpression(this, context);
    }
}
