package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * 后缀一元运算：{@code i++}、{@code x!!}
 */
public final class PostfixUnaryExpression extends Expression {
    private final Expression expression;
    private final Keyword operator;

    public PostfixUnaryExpression(Expression expression, Keyword operator) {
        this.expression = required(expression, "expression");
        this.operator = Keyword.requireRole(required(operator, "operator"), Keyword.Role.POSTFIX_OPERATOR, "operator");
    }

    public Expression getExpression() {
        return expression;
    }

    public Keyword getOperator() {
        return operator;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{expression, operator};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitPostfixUnaryExpression(this, context);
    }
}
