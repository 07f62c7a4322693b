package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

/**
 * return 表达式：{@code return@forEach x}
 */
public final class ReturnExpression extends Expression {
    private final String label;
    private final Expression expression;

    public ReturnExpression(String label, Expression expression) {
        this.label = label;
        this.expression = expression;
    }

    public String getLabel() {
        return label;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{label, expression};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("label", label);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitReturnExpression(this, context);
    }
}
