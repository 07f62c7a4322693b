package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

/**
 * 带标签的表达式：{@code loop@ for (...) ...}
 */
public final class LabeledExpression extends Expression {
    private final String label;
    private final Expression expression;

    public LabeledExpression(String label, Expression expression) {
        this.label = required(label, "label");
        this.expression = required(expression, "expression");
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
        return visitor.visitLabeledExpression(this, context);
    }
}
