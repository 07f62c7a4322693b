package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

/**
 * this 表达式，可带标签：{@code this@Outer}
 */
public final class ThisExpression extends Expression {
    private final String label;

    public ThisExpression(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{label};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("label", label);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitThisExpression(this, context);
    }
}
