package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

public final class ContinueExpression extends Expression {
    private final String label;

    public ContinueExpression(String label) {
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
        return visitor.visitContinueExpression(this, context);
    }
}
