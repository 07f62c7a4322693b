package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.type.TypeRef;

import java.util.Map;

/**
 * super 表达式：{@code super}、{@code super<Base>}、{@code super@Outer}
 */
public final class SuperExpression extends Expression {
    private final TypeRef typeArgType;
    private final String label;

    public SuperExpression(TypeRef typeArgType, String label) {
        this.typeArgType = typeArgType;
        this.label = label;
    }

    public TypeRef getTypeArgType() {
        return typeArgType;
    }

    public String getLabel() {
        return label;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{typeArgType, label};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("label", label);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSuperExpression(this, context);
    }
}
