package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.type.TypeRef;

/**
 * 单个绑定：名字加可选类型
 */
public final class Variable extends Node implements WithModifiers {
    private final Modifiers modifiers;
    private final NameExpression name;
    private final TypeRef typeRef;

    public Variable(Modifiers modifiers, NameExpression name, TypeRef typeRef) {
        this.modifiers = modifiers;
        this.name = required(name, "name");
        this.typeRef = typeRef;
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public NameExpression getName() {
        return name;
    }

    public TypeRef getTypeRef() {
        return typeRef;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, name, typeRef};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
