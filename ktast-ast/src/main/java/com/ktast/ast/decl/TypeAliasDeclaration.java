package com.ktast.ast.decl;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.type.TypeRef;

/**
 * 类型别名：{@code typealias Handler<T> = (T) -> Unit}
 */
public final class TypeAliasDeclaration extends Declaration implements WithModifiers {
    private final Modifiers modifiers;
    private final NameExpression name;
    private final TypeParams typeParams;
    private final TypeRef typeRef;

    public TypeAliasDeclaration(Modifiers modifiers, NameExpression name, TypeParams typeParams, TypeRef typeRef) {
        this.modifiers = modifiers;
        this.name = required(name, "name");
        this.typeParams = typeParams;
        this.typeRef = required(typeRef, "typeRef");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public NameExpression getName() {
        return name;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public TypeRef getTypeRef() {
        return typeRef;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, name, typeParams, typeRef};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAliasDeclaration(this, context);
    }
}
