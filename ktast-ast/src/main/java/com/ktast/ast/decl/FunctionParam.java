package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.Expression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.type.TypeRef;

/**
 * 形参：{@code vararg val items: String = ""}
 */
public final class FunctionParam extends Node implements WithModifiers {
    private final Modifiers modifiers;
    private final Keyword valOrVarKeyword;
    private final NameExpression name;
    private final TypeRef typeRef;
    private final Keyword equals;
    private final Expression defaultValue;

    public FunctionParam(Modifiers modifiers, Keyword valOrVarKeyword, NameExpression name, TypeRef typeRef,
                         Keyword equals, Expression defaultValue) {
        this.modifiers = modifiers;
        this.valOrVarKeyword = Keyword.requireRole(valOrVarKeyword, Keyword.Role.VAL_OR_VAR, "valOrVarKeyword");
        this.name = required(name, "name");
        this.typeRef = typeRef;
        this.equals = Keyword.requireType(equals, "equals", Keyword.Type.EQUAL);
        this.defaultValue = defaultValue;
        check((equals == null) == (defaultValue == null), "Default value and '=' must be both present or both absent");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Keyword getValOrVarKeyword() {
        return valOrVarKeyword;
    }

    public NameExpression getName() {
        return name;
    }

    public TypeRef getTypeRef() {
        return typeRef;
    }

    public Keyword getEquals() {
        return equals;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, valOrVarKeyword, name, typeRef, equals, defaultValue};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionParam(this, context);
    }
}
