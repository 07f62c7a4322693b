package com.ktast.ast.type;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;

/**
 * 可空类型：{@code String?}、{@code (suspend () -> Unit)?}
 */
public final class NullableType extends Type implements WithModifiers {
    private final Keyword lPar;
    private final Modifiers modifiers;
    private final Type innerType;
    private final Keyword rPar;

    public NullableType(Keyword lPar, Modifiers modifiers, Type innerType, Keyword rPar) {
        this.lPar = Keyword.requireType(lPar, "lPar", Keyword.Type.LPAR);
        this.modifiers = modifiers;
        this.innerType = required(innerType, "innerType");
        this.rPar = Keyword.requireType(rPar, "rPar", Keyword.Type.RPAR);
        check((lPar == null) == (rPar == null), "Nullable type parentheses must be both present or both absent");
        check(modifiers == null || lPar != null, "Modifiers of a nullable type require parentheses");
    }

    public NullableType(Type innerType) {
        this(null, null, innerType, null);
    }

    public Keyword getLPar() {
        return lPar;
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Type getInnerType() {
        return innerType;
    }

    public Keyword getRPar() {
        return rPar;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{lPar, modifiers, innerType, rPar};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitNullableType(this, context);
    }
}
