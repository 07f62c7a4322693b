package com.ktast.ast.type;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;

/**
 * 类型引用：出现在类型位置的类型，可带类型修饰符（如 {@code suspend}、注解）或一层括号
 */
public final class TypeRef extends Node implements WithModifiers {
    private final Keyword lPar;
    private final Modifiers modifiers;
    private final Type type;
    private final Keyword rPar;

    public TypeRef(Keyword lPar, Modifiers modifiers, Type type, Keyword rPar) {
        this.lPar = Keyword.requireType(lPar, "lPar", Keyword.Type.LPAR);
        this.modifiers = modifiers;
        this.type = required(type, "type");
        this.rPar = Keyword.requireType(rPar, "rPar", Keyword.Type.RPAR);
        check((lPar == null) == (rPar == null), "Type parentheses must be both present or both absent");
    }

    public TypeRef(Type type) {
        this(null, null, type, null);
    }

    public Keyword getLPar() {
        return lPar;
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Type getType() {
        return type;
    }

    public Keyword getRPar() {
        return rPar;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{lPar, modifiers, type, rPar};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTypeRef(this, context);
    }
}
