package com.ktast.ast.type;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;

/**
 * 类型实参：星投影 {@code *} 或具体类型（可带 {@code in}/{@code out}），二者恰好其一
 */
public final class TypeArg extends Node implements WithModifiers {
    private final Modifiers modifiers;
    private final Keyword asterisk;
    private final TypeRef typeRef;

    public TypeArg(Modifiers modifiers, Keyword asterisk, TypeRef typeRef) {
        this.modifiers = modifiers;
        this.asterisk = Keyword.requireType(asterisk, "asterisk", Keyword.Type.ASTERISK);
        this.typeRef = typeRef;
        check((asterisk == null) != (typeRef == null), "Type argument must have exactly one of asterisk and type");
        check(asterisk == null || modifiers == null, "Star projection cannot have modifiers");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Keyword getAsterisk() {
        return asterisk;
    }

    public TypeRef getTypeRef() {
        return typeRef;
    }

    public boolean isStarProjection() {
        return asterisk != null;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, asterisk, typeRef};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTypeArg(this, context);
    }
}
