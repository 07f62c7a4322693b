package com.ktast.ast.modifier;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;

import java.util.List;

/**
 * 注解集：{@code @Foo}、{@code @file:Foo}、{@code @[Foo Bar]}
 */
public final class AnnotationSet extends Node implements Modifier {
    private final Keyword atSymbol;
    private final Keyword target;
    private final Keyword colon;
    private final Keyword lBracket;
    private final List<Annotation> annotations;
    private final Keyword rBracket;

    public AnnotationSet(Keyword atSymbol, Keyword target, Keyword colon, Keyword lBracket,
                         List<Annotation> annotations, Keyword rBracket) {
        this.atSymbol = Keyword.requireType(required(atSymbol, "atSymbol"), "atSymbol", Keyword.Type.AT);
        this.target = Keyword.requireRole(target, Keyword.Role.ANNOTATION_TARGET, "target");
        this.colon = Keyword.requireType(colon, "colon", Keyword.Type.COLON);
        this.lBracket = Keyword.requireType(lBracket, "lBracket", Keyword.Type.LBRACKET);
        this.annotations = listOf(annotations);
        this.rBracket = Keyword.requireType(rBracket, "rBracket", Keyword.Type.RBRACKET);
        check((target == null) == (colon == null), "Annotation target and colon must be both present or both absent");
        check((lBracket == null) == (rBracket == null), "Annotation brackets must be both present or both absent");
        check(!this.annotations.isEmpty(), "Annotation set must contain at least one annotation");
        check(lBracket != null || this.annotations.size() == 1,
                "Annotation set without brackets must contain exactly one annotation");
    }

    public Keyword getAtSymbol() {
        return atSymbol;
    }

    public Keyword getTarget() {
        return target;
    }

    public Keyword getColon() {
        return colon;
    }

    public Keyword getLBracket() {
        return lBracket;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public Keyword getRBracket() {
        return rBracket;
    }

    public boolean isBracketed() {
        return lBracket != null;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{atSymbol, target, colon, lBracket, annotations, rBracket};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAnnotationSet(this, context);
    }
}
