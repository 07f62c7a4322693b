package com.ktast.ast.modifier;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * 修饰符列表：关键词修饰符与注解集按源码顺序混排
 */
public final class Modifiers extends Node {
    private final List<Modifier> elements;

    public Modifiers(List<? extends Modifier> elements) {
        this.elements = listOf(elements);
        check(!this.elements.isEmpty(), "Modifiers must not be empty");
        for (Modifier m : this.elements) {
            if (m instanceof Keyword) {
                Keyword.requireRole((Keyword) m, Keyword.Role.MODIFIER, "modifier");
            } else if (!(m instanceof AnnotationSet)) {
                throw new IllegalArgumentException("Unknown modifier: " + m);
            }
        }
    }

    public List<Modifier> getElements() {
        return elements;
    }

    public List<AnnotationSet> getAnnotationSets() {
        List<AnnotationSet> result = new ArrayList<AnnotationSet>();
        for (Modifier m : elements) {
            if (m instanceof AnnotationSet) result.add((AnnotationSet) m);
        }
        return result;
    }

    public List<Keyword> getKeywords() {
        List<Keyword> result = new ArrayList<Keyword>();
        for (Modifier m : elements) {
            if (m instanceof Keyword) result.add((Keyword) m);
        }
        return result;
    }

    /** 是否包含给定关键词修饰符 */
    public boolean has(Keyword.Type type) {
        for (Modifier m : elements) {
            if (m instanceof Keyword && ((Keyword) m).is(type)) return true;
        }
        return false;
    }

    /** 空安全版本：modifiers 可能为 null */
    public static boolean has(Modifiers modifiers, Keyword.Type type) {
        return modifiers != null && modifiers.has(type);
    }

    @Override
    protected Object[] slots() {
        return new Object[]{elements};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitModifiers(this, context);
    }
}
