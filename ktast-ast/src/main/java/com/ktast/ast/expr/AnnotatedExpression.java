package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.AnnotationSet;

import java.util.List;

/**
 * 带注解的表达式：{@code @Suppress("UNCHECKED_CAST") x as T}
 */
public final class AnnotatedExpression extends Expression {
    private final List<AnnotationSet> annotationSets;
    private final Expression expression;

    public AnnotatedExpression(List<AnnotationSet> annotationSets, Expression expression) {
        this.annotationSets = listOf(annotationSets);
        this.expression = required(expression, "expression");
        check(!this.annotationSets.isEmpty(), "Annotated expression requires at least one annotation set");
    }

    public List<AnnotationSet> getAnnotationSets() {
        return annotationSets;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{annotationSets, expression};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAnnotatedExpression(this, context);
    }
}
