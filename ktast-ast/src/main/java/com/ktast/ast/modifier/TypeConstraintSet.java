package com.ktast.ast.modifier;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.type.TypeRef;

import java.util.List;

/**
 * 类型约束子句：{@code where T : A, U : B}
 */
public final class TypeConstraintSet extends Node implements PostModifier {
    private final Keyword whereKeyword;
    private final TypeConstraints constraints;

    public TypeConstraintSet(Keyword whereKeyword, TypeConstraints constraints) {
        this.whereKeyword = Keyword.requireType(required(whereKeyword, "whereKeyword"), "whereKeyword",
                Keyword.Type.WHERE);
        this.constraints = required(constraints, "constraints");
    }

    public Keyword getWhereKeyword() {
        return whereKeyword;
    }

    public TypeConstraints getConstraints() {
        return constraints;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{whereKeyword, constraints};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTypeConstraintSet(this, context);
    }

    /**
     * 逗号分隔的约束列表
     */
    public static final class TypeConstraints extends Node {
        private final List<TypeConstraint> elements;

        public TypeConstraints(List<TypeConstraint> elements) {
            this.elements = listOf(elements);
            check(!this.elements.isEmpty(), "Type constraints must not be empty");
        }

        public List<TypeConstraint> getElements() {
            return elements;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{elements};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitTypeConstraints(this, context);
        }
    }

    /**
     * 单条约束：{@code T : Comparable<T>}
     */
    public static final class TypeConstraint extends Node {
        private final List<AnnotationSet> annotationSets;
        private final NameExpression name;
        private final TypeRef typeRef;

        public TypeConstraint(List<AnnotationSet> annotationSets, NameExpression name, TypeRef typeRef) {
            this.annotationSets = listOf(annotationSets);
            this.name = required(name, "name");
            this.typeRef = required(typeRef, "typeRef");
        }

        public List<AnnotationSet> getAnnotationSets() {
            return annotationSets;
        }

        public NameExpression getName() {
            return name;
        }

        public TypeRef getTypeRef() {
            return typeRef;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{annotationSets, name, typeRef};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitTypeConstraint(this, context);
        }
    }
}
