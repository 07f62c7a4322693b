package com.ktast.ast.type;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.NameExpression;

import java.util.List;

/**
 * 命名类型：{@code kotlin.collections.List<String>}
 */
public final class SimpleType extends Type {
    private final List<Qualifier> qualifiers;
    private final NameExpression name;
    private final TypeArgs typeArgs;

    public SimpleType(List<Qualifier> qualifiers, NameExpression name, TypeArgs typeArgs) {
        this.qualifiers = listOf(qualifiers);
        this.name = required(name, "name");
        this.typeArgs = typeArgs;
    }

    public List<Qualifier> getQualifiers() {
        return qualifiers;
    }

    public NameExpression getName() {
        return name;
    }

    public TypeArgs getTypeArgs() {
        return typeArgs;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{qualifiers, name, typeArgs};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSimpleType(this, context);
    }

    /**
     * 限定名中的一段，如 {@code Outer<T>.Inner} 中的 {@code Outer<T>}
     */
    public static final class Qualifier extends Node {
        private final NameExpression name;
        private final TypeArgs typeArgs;

        public Qualifier(NameExpression name, TypeArgs typeArgs) {
            this.name = required(name, "name");
            this.typeArgs = typeArgs;
        }

        public NameExpression getName() {
            return name;
        }

        public TypeArgs getTypeArgs() {
            return typeArgs;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{name, typeArgs};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitSimpleTypeQualifier(this, context);
        }
    }
}
