package com.ktast.ast.type;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 函数类型：{@code Receiver.(A, b: B) -> R}
 */
public final class FunctionType extends Type {
    private final Receiver receiver;
    private final Params params;
    private final TypeRef returnTypeRef;

    public FunctionType(Receiver receiver, Params params, TypeRef returnTypeRef) {
        this.receiver = receiver;
        this.params = required(params, "params");
        this.returnTypeRef = required(returnTypeRef, "returnTypeRef");
    }

    public Receiver getReceiver() {
        return receiver;
    }

    public Params getParams() {
        return params;
    }

    public TypeRef getReturnTypeRef() {
        return returnTypeRef;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{receiver, params, returnTypeRef};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionType(this, context);
    }

    /** 接收者类型 */
    public static final class Receiver extends Node {
        private final TypeRef typeRef;

        public Receiver(TypeRef typeRef) {
            this.typeRef = required(typeRef, "typeRef");
        }

        public TypeRef getTypeRef() {
            return typeRef;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{typeRef};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitFunctionTypeReceiver(this, context);
        }
    }

    /** 括号内的参数类型列表 */
    public static final class Params extends Node {
        private final List<Param> elements;
        private final Keyword trailingComma;

        public Params(List<Param> elements, Keyword trailingComma) {
            this.elements = listOf(elements);
            this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
            check(trailingComma == null || !this.elements.isEmpty(), "Trailing comma requires an element");
        }

        public List<Param> getElements() {
            return elements;
        }

        public Keyword getTrailingComma() {
            return trailingComma;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{elements, trailingComma};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitFunctionTypeParams(this, context);
        }
    }

    /** 参数类型，可带名字：{@code name: Type} */
    public static final class Param extends Node {
        private final NameExpression name;
        private final TypeRef typeRef;

        public Param(NameExpression name, TypeRef typeRef) {
            this.name = name;
            this.typeRef = required(typeRef, "typeRef");
        }

        public NameExpression getName() {
            return name;
        }

        public TypeRef getTypeRef() {
            return typeRef;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{name, typeRef};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitFunctionTypeParam(this, context);
        }
    }
}
