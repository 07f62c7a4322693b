package com.ktast.ast.decl;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.Expression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.modifier.PostModifier;
import com.ktast.ast.type.TypeRef;

import java.util.List;

/**
 * 函数声明；匿名函数表达式也以无名函数声明表示
 */
public final class FunctionDeclaration extends Declaration implements WithModifiers {
    private final Modifiers modifiers;
    private final Keyword funKeyword;
    private final TypeParams typeParams;
    private final TypeRef receiverTypeRef;
    private final NameExpression name;
    private final FunctionParams params;
    private final TypeRef returnTypeRef;
    private final List<PostModifier> postModifiers;
    private final Keyword equals;
    private final Expression body;

    public FunctionDeclaration(Modifiers modifiers, Keyword funKeyword, TypeParams typeParams,
                               TypeRef receiverTypeRef, NameExpression name, FunctionParams params,
                               TypeRef returnTypeRef, List<? extends PostModifier> postModifiers,
                               Keyword equals, Expression body) {
        this.modifiers = modifiers;
        this.funKeyword = Keyword.requireType(required(funKeyword, "funKeyword"), "funKeyword", Keyword.Type.FUN);
        this.typeParams = typeParams;
        this.receiverTypeRef = receiverTypeRef;
        this.name = name;
        this.params = required(params, "params");
        this.returnTypeRef = returnTypeRef;
        this.postModifiers = listOf(postModifiers);
        this.equals = Keyword.requireType(equals, "equals", Keyword.Type.EQUAL);
        this.body = body;
        check(equals == null || body != null, "Function with '=' must have an expression body");
        check(equals != null || body == null || body instanceof BlockExpression,
                "Function body without '=' must be a block");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Keyword getFunKeyword() {
        return funKeyword;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public TypeRef getReceiverTypeRef() {
        return receiverTypeRef;
    }

    public NameExpression getName() {
        return name;
    }

    public FunctionParams getParams() {
        return params;
    }

    public TypeRef getReturnTypeRef() {
        return returnTypeRef;
    }

    public List<PostModifier> getPostModifiers() {
        return postModifiers;
    }

    public Keyword getEquals() {
        return equals;
    }

    public Expression getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    /** 是否为 {@code = expr} 形式的表达式体 */
    public boolean hasExpressionBody() {
        return equals != null;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, funKeyword, typeParams, receiverTypeRef, name, params, returnTypeRef,
                postModifiers, equals, body};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDeclaration(this, context);
    }
}
