package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.decl.ClassDeclaration;

/**
 * 对象表达式：{@code object : Runnable { ... }}
 */
public final class ObjectLiteralExpression extends Expression {
    private final ClassDeclaration declaration;

    public ObjectLiteralExpression(ClassDeclaration declaration) {
        this.declaration = required(declaration, "declaration");
        check(declaration.isObject() && declaration.getName() == null, "Object literal must be an anonymous object");
    }

    public ClassDeclaration getDeclaration() {
        return declaration;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{declaration};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteralExpression(this, context);
    }
}
