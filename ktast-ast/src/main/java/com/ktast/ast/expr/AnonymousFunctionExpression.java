package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.decl.FunctionDeclaration;

/**
 * 匿名函数：{@code fun(x: Int): Int = x * 2}
 */
public final class AnonymousFunctionExpression extends Expression {
    private final FunctionDeclaration function;

    public AnonymousFunctionExpression(FunctionDeclaration function) {
        this.function = required(function, "function");
        check(function.getName() == null, "Anonymous function must not have a name");
    }

    public FunctionDeclaration getFunction() {
        return function;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{function};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAnonymousFunctionExpression(this, context);
    }
}
