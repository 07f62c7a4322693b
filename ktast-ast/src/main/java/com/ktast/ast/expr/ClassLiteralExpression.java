package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

/**
 * 类字面量：{@code String::class}
 */
public final class ClassLiteralExpression extends Expression {
    private final Expression receiver;

    public ClassLiteralExpression(Expression receiver) {
        this.receiver = required(receiver, "receiver");
    }

    public Expression getReceiver() {
        return receiver;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{receiver};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitClassLiteralExpression(this, context);
    }
}
