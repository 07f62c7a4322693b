package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

/**
 * 可调用引用：{@code String::length}、{@code ::println}
 */
public final class CallableReferenceExpression extends Expression {
    private final Expression receiver;
    private final NameExpression name;

    public CallableReferenceExpression(Expression receiver, NameExpression name) {
        this.receiver = receiver;
        this.name = required(name, "name");
    }

    public Expression getReceiver() {
        return receiver;
    }

    public NameExpression getName() {
        return name;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{receiver, name};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitCallableReferenceExpression(this, context);
    }
}
