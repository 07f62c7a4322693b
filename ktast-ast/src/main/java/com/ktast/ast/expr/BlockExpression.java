package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.Statement;
import com.ktast.ast.StatementsContainer;

import java.util.List;

/**
 * 花括号代码块
 */
public final class BlockExpression extends Expression implements StatementsContainer {
    private final List<Statement> statements;

    public BlockExpression(List<? extends Statement> statements) {
        this.statements = listOf(statements);
    }

    @Override
    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{statements};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitBlockExpression(this, context);
    }
}
