package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * while 循环
 */
public final class WhileExpression extends Expression {
    private final Keyword whileKeyword;
    private final Keyword lPar;
    private final Expression condition;
    private final Keyword rPar;
    private final Expression body;

    public WhileExpression(Keyword whileKeyword, Keyword lPar, Expression condition, Keyword rPar, Expression body) {
        this.whileKeyword = Keyword.requireType(required(whileKeyword, "whileKeyword"), "whileKeyword",
                Keyword.Type.WHILE);
        this.lPar = Keyword.requireType(required(lPar, "lPar"), "lPar", Keyword.Type.LPAR);
        this.condition = required(condition, "condition");
        this.rPar = Keyword.requireType(required(rPar, "rPar"), "rPar", Keyword.Type.RPAR);
        this.body = required(body, "body");
    }

    public Keyword getWhileKeyword() {
        return whileKeyword;
    }

    public Keyword getLPar() {
        return lPar;
    }

    public Expression getCondition() {
        return condition;
    }

    public Keyword getRPar() {
        return rPar;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{whileKeyword, lPar, condition, rPar, body};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitWhileExpression(this, context);
    }
}
