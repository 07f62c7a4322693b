package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * do-while 循环
 */
public final class DoWhileExpression extends Expression {
    private final Keyword doKeyword;
    private final Expression body;
    private final Keyword whileKeyword;
    private final Keyword lPar;
    private final Expression condition;
    private final Keyword rPar;

    public DoWhileExpression(Keyword doKeyword, Expression body, Keyword whileKeyword, Keyword lPar,
                             Expression condition, Keyword rPar) {
        this.doKeyword = Keyword.requireType(required(doKeyword, "doKeyword"), "doKeyword", Keyword.Type.DO);
        this.body = required(body, "body");
        this.whileKeyword = Keyword.requireType(required(whileKeyword, "whileKeyword"), "whileKeyword",
                Keyword.Type.WHILE);
        this.lPar = Keyword.requireType(required(lPar, "lPar"), "lPar", Keyword.Type.LPAR);
        this.condition = required(condition, "condition");
        this.rPar = Keyword.requireType(required(rPar, "rPar"), "rPar", Keyword.Type.RPAR);
    }

    public Keyword getDoKeyword() {
        return doKeyword;
    }

    public Expression getBody() {
        return body;
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

    @Override
    protected Object[] slots() {
        return new Object[]{doKeyword, body, whileKeyword, lPar, condition, rPar};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitDoWhileExpression(this, context);
    }
}
