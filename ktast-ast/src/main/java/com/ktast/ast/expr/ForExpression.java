package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * for 循环：{@code for ((k, v) in map) ...}
 */
public final class ForExpression extends Expression {
    private final Keyword forKeyword;
    private final Keyword lPar;
    private final LambdaExpression.LambdaParam loopParam;
    private final Keyword inKeyword;
    private final Expression loopRange;
    private final Keyword rPar;
    private final Expression body;

    public ForExpression(Keyword forKeyword, Keyword lPar, LambdaExpression.LambdaParam loopParam, Keyword inKeyword,
                         Expression loopRange, Keyword rPar, Expression body) {
        this.forKeyword = Keyword.requireType(required(forKeyword, "forKeyword"), "forKeyword", Keyword.Type.FOR);
        this.lPar = Keyword.requireType(required(lPar, "lPar"), "lPar", Keyword.Type.LPAR);
        this.loopParam = required(loopParam, "loopParam");
        this.inKeyword = Keyword.requireType(required(inKeyword, "inKeyword"), "inKeyword", Keyword.Type.IN);
        this.loopRange = required(loopRange, "loopRange");
        this.rPar = Keyword.requireType(required(rPar, "rPar"), "rPar", Keyword.Type.RPAR);
        this.body = required(body, "body");
    }

    public Keyword getForKeyword() {
        return forKeyword;
    }

    public Keyword getLPar() {
        return lPar;
    }

    public LambdaExpression.LambdaParam getLoopParam() {
        return loopParam;
    }

    public Keyword getInKeyword() {
        return inKeyword;
    }

    public Expression getLoopRange() {
        return loopRange;
    }

    public Keyword getRPar() {
        return rPar;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{forKeyword, lPar, loopParam, inKeyword, loopRange, rPar, body};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitForExpression(this, context);
    }
}
