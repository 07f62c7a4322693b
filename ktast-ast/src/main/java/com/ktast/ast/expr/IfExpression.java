package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * if 表达式
 */
public final class IfExpression extends Expression {
    private final Keyword ifKeyword;
    private final Keyword lPar;
    private final Expression condition;
    private final Keyword rPar;
    private final Expression body;
    private final Keyword elseKeyword;
    private final Expression elseBody;

    public IfExpression(Keyword ifKeyword, Keyword lPar, Expression condition, Keyword rPar, Expression body,
                        Keyword elseKeyword, Expression elseBody) {
        this.ifKeyword = Keyword.requireType(required(ifKeyword, "ifKeyword"), "ifKeyword", Keyword.Type.IF);
        this.lPar = Keyword.requireType(required(lPar, "lPar"), "lPar", Keyword.Type.LPAR);
        this.condition = required(condition, "condition");
        this.rPar = Keyword.requireType(required(rPar, "rPar"), "rPar", Keyword.Type.RPAR);
        this.body = required(body, "body");
        this.elseKeyword = Keyword.requireType(elseKeyword, "elseKeyword", Keyword.Type.ELSE);
        this.elseBody = elseBody;
        check((elseKeyword == null) == (elseBody == null), "Else keyword and else body must be both present or both absent");
    }

    public Keyword getIfKeyword() {
        return ifKeyword;
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

    public Keyword getElseKeyword() {
        return elseKeyword;
    }

    public Expression getElseBody() {
        return elseBody;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{ifKeyword, lPar, condition, rPar, body, elseKeyword, elseBody};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpression(this, context);
    }
}
