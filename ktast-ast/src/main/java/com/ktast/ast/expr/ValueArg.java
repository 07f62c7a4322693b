package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

/**
 * 单个实参：{@code x}、{@code name = x}、{@code *array}
 */
public final class ValueArg extends Node {
    private final NameExpression name;
    private final Keyword asterisk;
    private final Expression expression;

    public ValueArg(NameExpression name, Keyword asterisk, Expression expression) {
        this.name = name;
        this.asterisk = Keyword.requireType(asterisk, "asterisk", Keyword.Type.ASTERISK);
        this.expression = required(expression, "expression");
    }

    public NameExpression getName() {
        return name;
    }

    public Keyword getAsterisk() {
        return asterisk;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{name, asterisk, expression};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitValueArg(this, context);
    }
}
