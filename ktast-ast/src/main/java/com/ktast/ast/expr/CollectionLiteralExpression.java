package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 集合字面量（注解参数中）：{@code [1, 2, 3]}
 */
public final class CollectionLiteralExpression extends Expression {
    private final List<Expression> expressions;
    private final Keyword trailingComma;

    public CollectionLiteralExpression(List<? extends Expression> expressions, Keyword trailingComma) {
        this.expressions = listOf(expressions);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        check(trailingComma == null || !this.expressions.isEmpty(), "Trailing comma requires an element");
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public Keyword getTrailingComma() {
        return trailingComma;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{expressions, trailingComma};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteralExpression(this, context);
    }
}
