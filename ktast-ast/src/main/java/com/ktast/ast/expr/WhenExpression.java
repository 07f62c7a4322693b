package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.type.TypeRef;

import java.util.List;

/**
 * when 表达式
 */
public final class WhenExpression extends Expression {
    private final Keyword whenKeyword;
    private final Keyword lPar;
    private final Expression subject;
    private final Keyword rPar;
    private final List<WhenBranch> branches;

    public WhenExpression(Keyword whenKeyword, Keyword lPar, Expression subject, Keyword rPar,
                          List<WhenBranch> branches) {
        this.whenKeyword = Keyword.requireType(required(whenKeyword, "whenKeyword"), "whenKeyword",
                Keyword.Type.WHEN);
        this.lPar = Keyword.requireType(lPar, "lPar", Keyword.Type.LPAR);
        this.subject = subject;
        this.rPar = Keyword.requireType(rPar, "rPar", Keyword.Type.RPAR);
        this.branches = listOf(branches);
        check((lPar == null) == (subject == null) && (subject == null) == (rPar == null),
                "Subject and its parentheses must be all present or all absent");
    }

    public Keyword getWhenKeyword() {
        return whenKeyword;
    }

    public Keyword getLPar() {
        return lPar;
    }

    public Expression getSubject() {
        return subject;
    }

    public Keyword getRPar() {
        return rPar;
    }

    public List<WhenBranch> getBranches() {
        return branches;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{whenKeyword, lPar, subject, rPar, branches};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitWhenExpression(this, context);
    }

    /**
     * 分支：{@code 1, 2 -> a} 或 {@code else -> b}
     */
    public static final class WhenBranch extends Node {
        private final List<WhenCondition> conditions;
        private final Keyword trailingComma;
        private final Keyword elseKeyword;
        private final Keyword arrow;
        private final Expression body;

        public WhenBranch(List<WhenCondition> conditions, Keyword trailingComma, Keyword elseKeyword,
                          Keyword arrow, Expression body) {
            this.conditions = listOf(conditions);
            this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
            this.elseKeyword = Keyword.requireType(elseKeyword, "elseKeyword", Keyword.Type.ELSE);
            this.arrow = Keyword.requireType(required(arrow, "arrow"), "arrow", Keyword.Type.ARROW);
            this.body = required(body, "body");
            if (this.conditions.isEmpty()) {
                check(elseKeyword != null, "Branch without conditions must be an else branch");
                check(trailingComma == null, "Else branch cannot have a trailing comma");
            } else {
                check(elseKeyword == null, "Branch with conditions cannot be an else branch");
            }
        }

        public List<WhenCondition> getConditions() {
            return conditions;
        }

        public Keyword getTrailingComma() {
            return trailingComma;
        }

        public Keyword getElseKeyword() {
            return elseKeyword;
        }

        public Keyword getArrow() {
            return arrow;
        }

        public Expression getBody() {
            return body;
        }

        public boolean isElse() {
            return elseKeyword != null;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{conditions, trailingComma, elseKeyword, arrow, body};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitWhenBranch(this, context);
        }
    }

    /**
     * 分支条件：表达式、{@code in range}、{@code !in range}、{@code is T}、{@code !is T}
     */
    public static final class WhenCondition extends Node {
        private final Keyword operator;
        private final Expression expression;
        private final TypeRef typeRef;

        public WhenCondition(Keyword operator, Expression expression, TypeRef typeRef) {
            this.operator = Keyword.requireRole(operator, Keyword.Role.WHEN_OPERATOR, "operator");
            this.expression = expression;
            this.typeRef = typeRef;
            if (operator == null || operator.is(Keyword.Type.IN) || operator.is(Keyword.Type.NOT_IN)) {
                check(expression != null && typeRef == null, "Condition requires an expression operand");
            } else {
                check(typeRef != null && expression == null, "Type test condition requires a type operand");
            }
        }

        public Keyword getOperator() {
            return operator;
        }

        public Expression getExpression() {
            return expression;
        }

        public TypeRef getTypeRef() {
            return typeRef;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{operator, expression, typeRef};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitWhenCondition(this, context);
        }
    }
}
