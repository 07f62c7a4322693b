package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.Statement;
import com.ktast.ast.StatementsContainer;
import com.ktast.ast.decl.Variable;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.type.TypeRef;

import java.util.List;

/**
 * Lambda 表达式：{@code { a, b -> a + b }}
 */
public final class LambdaExpression extends Expression {
    private final LambdaParams params;
    private final Keyword arrow;
    private final LambdaBody body;

    public LambdaExpression(LambdaParams params, Keyword arrow, LambdaBody body) {
        this.params = params;
        this.arrow = Keyword.requireType(arrow, "arrow", Keyword.Type.ARROW);
        this.body = required(body, "body");
        check(params == null || arrow != null, "Lambda parameters require '->'");
    }

    public LambdaParams getParams() {
        return params;
    }

    public Keyword getArrow() {
        return arrow;
    }

    public LambdaBody getBody() {
        return body;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{params, arrow, body};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpression(this, context);
    }

    /** 参数列表（不带括号） */
    public static final class LambdaParams extends Node {
        private final List<LambdaParam> elements;
        private final Keyword trailingComma;

        public LambdaParams(List<LambdaParam> elements, Keyword trailingComma) {
            this.elements = listOf(elements);
            this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
            check(!this.elements.isEmpty(), "Lambda parameter list must not be empty");
        }

        public List<LambdaParam> getElements() {
            return elements;
        }

        public Keyword getTrailingComma() {
            return trailingComma;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{elements, trailingComma};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitLambdaParams(this, context);
        }
    }

    /**
     * 单个参数：{@code x}、{@code x: Int}、解构 {@code (k, v)} 或 {@code (k, v): Pair<K, V>}
     * <p>也用作 for 循环变量</p>
     */
    public static final class LambdaParam extends Node {
        private final Keyword lPar;
        private final List<Variable> variables;
        private final Keyword trailingComma;
        private final Keyword rPar;
        private final TypeRef destructTypeRef;

        public LambdaParam(Keyword lPar, List<Variable> variables, Keyword trailingComma, Keyword rPar,
                           TypeRef destructTypeRef) {
            this.lPar = Keyword.requireType(lPar, "lPar", Keyword.Type.LPAR);
            this.variables = listOf(variables);
            this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
            this.rPar = Keyword.requireType(rPar, "rPar", Keyword.Type.RPAR);
            this.destructTypeRef = destructTypeRef;
            check(!this.variables.isEmpty(), "Lambda parameter must declare at least one variable");
            check((lPar == null) == (rPar == null), "Parentheses must be paired");
            if (this.variables.size() >= 2) {
                check(lPar != null, "Destructuring parameter requires parentheses");
            } else {
                check(lPar == null, "Single variable must not be parenthesized");
            }
            check(trailingComma == null || lPar != null, "Trailing comma requires parentheses");
            check(destructTypeRef == null || lPar != null, "Destructuring type requires parentheses");
        }

        public Keyword getLPar() {
            return lPar;
        }

        public List<Variable> getVariables() {
            return variables;
        }

        public Keyword getTrailingComma() {
            return trailingComma;
        }

        public Keyword getRPar() {
            return rPar;
        }

        public TypeRef getDestructTypeRef() {
            return destructTypeRef;
        }

        public boolean isDestructuring() {
            return lPar != null;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{lPar, variables, trailingComma, rPar, destructTypeRef};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitLambdaParam(this, context);
        }
    }

    /** Lambda 体（箭头之后到右花括号之前的语句） */
    public static final class LambdaBody extends Node implements StatementsContainer {
        private final List<Statement> statements;

        public LambdaBody(List<? extends Statement> statements) {
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
            return visitor.visitLambdaBody(this, context);
        }
    }
}
