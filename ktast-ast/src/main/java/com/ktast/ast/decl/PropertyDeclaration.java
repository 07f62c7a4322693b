package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.Expression;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.modifier.PostModifier;
import com.ktast.ast.modifier.TypeConstraintSet;
import com.ktast.ast.type.TypeRef;

import java.util.List;

/**
 * 属性声明；多个变量时为解构声明 {@code val (a, b) = pair}
 */
public final class PropertyDeclaration extends Declaration implements WithModifiers {
    private final Modifiers modifiers;
    private final Keyword valOrVarKeyword;
    private final TypeParams typeParams;
    private final TypeRef receiverTypeRef;
    private final Keyword lPar;
    private final List<Variable> variables;
    private final Keyword trailingComma;
    private final Keyword rPar;
    private final TypeConstraintSet typeConstraintSet;
    private final Keyword equals;
    private final Expression initializer;
    private final PropertyDelegate delegate;
    private final List<Accessor> accessors;

    public PropertyDeclaration(Modifiers modifiers, Keyword valOrVarKeyword, TypeParams typeParams,
                               TypeRef receiverTypeRef, Keyword lPar, List<Variable> variables,
                               Keyword trailingComma, Keyword rPar, TypeConstraintSet typeConstraintSet,
                               Keyword equals, Expression initializer, PropertyDelegate delegate,
                               List<? extends Accessor> accessors) {
        this.modifiers = modifiers;
        this.valOrVarKeyword = Keyword.requireRole(required(valOrVarKeyword, "valOrVarKeyword"),
                Keyword.Role.VAL_OR_VAR, "valOrVarKeyword");
        this.typeParams = typeParams;
        this.receiverTypeRef = receiverTypeRef;
        this.lPar = Keyword.requireType(lPar, "lPar", Keyword.Type.LPAR);
        this.variables = listOf(variables);
        this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
        this.rPar = Keyword.requireType(rPar, "rPar", Keyword.Type.RPAR);
        this.typeConstraintSet = typeConstraintSet;
        this.equals = Keyword.requireType(equals, "equals", Keyword.Type.EQUAL);
        this.initializer = initializer;
        this.delegate = delegate;
        this.accessors = listOf(accessors);

        check(!this.variables.isEmpty(), "Property must declare at least one variable");
        if (this.variables.size() >= 2) {
            check(lPar != null && rPar != null, "Destructuring declaration requires parentheses");
        } else {
            check(lPar == null && rPar == null, "Single variable must not be parenthesized");
        }
        check(trailingComma == null || lPar != null, "Trailing comma requires parentheses");
        check(initializer == null || delegate == null, "Property cannot have both initializer and delegate");
        check((equals == null) == (initializer == null), "Initializer and '=' must be both present or both absent");
        check(this.accessors.size() <= 2, "Property can have at most two accessors");
        int getters = 0;
        int setters = 0;
        for (Accessor accessor : this.accessors) {
            if (accessor instanceof Getter) getters++;
            else setters++;
        }
        check(getters <= 1, "Property can have at most one getter");
        check(setters <= 1, "Property can have at most one setter");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Keyword getValOrVarKeyword() {
        return valOrVarKeyword;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public TypeRef getReceiverTypeRef() {
        return receiverTypeRef;
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

    public TypeConstraintSet getTypeConstraintSet() {
        return typeConstraintSet;
    }

    public Keyword getEquals() {
        return equals;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public PropertyDelegate getDelegate() {
        return delegate;
    }

    public List<Accessor> getAccessors() {
        return accessors;
    }

    public boolean isVal() {
        return valOrVarKeyword.is(Keyword.Type.VAL);
    }

    public boolean isVar() {
        return valOrVarKeyword.is(Keyword.Type.VAR);
    }

    public boolean isDestructuring() {
        return lPar != null;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, valOrVarKeyword, typeParams, receiverTypeRef, lPar, variables,
                trailingComma, rPar, typeConstraintSet, equals, initializer, delegate, accessors};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyDeclaration(this, context);
    }

    /**
     * 属性委托：{@code by lazy { ... }}
     */
    public static final class PropertyDelegate extends Node {
        private final Keyword byKeyword;
        private final Expression expression;

        public PropertyDelegate(Keyword byKeyword, Expression expression) {
            this.byKeyword = Keyword.requireType(required(byKeyword, "byKeyword"), "byKeyword", Keyword.Type.BY);
            this.expression = required(expression, "expression");
        }

        public Keyword getByKeyword() {
            return byKeyword;
        }

        public Expression getExpression() {
            return expression;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{byKeyword, expression};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitPropertyDelegate(this, context);
        }
    }

    /**
     * 属性访问器基类
     */
    public abstract static class Accessor extends Node implements WithModifiers {
        public abstract List<PostModifier> getPostModifiers();

        public abstract Keyword getEquals();

        public abstract Expression getBody();

        /** 是否为 {@code = expr} 形式的表达式体 */
        public boolean hasExpressionBody() {
            return getEquals() != null;
        }

        static void checkBody(Keyword equals, Expression body) {
            check(equals == null || body != null, "Accessor with '=' must have a body");
            check(equals != null || body == null || body instanceof BlockExpression,
                    "Accessor body without '=' must be a block");
        }
    }

    /**
     * getter：{@code get() = field}；有函数体时写出空括号
     */
    public static final class Getter extends Accessor {
        private final Modifiers modifiers;
        private final Keyword getKeyword;
        private final TypeRef typeRef;
        private final List<PostModifier> postModifiers;
        private final Keyword equals;
        private final Expression body;

        public Getter(Modifiers modifiers, Keyword getKeyword, TypeRef typeRef,
                      List<? extends PostModifier> postModifiers, Keyword equals, Expression body) {
            this.modifiers = modifiers;
            this.getKeyword = Keyword.requireType(required(getKeyword, "getKeyword"), "getKeyword", Keyword.Type.GET);
            this.typeRef = typeRef;
            this.postModifiers = listOf(postModifiers);
            this.equals = Keyword.requireType(equals, "equals", Keyword.Type.EQUAL);
            this.body = body;
            checkBody(equals, body);
            check(typeRef == null || body != null, "Getter return type requires a body");
            check(this.postModifiers.isEmpty() || body != null, "Getter post-modifiers require a body");
        }

        @Override
        public Modifiers getModifiers() {
            return modifiers;
        }

        public Keyword getGetKeyword() {
            return getKeyword;
        }

        public TypeRef getTypeRef() {
            return typeRef;
        }

        @Override
        public List<PostModifier> getPostModifiers() {
            return postModifiers;
        }

        @Override
        public Keyword getEquals() {
            return equals;
        }

        @Override
        public Expression getBody() {
            return body;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{modifiers, getKeyword, typeRef, postModifiers, equals, body};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitGetter(this, context);
        }
    }

    /**
     * setter：{@code set(value) { field = value }}；形参与函数体同时出现或同时缺省
     */
    public static final class Setter extends Accessor {
        private final Modifiers modifiers;
        private final Keyword setKeyword;
        private final FunctionParams params;
        private final List<PostModifier> postModifiers;
        private final Keyword equals;
        private final Expression body;

        public Setter(Modifiers modifiers, Keyword setKeyword, FunctionParams params,
                      List<? extends PostModifier> postModifiers, Keyword equals, Expression body) {
            this.modifiers = modifiers;
            this.setKeyword = Keyword.requireType(required(setKeyword, "setKeyword"), "setKeyword", Keyword.Type.SET);
            this.params = params;
            this.postModifiers = listOf(postModifiers);
            this.equals = Keyword.requireType(equals, "equals", Keyword.Type.EQUAL);
            this.body = body;
            checkBody(equals, body);
            check((params == null) == (body == null), "Setter parameter and body must be both present or both absent");
            check(this.postModifiers.isEmpty() || body != null, "Setter post-modifiers require a body");
        }

        @Override
        public Modifiers getModifiers() {
            return modifiers;
        }

        public Keyword getSetKeyword() {
            return setKeyword;
        }

        public FunctionParams getParams() {
            return params;
        }

        @Override
        public List<PostModifier> getPostModifiers() {
            return postModifiers;
        }

        @Override
        public Keyword getEquals() {
            return equals;
        }

        @Override
        public Expression getBody() {
            return body;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{modifiers, setKeyword, params, postModifiers, equals, body};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitSetter(this, context);
        }
    }
}
