package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.ValueArgs;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;

/**
 * 次构造器：{@code constructor(x: Int) : this(x, 0) { ... }}
 */
public final class SecondaryConstructorDeclaration extends Declaration implements WithModifiers {
    private final Modifiers modifiers;
    private final Keyword constructorKeyword;
    private final FunctionParams params;
    private final DelegationCall delegationCall;
    private final BlockExpression block;

    public SecondaryConstructorDeclaration(Modifiers modifiers, Keyword constructorKeyword, FunctionParams params,
                                           DelegationCall delegationCall, BlockExpression block) {
        this.modifiers = modifiers;
        this.constructorKeyword = Keyword.requireType(required(constructorKeyword, "constructorKeyword"),
                "constructorKeyword", Keyword.Type.CONSTRUCTOR);
        this.params = required(params, "params");
        this.delegationCall = delegationCall;
        this.block = block;
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Keyword getConstructorKeyword() {
        return constructorKeyword;
    }

    public FunctionParams getParams() {
        return params;
    }

    public DelegationCall getDelegationCall() {
        return delegationCall;
    }

    public BlockExpression getBlock() {
        return block;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, constructorKeyword, params, delegationCall, block};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSecondaryConstructorDeclaration(this, context);
    }

    /**
     * 委托调用：{@code this(...)} 或 {@code super(...)}
     */
    public static final class DelegationCall extends Node {
        private final Keyword target;
        private final ValueArgs args;

        public DelegationCall(Keyword target, ValueArgs args) {
            this.target = Keyword.requireRole(required(target, "target"), Keyword.Role.DELEGATION_TARGET, "target");
            this.args = required(args, "args");
        }

        public Keyword getTarget() {
            return target;
        }

        public ValueArgs getArgs() {
            return args;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{target, args};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitDelegationCall(this, context);
        }
    }
}
