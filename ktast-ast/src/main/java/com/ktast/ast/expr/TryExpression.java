package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.decl.FunctionParams;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * try 表达式
 */
public final class TryExpression extends Expression {
    private final BlockExpression block;
    private final List<CatchClause> catchClauses;
    private final BlockExpression finallyBlock;

    public TryExpression(BlockExpression block, List<CatchClause> catchClauses, BlockExpression finallyBlock) {
        this.block = required(block, "block");
        this.catchClauses = listOf(catchClauses);
        this.finallyBlock = finallyBlock;
        check(!this.catchClauses.isEmpty() || finallyBlock != null, "Try expression needs a catch or finally block");
    }

    public BlockExpression getBlock() {
        return block;
    }

    public List<CatchClause> getCatchClauses() {
        return catchClauses;
    }

    public BlockExpression getFinallyBlock() {
        return finallyBlock;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{block, catchClauses, finallyBlock};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTryExpression(this, context);
    }

    /**
     * catch 子句：{@code catch (e: IOException) { ... }}
     */
    public static final class CatchClause extends Node {
        private final Keyword catchKeyword;
        private final FunctionParams params;
        private final BlockExpression block;

        public CatchClause(Keyword catchKeyword, FunctionParams params, BlockExpression block) {
            this.catchKeyword = Keyword.requireType(required(catchKeyword, "catchKeyword"), "catchKeyword",
                    Keyword.Type.CATCH);
            this.params = required(params, "params");
            this.block = required(block, "block");
        }

        public Keyword getCatchKeyword() {
            return catchKeyword;
        }

        public FunctionParams getParams() {
            return params;
        }

        public BlockExpression getBlock() {
            return block;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{catchKeyword, params, block};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitCatchClause(this, context);
        }
    }
}
