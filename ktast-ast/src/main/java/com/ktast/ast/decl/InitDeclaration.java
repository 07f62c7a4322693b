package com.ktast.ast.decl;

import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.modifier.Modifiers;

/**
 * 初始化块：{@code init { ... }}
 */
public final class InitDeclaration extends Declaration implements WithModifiers {
    private final Modifiers modifiers;
    private final BlockExpression block;

    public InitDeclaration(Modifiers modifiers, BlockExpression block) {
        this.modifiers = modifiers;
        this.block = required(block, "block");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public BlockExpression getBlock() {
        return block;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, block};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitInitDeclaration(this, context);
    }
}
