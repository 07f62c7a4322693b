package com.ktast.ast.type;

import com.ktast.ast.NodeVisitor;

/**
 * {@code dynamic} 类型
 */
public final class DynamicType extends Type {

    @Override
    protected Object[] slots() {
        return new Object[0];
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitDynamicType(this, context);
    }
}
