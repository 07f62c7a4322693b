package com.ktast.ast.modifier;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.ValueArgs;
import com.ktast.ast.type.SimpleType;

/**
 * 单个注解：类型加可选实参列表
 */
public final class Annotation extends Node {
    private final SimpleType type;
    private final ValueArgs args;

    public Annotation(SimpleType type, ValueArgs args) {
        this.type = required(type, "type");
        this.args = args;
    }

    public SimpleType getType() {
        return type;
    }

    public ValueArgs getArgs() {
        return args;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{type, args};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitAnnotation(this, context);
    }
}
