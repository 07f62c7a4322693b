package com.ktast.ast.extra;

import com.ktast.ast.NodeVisitor;

/**
 * 没有对应槽位的尾随逗号（如最后一个枚举项之后）
 */
public final class TrailingComma extends Extra {
    private final String text;

    public TrailingComma(String text) {
        this.text = required(text, "text");
        check(",".equals(text), "Trailing comma text must be ','");
    }

    public TrailingComma() {
        this(",");
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{text};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTrailingComma(this, context);
    }
}
