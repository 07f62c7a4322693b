package com.ktast.ast.extra;

import com.ktast.ast.NodeVisitor;

public final class Semicolon extends Extra {
    private final String text;

    public Semicolon(String text) {
        this.text = required(text, "text");
        check(";".equals(text), "Semicolon text must be ';'");
    }

    public Semicolon() {
        this(";");
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
        return visitor.visitSemicolon(this, context);
    }
}
