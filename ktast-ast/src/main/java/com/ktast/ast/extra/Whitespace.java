package com.ktast.ast.extra;

import com.ktast.ast.NodeVisitor;

public final class Whitespace extends Extra {
    private final String text;

    public Whitespace(String text) {
        this.text = required(text, "text");
        check(!text.isEmpty() && text.trim().isEmpty(), "Whitespace text must be non-empty blank text");
    }

    @Override
    public String getText() {
        return text;
    }

    public boolean containsLineBreak() {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{text};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitWhitespace(this, context);
    }
}
