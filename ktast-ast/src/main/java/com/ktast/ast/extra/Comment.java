package com.ktast.ast.extra;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

/**
 * 注释；startsLine/endsLine 记录注释是否独占行首/行尾
 */
public final class Comment extends Extra {
    private final String text;
    private final boolean startsLine;
    private final boolean endsLine;

    public Comment(String text, boolean startsLine, boolean endsLine) {
        this.text = required(text, "text");
        this.startsLine = startsLine;
        this.endsLine = endsLine;
        check(text.startsWith("//") || text.startsWith("/*"), "Comment must start with '//' or '/*'");
    }

    @Override
    public String getText() {
        return text;
    }

    public boolean isStartsLine() {
        return startsLine;
    }

    public boolean isEndsLine() {
        return endsLine;
    }

    public boolean isLineComment() {
        return text.startsWith("//");
    }

    @Override
    protected Object[] slots() {
        return new Object[]{text, startsLine, endsLine};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("text", text, "startsLine", startsLine, "endsLine", endsLine);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitComment(this, context);
    }
}
