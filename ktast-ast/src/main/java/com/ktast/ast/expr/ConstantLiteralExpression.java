package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

/**
 * 常量字面量，保留源码文本（如 {@code 0x1F}、{@code 1_000L}、{@code 'a'}）
 */
public final class ConstantLiteralExpression extends Expression {

    public enum Kind {
        BOOLEAN,
        CHARACTER,
        INTEGER,
        REAL,
        NULL
    }

    private final String text;
    private final Kind kind;

    public ConstantLiteralExpression(String text, Kind kind) {
        this.text = required(text, "text");
        this.kind = required(kind, "kind");
        check(!text.isEmpty(), "Literal text must not be empty");
    }

    public String getText() {
        return text;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{text, kind};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("text", text, "kind", kind);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitConstantLiteralExpression(this, context);
    }
}
