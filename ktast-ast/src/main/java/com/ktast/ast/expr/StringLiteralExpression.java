package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;

import java.util.List;
import java.util.Map;

/**
 * 字符串字面量；raw 为三引号字符串
 */
public final class StringLiteralExpression extends Expression {
    private final List<StringEntry> entries;
    private final boolean raw;

    public StringLiteralExpression(List<? extends StringEntry> entries, boolean raw) {
        this.entries = listOf(entries);
        this.raw = raw;
        if (raw) {
            for (StringEntry entry : this.entries) {
                check(!(entry instanceof EscapeStringEntry), "Raw strings cannot contain escape sequences");
            }
        }
    }

    public List<StringEntry> getEntries() {
        return entries;
    }

    public boolean isRaw() {
        return raw;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{entries, raw};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("raw", raw);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitStringLiteralExpression(this, context);
    }

    /** 字符串片段 */
    public abstract static class StringEntry extends Node {
    }

    /** 普通文本片段 */
    public static final class LiteralStringEntry extends StringEntry {
        private final String text;

        public LiteralStringEntry(String text) {
            this.text = required(text, "text");
        }

        public String getText() {
            return text;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{text};
        }

        @Override
        public Map<String, Object> getAttributes() {
            return attributes("text", text);
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitLiteralStringEntry(this, context);
        }
    }

    /** 转义序列：{@code \n}、{@code \$} */
    public static final class EscapeStringEntry extends StringEntry {
        private final String text;

        public EscapeStringEntry(String text) {
            this.text = required(text, "text");
            check(text.startsWith("\\") && text.length() > 1, "Escape sequence must start with '\\'");
        }

        public String getText() {
            return text;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{text};
        }

        @Override
        public Map<String, Object> getAttributes() {
            return attributes("text", text);
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitEscapeStringEntry(this, context);
        }
    }

    /**
     * 模板片段：短形式 {@code $name}，长形式 {@code ${expr}}
     */
    public static final class TemplateStringEntry extends StringEntry {
        private final Expression expression;
        private final boolean shortTemplate;

        public TemplateStringEntry(Expression expression, boolean shortTemplate) {
            this.expression = required(expression, "expression");
            this.shortTemplate = shortTemplate;
            if (shortTemplate) {
                check(expression instanceof NameExpression
                                || (expression instanceof ThisExpression && ((ThisExpression) expression).getLabel() == null),
                        "Short template must be a name or an unlabelled this");
            }
        }

        public Expression getExpression() {
            return expression;
        }

        public boolean isShortTemplate() {
            return shortTemplate;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{expression, shortTemplate};
        }

        @Override
        public Map<String, Object> getAttributes() {
            return attributes("short", shortTemplate);
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitTemplateStringEntry(this, context);
        }
    }
}
