package com.ktast.ast.expr;

import com.ktast.ast.NodeVisitor;

import java.util.List;
import java.util.Map;

/**
 * 名字引用；反引号名字保留反引号
 */
public final class NameExpression extends Expression {
    private final String text;

    public NameExpression(String text) {
        this.text = required(text, "text");
        check(!text.isEmpty(), "Name must not be empty");
    }

    public String getText() {
        return text;
    }

    /** 用 '.' 连接名字序列 */
    public static String join(List<NameExpression> names) {
        StringBuilder sb = new StringBuilder();
        for (NameExpression name : names) {
            if (sb.length() > 0) sb.append('.');
            sb.append(name.getText());
        }
        return sb.toString();
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
        return visitor.visitNameExpression(this, context);
    }
}
