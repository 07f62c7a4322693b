package com.ktast.ast.extra;

import com.ktast.ast.NodeVisitor;

import java.util.Map;

/**
 * 折叠后的空行：count 个空行，输出 count + 1 个换行
 */
public final class BlankLines extends Extra {
    private final int count;

    public BlankLines(int count) {
        check(count >= 1, "Blank line count must be at least 1");
        this.count = count;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= count; i++) {
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    protected Object[] slots() {
        return new Object[]{count};
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("count", count);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitBlankLines(this, context);
    }
}
