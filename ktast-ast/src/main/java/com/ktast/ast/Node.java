package com.ktast.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AST 节点基类
 *
 * <p>节点不可变，按值比较（{@link #equals}），节点身份为 Java 对象引用身份。
 * 每个具体节点通过 {@link #slots()} 按源码从左到右的顺序列出全部字段，
 * Visitor、MutableVisitor、Writer、Dumper 共用这一顺序。</p>
 */
public abstract class Node {

    protected Node() {
    }

    /**
     * 按源码顺序返回全部字段值（子节点、子节点列表、标量，缺省字段为 null）
     */
    protected abstract Object[] slots();

    public abstract <R, C> R accept(NodeVisitor<R, C> visitor, C context);

    /**
     * 按源码顺序返回直接子节点：跳过缺省字段与标量，列表字段逐个展开
     */
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<Node>();
        for (Object slot : slots()) {
            if (slot instanceof Node) {
                children.add((Node) slot);
            } else if (slot instanceof List) {
                for (Object element : (List<?>) slot) {
                    if (element instanceof Node) {
                        children.add((Node) element);
                    }
                }
            }
        }
        return children;
    }

    /**
     * 节点种类名：去掉包名的类名，嵌套类以 '.' 连接，如 {@code ClassDeclaration.ClassBody}
     */
    public String getKindName() {
        String name = getClass().getName();
        name = name.substring(name.lastIndexOf('.') + 1);
        return name.replace('$', '.');
    }

    /**
     * 标量属性（文本、标志、形式），供 Dumper 详细模式输出；无标量的节点返回空表
     */
    public Map<String, Object> getAttributes() {
        return Collections.emptyMap();
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(slots(), ((Node) o).slots());
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().hashCode() + Arrays.hashCode(slots());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getKindName());
        Map<String, Object> attributes = getAttributes();
        if (!attributes.isEmpty()) {
            sb.append(attributes);
        }
        List<Node> children = getChildren();
        if (!children.isEmpty()) {
            sb.append(children);
        }
        return sb.toString();
    }

    // ============ 构造辅助 ============

    protected static <T> List<T> listOf(List<? extends T> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        for (Object element : list) {
            if (element == null) {
                throw new IllegalArgumentException("List elements must not be null");
            }
        }
        return Collections.unmodifiableList(new ArrayList<T>(list));
    }

    protected static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    protected static void check(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    protected static Map<String, Object> attributes(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}
