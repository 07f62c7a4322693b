package com.ktast.ast;

import com.ktast.ast.extra.Extra;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 语法树结构转储，用于调试与测试
 *
 * <p>每个节点一行，按深度缩进两个空格。给出附加信息映射时，前置、后置附加信息以
 * {@code BEFORE: }/{@code AFTER: } 前缀与节点同级输出，内部附加信息以 {@code WITHIN: } 前缀在子节点层级输出。
 * 详细模式下带标量属性的节点追加 {@code {key="value"}}。</p>
 *
 * <pre>
 * KotlinFile
 *   PropertyDeclaration
 *     Keyword.VAL{text="val"}
 *     Variable
 *       NameExpression{text="x"}
 *     Keyword.EQUAL{text="="}
 *     ConstantLiteralExpression{text="false", kind="BOOLEAN"}
 * </pre>
 */
public class Dumper extends Visitor {

    private final StringBuilder output = new StringBuilder();
    private final ExtrasMap extrasMap;
    private final boolean verbose;

    protected Dumper(ExtrasMap extrasMap, boolean verbose) {
        this.extrasMap = extrasMap;
        this.verbose = verbose;
    }

    public static String dump(Node root) {
        return dump(root, null, true);
    }

    public static String dump(Node root, ExtrasMap extrasMap) {
        return dump(root, extrasMap, true);
    }

    /**
     * @param root      根节点
     * @param extrasMap 附加信息映射，可为 null
     * @param verbose   是否输出标量属性
     */
    public static String dump(Node root, ExtrasMap extrasMap, boolean verbose) {
        Dumper dumper = new Dumper(extrasMap, verbose);
        dumper.visit(NodePath.rootPath(root));
        return dumper.output.toString();
    }

    @Override
    protected void visit(NodePath path) {
        Node node = path.getNode();
        int depth = path.getDepth();
        writeExtras(depth, "BEFORE: ", extrasMap == null ? null : extrasMap.extrasBefore(node));
        writeLine(depth, "", node);
        visitChildren(path);
        writeExtras(depth + 1, "WITHIN: ", extrasMap == null ? null : extrasMap.extrasWithin(node));
        writeExtras(depth, "AFTER: ", extrasMap == null ? null : extrasMap.extrasAfter(node));
    }

    private void writeExtras(int depth, String prefix, List<Extra> extras) {
        if (extras == null) return;
        for (Extra extra : extras) {
            writeLine(depth, prefix, extra);
        }
    }

    private void writeLine(int depth, String prefix, Node node) {
        for (int i = 0; i < depth; i++) {
            output.append("  ");
        }
        output.append(prefix).append(node.getKindName());
        if (verbose) {
            Map<String, Object> attributes = node.getAttributes();
            if (!attributes.isEmpty()) {
                output.append('{');
                Iterator<Map.Entry<String, Object>> it = attributes.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, Object> entry = it.next();
                    output.append(entry.getKey()).append("=\"").append(escape(String.valueOf(entry.getValue())))
                            .append('"');
                    if (it.hasNext()) {
                        output.append(", ");
                    }
                }
                output.append('}');
            }
        }
        output.append('\n');
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\b': sb.append("\\b"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '"': sb.append("\\\""); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
