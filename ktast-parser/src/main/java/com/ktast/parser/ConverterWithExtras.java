package com.ktast.parser;

import com.ktast.ast.MutableExtrasMap;
import com.ktast.ast.Node;
import com.ktast.ast.NodeExtrasMap;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.KotlinScript;
import com.ktast.ast.extra.BlankLines;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Extra;
import com.ktast.ast.extra.Semicolon;
import com.ktast.ast.extra.TrailingComma;
import com.ktast.ast.extra.Whitespace;
import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 转换的同时收集附加信息（空白、注释、分号、尾随逗号）
 *
 * <p>转换完成后，原始树中每一段连续的附加信息叶子按两侧的有效叶子归属到节点的前、内、后三个位置。
 * 本对象本身就是结果映射，也可以通过 {@link #getExtrasMap()} 取得底层映射。</p>
 */
public class ConverterWithExtras extends Converter implements MutableExtrasMap {

    private static final Logger LOGGER = Logger.getLogger(ConverterWithExtras.class.getName());

    /** 由节点自己写出右括号的原始节点种类，右括号之前的附加信息归入其内部 */
    private static final Set<SyntaxKind> CLOSING_KINDS = EnumSet.of(
            SyntaxKind.CLASS_BODY,
            SyntaxKind.BLOCK,
            SyntaxKind.LAMBDA_EXPRESSION,
            SyntaxKind.WHEN,
            SyntaxKind.LONG_TEMPLATE_ENTRY,
            SyntaxKind.VALUE_PARAMETER_LIST,
            SyntaxKind.VALUE_ARGUMENT_LIST,
            SyntaxKind.PARENTHESIZED,
            SyntaxKind.FUNCTION_TYPE_PARAMS,
            SyntaxKind.ARRAY_ACCESS_EXPRESSION,
            SyntaxKind.COLLECTION_LITERAL,
            SyntaxKind.CONTRACT_EFFECTS,
            SyntaxKind.TYPE_PARAMETER_LIST,
            SyntaxKind.TYPE_ARGUMENT_LIST);

    private static final Set<TokenType> CLOSING_TOKENS = EnumSet.of(
            TokenType.RBRACE, TokenType.RPAR, TokenType.RBRACKET, TokenType.GT, TokenType.LONG_TEMPLATE_ENTRY_END);

    private final boolean collapseBlankLines;
    private final NodeExtrasMap extrasMap = new NodeExtrasMap();
    // 同一原始节点多次报告时只保留最后一个
    private final Map<SyntaxNode, Node> nodesByRaw = new IdentityHashMap<SyntaxNode, Node>();
    private final Map<SyntaxNode, SyntaxNode> firstLeaves = new IdentityHashMap<SyntaxNode, SyntaxNode>();
    private final Map<SyntaxNode, SyntaxNode> lastLeaves = new IdentityHashMap<SyntaxNode, SyntaxNode>();

    public ConverterWithExtras() {
        this(false);
    }

    /**
     * @param collapseBlankLines 含两个以上换行的空白折叠为 {@link BlankLines}
     */
    public ConverterWithExtras(boolean collapseBlankLines) {
        this.collapseBlankLines = collapseBlankLines;
    }

    @Override
    public KotlinFile convertFile(SyntaxNode raw) {
        KotlinFile file = super.convertFile(raw);
        collectExtras(raw);
        return file;
    }

    @Override
    public KotlinScript convertScript(SyntaxNode raw) {
        KotlinScript script = super.convertScript(raw);
        collectExtras(raw);
        return script;
    }

    @Override
    protected <T extends Node> T onNode(T node, SyntaxNode raw) {
        if (node != null && raw != null) {
            nodesByRaw.put(raw, node);
        }
        return super.onNode(node, raw);
    }

    public NodeExtrasMap getExtrasMap() {
        return extrasMap;
    }

    @Override
    public List<Extra> extrasBefore(Node node) {
        return extrasMap.extrasBefore(node);
    }

    @Override
    public List<Extra> extrasWithin(Node node) {
        return extrasMap.extrasWithin(node);
    }

    @Override
    public List<Extra> extrasAfter(Node node) {
        return extrasMap.extrasAfter(node);
    }

    @Override
    public void moveExtras(Node from, Node to) {
        extrasMap.moveExtras(from, to);
    }

    // ============ 附加信息归属 ============

    private void collectExtras(SyntaxNode root) {
        indexLeaves(root);
        List<SyntaxNode> leaves = root.getLeaves();
        SyntaxNode previous = null;
        int i = 0;
        while (i < leaves.size()) {
            SyntaxNode leaf = leaves.get(i);
            if (!isExtraLeaf(leaf)) {
                previous = leaf;
                i++;
                continue;
            }
            int start = i;
            while (i < leaves.size() && isExtraLeaf(leaves.get(i))) {
                i++;
            }
            SyntaxNode next = i < leaves.size() ? leaves.get(i) : null;
            List<Extra> run = new ArrayList<Extra>();
            for (int k = start; k < i; k++) {
                run.add(toExtra(leaves, k));
            }
            placeRun(root, previous, run, next);
        }
    }

    private void placeRun(SyntaxNode root, SyntaxNode a, List<Extra> run, SyntaxNode b) {
        Node x = a == null ? null : innermostEndingAt(root, a);
        Node y = b == null ? null : outermostStartingAt(root, b);
        Node z = b == null ? null : closingOwner(root, b);
        int split = firstLineBreakSplit(run);

        if (y != null) {
            if (x != null && split >= 0) {
                add(x, run.subList(0, split), Position.AFTER);
                add(y, run.subList(split, run.size()), Position.BEFORE);
            } else {
                add(y, run, Position.BEFORE);
            }
        } else if (z != null) {
            if (x == null) {
                add(z, run, Position.WITHIN);
            } else if (split >= 0) {
                add(x, run.subList(0, split), Position.AFTER);
                add(z, run.subList(split, run.size()), Position.WITHIN);
            } else {
                add(x, run, Position.AFTER);
            }
        } else if (x != null) {
            add(x, run, Position.AFTER);
        } else {
            Node owner = b == null ? nodesByRaw.get(root) : innermostOwner(root, b);
            LOGGER.log(Level.FINE, "Attaching {0} extras within {1} as a fallback",
                    new Object[]{run.size(), owner == null ? "nothing" : owner.getKindName()});
            if (owner == null) {
                LOGGER.warning("Extras could not be placed: " + run);
                return;
            }
            add(owner, run, Position.WITHIN);
        }
    }

    private enum Position {
        BEFORE,
        WITHIN,
        AFTER
    }

    private void add(Node node, List<Extra> extras, Position position) {
        List<Extra> result = new ArrayList<Extra>();
        for (Extra extra : extras) {
            if (collapseBlankLines && extra instanceof Whitespace) {
                collapse(extra.getText(), result);
            } else {
                result.add(extra);
            }
        }
        if (result.isEmpty()) return;
        switch (position) {
            case BEFORE:
                extrasMap.addBefore(node, result);
                break;
            case WITHIN:
                extrasMap.addWithin(node, result);
                break;
            default:
                extrasMap.addAfter(node, result);
        }
    }

    /**
     * 连续换行折叠为 {@link BlankLines}，最后一个换行之后的缩进保留为 {@link Whitespace}；
     * 换行之间夹有其他空白字符时不折叠
     */
    private static void collapse(String text, List<Extra> result) {
        int lastBreak = text.lastIndexOf('\n');
        String breaks = text.substring(0, lastBreak + 1);
        int count = breaks.length();
        if (count < 2 || !breaks.replace("\n", "").isEmpty()) {
            result.add(new Whitespace(text));
            return;
        }
        result.add(new BlankLines(count - 1));
        if (lastBreak + 1 < text.length()) {
            result.add(new Whitespace(text.substring(lastBreak + 1)));
        }
    }

    /**
     * 把第一个含换行的空白在换行之后切开，返回后半段在列表中的起始下标；没有换行时返回 -1
     */
    private static int firstLineBreakSplit(List<Extra> run) {
        for (int i = 0; i < run.size(); i++) {
            Extra extra = run.get(i);
            if (!(extra instanceof Whitespace)) continue;
            String text = extra.getText();
            int end = lineBreakEnd(text);
            if (end < 0) continue;
            run.set(i, new Whitespace(text.substring(0, end)));
            if (end < text.length()) {
                run.add(i + 1, new Whitespace(text.substring(end)));
            }
            return i + 1;
        }
        return -1;
    }

    /** 第一个换行（含 \r\n）之后的位置 */
    private static int lineBreakEnd(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n') return i + 1;
            if (ch == '\r') {
                return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? i + 2 : i + 1;
            }
        }
        return -1;
    }

    // ============ 叶子与节点的对应 ============

    private static boolean isExtraLeaf(SyntaxNode leaf) {
        return leaf.isTrivia();
    }

    private Extra toExtra(List<SyntaxNode> leaves, int index) {
        SyntaxNode leaf = leaves.get(index);
        String text = leaf.getText();
        switch (leaf.getTokenType()) {
            case WHITE_SPACE:
                return new Whitespace(text);
            case EOL_COMMENT:
                return new Comment(text, startsLine(leaves, index), true);
            case BLOCK_COMMENT:
                return new Comment(text, startsLine(leaves, index), endsLine(leaves, index));
            case SEMICOLON:
                return new Semicolon(text);
            case TRAILING_COMMA:
                return new TrailingComma(text);
            default:
                throw new IllegalStateException("Unexpected extra token " + leaf);
        }
    }

    private static boolean startsLine(List<SyntaxNode> leaves, int index) {
        if (index == 0) return true;
        SyntaxNode previous = leaves.get(index - 1);
        return previous.is(TokenType.WHITE_SPACE) && lineBreakEnd(previous.getText()) >= 0;
    }

    private static boolean endsLine(List<SyntaxNode> leaves, int index) {
        if (index + 1 == leaves.size()) return true;
        SyntaxNode next = leaves.get(index + 1);
        return next.is(TokenType.EOF) || next.is(TokenType.WHITE_SPACE) && lineBreakEnd(next.getText()) >= 0;
    }

    /**
     * 记录每个复合节点的第一个和最后一个有效叶子
     */
    private void indexLeaves(SyntaxNode node) {
        if (node.isLeaf()) return;
        SyntaxNode first = null;
        SyntaxNode last = null;
        for (SyntaxNode child : node.getChildren()) {
            indexLeaves(child);
            SyntaxNode childFirst = child.isLeaf() ? (child.isTrivia() ? null : child) : firstLeaves.get(child);
            SyntaxNode childLast = child.isLeaf() ? (child.isTrivia() ? null : child) : lastLeaves.get(child);
            if (first == null) first = childFirst;
            if (childLast != null) last = childLast;
        }
        if (first != null) {
            firstLeaves.put(node, first);
            lastLeaves.put(node, last);
        }
    }

    private SyntaxNode firstLeaf(SyntaxNode node) {
        return node.isLeaf() ? node : firstLeaves.get(node);
    }

    private SyntaxNode lastLeaf(SyntaxNode node) {
        return node.isLeaf() ? node : lastLeaves.get(node);
    }

    /** 最后一个有效叶子是 leaf 的最内层节点（不含根） */
    private Node innermostEndingAt(SyntaxNode root, SyntaxNode leaf) {
        for (SyntaxNode raw = leaf; raw != null && raw != root && lastLeaf(raw) == leaf; raw = raw.getParent()) {
            Node node = nodesByRaw.get(raw);
            if (node != null) return node;
        }
        return null;
    }

    /** 第一个有效叶子是 leaf 的最外层节点（不含根） */
    private Node outermostStartingAt(SyntaxNode root, SyntaxNode leaf) {
        Node result = null;
        for (SyntaxNode raw = leaf; raw != null && raw != root && firstLeaf(raw) == leaf; raw = raw.getParent()) {
            Node node = nodesByRaw.get(raw);
            if (node != null) result = node;
        }
        return result;
    }

    /** leaf 是某个节点自己写出的右括号或文件结尾时，返回该节点 */
    private Node closingOwner(SyntaxNode root, SyntaxNode leaf) {
        if (leaf.is(TokenType.EOF)) {
            return nodesByRaw.get(root);
        }
        SyntaxNode parent = leaf.getParent();
        if (parent == null || !CLOSING_TOKENS.contains(leaf.getTokenType()) || !CLOSING_KINDS.contains(parent.getKind())
                || lastLeaf(parent) != leaf) {
            return null;
        }
        return nodesByRaw.get(parent);
    }

    private Node innermostOwner(SyntaxNode root, SyntaxNode leaf) {
        for (SyntaxNode raw = leaf; raw != null; raw = raw.getParent()) {
            Node node = nodesByRaw.get(raw);
            if (node != null) return node;
            if (raw == root) break;
        }
        return null;
    }
}
