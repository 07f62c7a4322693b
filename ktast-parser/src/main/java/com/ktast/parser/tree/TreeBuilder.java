package com.ktast.parser.tree;

import com.ktast.parser.lexer.Token;
import com.ktast.parser.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 基于标记的原始语法树构建器
 *
 * <p>语法分析器只看到有效词法单元；空白、注释自动跳过。分析器用 {@link #mark()} 在当前位置打开标记，
 * 分析完一个结构后调用 {@link Marker#done(SyntaxKind)} 闭合。标记从当前有效单元开始、到最后消耗的有效单元结束，
 * 前后的附加信息留在外层节点中。{@link #build()} 按标记事件把全部词法单元装配成树。</p>
 */
public class TreeBuilder {

    private final List<Token> tokens;
    private final TokenType[] types;
    private final List<Event> productions = new ArrayList<Event>();
    private final List<int[]> remaps = new ArrayList<int[]>();

    private int current;
    private int lastConsumed = -1;

    /**
     * @param tokens 以 EOF 结尾的完整词法单元列表
     */
    public TreeBuilder(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.types = new TokenType[tokens.size()];
        for (int i = 0; i < types.length; i++) {
            types[i] = tokens.get(i).getType();
        }
        this.current = skipTrivia(0);
    }

    // ============ 词法单元访问 ============

    public TokenType getTokenType() {
        return types[current];
    }

    public Token getToken() {
        return tokenAt(current);
    }

    public String getTokenText() {
        return tokens.get(current).getLexeme();
    }

    public boolean eof() {
        return types[current] == TokenType.EOF;
    }

    /**
     * 向后第 n 个有效单元的类型，lookAhead(0) 为当前单元
     */
    public TokenType lookAhead(int n) {
        return types[indexAhead(n)];
    }

    public String lookAheadText(int n) {
        return tokens.get(indexAhead(n)).getLexeme();
    }

    private int indexAhead(int n) {
        int i = current;
        for (int k = 0; k < n && types[i] != TokenType.EOF; k++) {
            i = skipTrivia(i + 1);
        }
        return i;
    }

    public void advance() {
        if (eof()) return;
        lastConsumed = current;
        current = skipTrivia(current + 1);
    }

    /**
     * 上一个有效单元与当前单元之间是否有换行
     */
    public boolean newlineBefore() {
        for (int i = current - 1; i >= 0 && types[i].isTrivia(); i--) {
            if (containsLineBreak(i)) return true;
        }
        return false;
    }

    /**
     * 当前单元与下一个有效单元之间是否有换行
     */
    public boolean newlineAfterCurrent() {
        for (int i = current + 1; i < types.length && types[i].isTrivia(); i++) {
            if (containsLineBreak(i)) return true;
        }
        return false;
    }

    /** 当前单元之前紧挨着附加信息（空白或注释） */
    public boolean triviaBefore() {
        return current > 0 && types[current - 1].isTrivia();
    }

    /**
     * 向后第 n 个有效单元与它的前一个单元是否紧邻
     */
    public boolean adjacent(int n) {
        int i = indexAhead(n);
        return i > 0 && !types[i - 1].isTrivia();
    }

    /**
     * 重新标记当前单元的类型；标记为附加信息类型时当前位置随之后移，回滚时一并撤销
     */
    public void remapCurrent(TokenType type) {
        remaps.add(new int[]{current, types[current].ordinal()});
        types[current] = type;
        if (type.isTrivia()) {
            current = skipTrivia(current);
        }
    }

    private int skipTrivia(int i) {
        while (i < types.length - 1 && types[i].isTrivia()) i++;
        return i;
    }

    private boolean containsLineBreak(int i) {
        String text = tokens.get(i).getLexeme();
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    private Token tokenAt(int i) {
        Token token = tokens.get(i);
        return token.getType() == types[i] ? token : token.withType(types[i]);
    }

    // ============ 标记 ============

    public Marker mark() {
        Marker marker = new Marker(current);
        productions.add(marker.startEvent);
        return marker;
    }

    /**
     * 按标记事件装配语法树；根标记包含全部词法单元（含首尾附加信息与 EOF）
     */
    public SyntaxNode build() {
        Deque<Frame> stack = new ArrayDeque<Frame>();
        SyntaxNode root = null;
        int cursor = 0;
        for (Event event : productions) {
            if (root != null) {
                throw new IllegalStateException("Marker after the root marker was completed");
            }
            Marker marker = event.marker;
            if (event.start) {
                if (marker.kind == null) {
                    throw new IllegalStateException("Marker at token " + marker.start + " was never completed");
                }
                if (!stack.isEmpty()) {
                    cursor = flush(stack.peek(), cursor, marker.start);
                }
                stack.push(new Frame(marker.kind));
            } else {
                Frame frame = stack.pop();
                cursor = flush(frame, cursor, stack.isEmpty() ? tokens.size() : marker.end);
                SyntaxNode node = SyntaxNode.composite(frame.kind);
                for (SyntaxNode child : frame.children) {
                    node.addChild(child);
                }
                if (stack.isEmpty()) {
                    root = node;
                } else {
                    stack.peek().children.add(node);
                }
            }
        }
        if (root == null) {
            throw new IllegalStateException("No root marker");
        }
        return root;
    }

    private int flush(Frame frame, int from, int to) {
        for (int i = from; i < to; i++) {
            frame.children.add(SyntaxNode.leaf(tokenAt(i)));
        }
        return Math.max(from, to);
    }

    private static final class Frame {
        final SyntaxKind kind;
        final List<SyntaxNode> children = new ArrayList<SyntaxNode>();

        Frame(SyntaxKind kind) {
            this.kind = kind;
        }
    }

    private static final class Event {
        final Marker marker;
        final boolean start;

        Event(Marker marker, boolean start) {
            this.marker = marker;
            this.start = start;
        }
    }

    /**
     * 打开的标记
     */
    public final class Marker {
        private final int start;
        private final int remapCount;
        private final int lastConsumedAtStart;
        private final Event startEvent = new Event(this, true);
        private SyntaxKind kind;
        private int end = -1;

        private Marker(int start) {
            this(start, remaps.size(), lastConsumed);
        }

        private Marker(int start, int remapCount, int lastConsumedAtStart) {
            this.start = start;
            this.remapCount = remapCount;
            this.lastConsumedAtStart = lastConsumedAtStart;
        }

        /**
         * 闭合标记；在它之后打开的标记必须已经闭合或丢弃
         */
        public void done(SyntaxKind k) {
            if (kind != null) {
                throw new IllegalStateException("Marker already done as " + kind);
            }
            for (int i = productions.size() - 1; i >= 0; i--) {
                Event event = productions.get(i);
                if (event == startEvent) break;
                if (event.start && event.marker.kind == null) {
                    throw new IllegalStateException("Inner marker at token " + event.marker.start + " is not done");
                }
            }
            kind = k;
            end = Math.max(lastConsumed + 1, start);
            productions.add(new Event(this, false));
        }

        /**
         * 放弃标记，已消耗的单元归入外层
         */
        public void drop() {
            if (kind != null) {
                throw new IllegalStateException("Cannot drop a completed marker");
            }
            productions.remove(startEvent);
        }

        /**
         * 回到标记位置：撤销之后的全部标记、消耗与重新标记
         */
        public void rollbackTo() {
            int index = productions.indexOf(startEvent);
            if (index < 0) {
                throw new IllegalStateException("Marker is no longer active");
            }
            productions.subList(index, productions.size()).clear();
            for (int i = remaps.size() - 1; i >= remapCount; i--) {
                int[] remap = remaps.remove(i);
                types[remap[0]] = TokenType.values()[remap[1]];
            }
            current = start;
            lastConsumed = lastConsumedAtStart;
        }

        /**
         * 在本标记之前打开一个从同一位置开始的新标记（左递归结构用）
         */
        public Marker precede() {
            int index = productions.indexOf(startEvent);
            if (index < 0) {
                throw new IllegalStateException("Marker is no longer active");
            }
            Marker outer = new Marker(start, remapCount, lastConsumedAtStart);
            productions.add(index, outer.startEvent);
            return outer;
        }
    }
}
