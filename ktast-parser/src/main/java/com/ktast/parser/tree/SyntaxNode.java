package com.ktast.parser.tree;

import com.ktast.parser.lexer.Token;
import com.ktast.parser.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 原始语法树节点
 *
 * <p>复合节点有种类和子节点，叶子节点持有一个词法单元。空白、注释等附加信息同样是叶子，
 * 按源码顺序与有效子节点交错排列，因此整棵树的叶子依次拼接即为源码。</p>
 */
public final class SyntaxNode {
    private final SyntaxKind kind;
    private final Token token;
    private final List<SyntaxNode> children;
    private SyntaxNode parent;

    private SyntaxNode(SyntaxKind kind, Token token, List<SyntaxNode> children) {
        this.kind = kind;
        this.token = token;
        this.children = children;
    }

    static SyntaxNode composite(SyntaxKind kind) {
        return new SyntaxNode(kind, null, new ArrayList<SyntaxNode>());
    }

    static SyntaxNode leaf(Token token) {
        return new SyntaxNode(null, token, Collections.<SyntaxNode>emptyList());
    }

    void addChild(SyntaxNode child) {
        child.parent = this;
        children.add(child);
    }

    /** 复合节点种类，叶子返回 null */
    public SyntaxKind getKind() {
        return kind;
    }

    /** 叶子的词法单元，复合节点返回 null */
    public Token getToken() {
        return token;
    }

    public TokenType getTokenType() {
        return token == null ? null : token.getType();
    }

    public boolean isLeaf() {
        return token != null;
    }

    public boolean is(SyntaxKind k) {
        return kind == k;
    }

    public boolean is(TokenType type) {
        return token != null && token.getType() == type;
    }

    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public SyntaxNode getParent() {
        return parent;
    }

    /**
     * 附加信息叶子：空白、注释、尾随逗号与分号
     */
    public boolean isTrivia() {
        return token != null && (token.getType().isTrivia() || token.getType() == TokenType.SEMICOLON);
    }

    /**
     * 去掉附加信息叶子后的子节点
     */
    public List<SyntaxNode> getSignificantChildren() {
        List<SyntaxNode> result = new ArrayList<SyntaxNode>();
        for (SyntaxNode child : children) {
            if (!child.isTrivia()) {
                result.add(child);
            }
        }
        return result;
    }

    /** 第一个给定种类的子节点，没有时返回 null */
    public SyntaxNode child(SyntaxKind k) {
        for (SyntaxNode child : children) {
            if (child.kind == k) return child;
        }
        return null;
    }

    /** 第一个给定类型的叶子子节点，没有时返回 null */
    public SyntaxNode leaf(TokenType type) {
        for (SyntaxNode child : children) {
            if (child.is(type)) return child;
        }
        return null;
    }

    public String getText() {
        if (token != null) {
            return token.getLexeme();
        }
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        if (token != null) {
            sb.append(token.getLexeme());
            return;
        }
        for (SyntaxNode child : children) {
            child.appendText(sb);
        }
    }

    /**
     * 按源码顺序收集全部叶子
     */
    public List<SyntaxNode> getLeaves() {
        List<SyntaxNode> leaves = new ArrayList<SyntaxNode>();
        collectLeaves(leaves);
        return leaves;
    }

    private void collectLeaves(List<SyntaxNode> leaves) {
        if (token != null) {
            leaves.add(this);
            return;
        }
        for (SyntaxNode child : children) {
            child.collectLeaves(leaves);
        }
    }

    /** 起始偏移，空的复合节点返回 -1 */
    public int getStartOffset() {
        if (token != null) return token.getOffset();
        for (SyntaxNode child : children) {
            int offset = child.getStartOffset();
            if (offset >= 0) return offset;
        }
        return -1;
    }

    @Override
    public String toString() {
        return token != null ? token.toString() : kind + "[" + children.size() + "]";
    }

    /**
     * 缩进形式的树结构，调试用
     */
    public String toTreeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        if (token != null) {
            sb.append(token.getType()).append(" '").append(token.getLexeme().replace("\n", "\\n")).append("'\n");
            return;
        }
        sb.append(kind).append('\n');
        for (SyntaxNode child : children) {
            child.appendTree(sb, depth + 1);
        }
    }
}
