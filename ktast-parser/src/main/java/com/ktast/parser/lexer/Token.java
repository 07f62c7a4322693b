package com.ktast.parser.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndOffset() {
        return offset + lexeme.length();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /**
     * 同一位置、不同类型的副本（语法分析器重新标记时使用）
     */
    public Token withType(TokenType newType) {
        return new Token(newType, lexeme, line, column, offset);
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d:%d", type, lexeme, line, column);
    }
}
