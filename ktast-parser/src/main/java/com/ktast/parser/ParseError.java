package com.ktast.parser;

/**
 * 词法或语法分析中收集的错误
 */
public final class ParseError {
    private final String description;
    private final int offset;
    private final int line;
    private final int column;

    public ParseError(String description, int offset, int line, int column) {
        this.description = description;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public String getDescription() {
        return description;
    }

    /** 源码中的字符偏移 */
    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return line + ":" + column + ": " + description;
    }
}
