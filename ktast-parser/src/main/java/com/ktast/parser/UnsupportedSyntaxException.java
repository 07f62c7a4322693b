package com.ktast.parser;

/**
 * 能识别但语法树无法表示的构造，如上下文接收者、确定非空类型
 */
public class UnsupportedSyntaxException extends RuntimeException {
    private final int offset;

    public UnsupportedSyntaxException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
