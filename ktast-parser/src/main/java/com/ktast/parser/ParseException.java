package com.ktast.parser;

import com.ktast.parser.lexer.Token;

/**
 * 语法分析异常，由语句级的错误恢复捕获并转为 {@link ParseError}
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /**
     * 不含位置信息的错误描述
     */
    public String getDescription() {
        String message = super.getMessage();
        return expected == null ? message : message + ", expected: " + expected;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
