package com.ktast.ast;

/**
 * 输出上下文，跟踪输出缓冲区、上一个输出片段以及换行/分号状态
 */
public class WriterContext {
    private final StringBuilder output = new StringBuilder();
    private String lastText = "";
    private boolean newlineOrSemicolonSinceToken = false;
    private boolean semicolonSinceToken = false;
    private boolean pendingLineCommentNewline = false;

    /**
     * 追加有效文本（关键词、名字、字面量、标点）
     *
     * @param space 是否先补一个空格
     */
    public void appendToken(String text, boolean space) {
        if (text.isEmpty()) return;
        flushLineCommentNewline(text);
        if (space) {
            output.append(' ');
        }
        output.append(text);
        lastText = text;
        newlineOrSemicolonSinceToken = false;
        semicolonSinceToken = false;
    }

    /**
     * 原样追加附加信息文本
     */
    public void appendExtra(String text, boolean space, boolean semicolon, boolean lineComment) {
        if (text.isEmpty()) return;
        flushLineCommentNewline(text);
        if (space) {
            output.append(' ');
        }
        output.append(text);
        lastText = text;
        if (semicolon) {
            newlineOrSemicolonSinceToken = true;
            semicolonSinceToken = true;
        }
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            newlineOrSemicolonSinceToken = true;
        }
        if (lineComment) {
            pendingLineCommentNewline = true;
        }
    }

    /**
     * 启发式换行
     */
    public void newLine() {
        pendingLineCommentNewline = false;
        output.append('\n');
        lastText = "\n";
        newlineOrSemicolonSinceToken = true;
    }

    /**
     * 启发式分号
     */
    public void semicolon() {
        flushLineCommentNewline(";");
        output.append(';');
        lastText = ";";
        newlineOrSemicolonSinceToken = true;
        semicolonSinceToken = true;
    }

    /** 行注释之后的内容必须另起一行 */
    private void flushLineCommentNewline(String next) {
        if (!pendingLineCommentNewline) return;
        pendingLineCommentNewline = false;
        char first = next.charAt(0);
        if (first != '\n' && first != '\r') {
            newLine();
        }
    }

    public String getLastText() {
        return lastText;
    }

    public boolean isNewlineOrSemicolonSinceToken() {
        return newlineOrSemicolonSinceToken;
    }

    public boolean isSemicolonSinceToken() {
        return semicolonSinceToken;
    }

    public String getOutput() {
        return output.toString();
    }
}
