package com.ktast.parser.lexer;

import com.ktast.parser.ParseError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Kotlin 词法分析器
 *
 * <p>产出全部词法单元，空白与注释也作为词法单元保留，源码文本可由各单元依次拼接还原。
 * 字符串模板通过模式栈处理：{@code ${} 进入代码模式，与之配对的 {@code }} 回到字符串模式。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<Token>();
    private final List<ParseError> errors = new ArrayList<ParseError>();
    private final Deque<Mode> modes = new ArrayDeque<Mode>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的词法单元列表
     */
    public List<Token> scanTokens() {
        modes.push(Mode.code(false));
        while (!isAtEnd()) {
            begin();
            Mode mode = modes.peek();
            if (mode.string) {
                scanStringPart(mode);
            } else {
                scanToken(mode);
            }
        }
        if (modes.peek().string || modes.size() > 1) {
            begin();
            error("Unterminated string literal");
        }
        begin();
        tokens.add(new Token(TokenType.EOF, "", line, column, current));
        return tokens;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    // ============ 代码模式 ============

    private void scanToken(Mode mode) {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAR); break;
            case ')': addToken(TokenType.RPAR); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '@': addToken(TokenType.AT); break;

            case '{':
                if (mode.template) mode.braceDepth++;
                addToken(TokenType.LBRACE);
                break;

            case '}':
                if (mode.template && mode.braceDepth == 0) {
                    modes.pop();
                    addToken(TokenType.LONG_TEMPLATE_ENTRY_END);
                } else {
                    if (mode.braceDepth > 0) mode.braceDepth--;
                    addToken(TokenType.RBRACE);
                }
                break;

            case ':':
                addToken(match(':') ? TokenType.COLONCOLON : TokenType.COLON);
                break;

            case '.':
                if (match('.')) {
                    addToken(match('<') ? TokenType.RANGE_UNTIL : TokenType.RANGE);
                } else if (isDigit(peek())) {
                    fraction();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '?':
                if (match('.')) addToken(TokenType.SAFE_ACCESS);
                else if (match(':')) addToken(TokenType.ELVIS);
                else addToken(TokenType.QUEST);
                break;

            case '-':
                if (match('>')) addToken(TokenType.ARROW);
                else if (match('-')) addToken(TokenType.MINUSMINUS);
                else if (match('=')) addToken(TokenType.MINUSEQ);
                else addToken(TokenType.MINUS);
                break;

            case '+':
                if (match('+')) addToken(TokenType.PLUSPLUS);
                else if (match('=')) addToken(TokenType.PLUSEQ);
                else addToken(TokenType.PLUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.MULTEQ : TokenType.MUL);
                break;

            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                    addToken(TokenType.EOL_COMMENT);
                } else if (match('*')) {
                    blockComment();
                } else if (match('=')) {
                    addToken(TokenType.DIVEQ);
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.PERCEQ : TokenType.PERC);
                break;

            case '=':
                if (match('=')) {
                    addToken(match('=') ? TokenType.EQEQEQ : TokenType.EQEQ);
                } else {
                    addToken(TokenType.EQ);
                }
                break;

            case '!':
                if (match('=')) {
                    addToken(match('=') ? TokenType.EXCLEQEQEQ : TokenType.EXCLEQ);
                } else if (match('!')) {
                    addToken(TokenType.EXCLEXCL);
                } else if (matchWord("in")) {
                    addToken(TokenType.NOT_IN);
                } else if (matchWord("is")) {
                    addToken(TokenType.NOT_IS);
                } else {
                    addToken(TokenType.EXCL);
                }
                break;

            case '<':
                addToken(match('=') ? TokenType.LTEQ : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GTEQ : TokenType.GT);
                break;

            case '&':
                addToken(match('&') ? TokenType.ANDAND : TokenType.AND);
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OROR);
                } else {
                    error("Unexpected character '|'");
                }
                break;

            case '"':
                if (peek() == '"' && peekNext() == '"') {
                    advance();
                    advance();
                    addToken(TokenType.OPEN_QUOTE);
                    modes.push(Mode.string(true));
                } else {
                    addToken(TokenType.OPEN_QUOTE);
                    modes.push(Mode.string(false));
                }
                break;

            case '\'':
                character();
                break;

            case '`':
                backtickIdentifier();
                break;

            case ' ':
            case '\t':
            case '\r':
            case '\n':
            case '\f':
                whitespace();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    error("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    private void whitespace() {
        while (!isAtEnd() && isWhitespace(peek())) advance();
        addToken(TokenType.WHITE_SPACE);
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        if (depth > 0) {
            error("Unterminated block comment");
            return;
        }
        addToken(TokenType.BLOCK_COMMENT);
    }

    private void identifier() {
        while (!isAtEnd() && isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = TokenType.keyword(text);
        if (type == TokenType.AS_KEYWORD && match('?')) {
            type = TokenType.AS_SAFE;
        }
        addToken(type != null ? type : TokenType.IDENTIFIER);
    }

    private void backtickIdentifier() {
        while (!isAtEnd() && peek() != '`' && peek() != '\n') advance();
        if (!match('`')) {
            error("Unterminated backtick identifier");
            return;
        }
        addToken(TokenType.IDENTIFIER);
    }

    private void character() {
        if (peek() == '\\') {
            advance();
            if (peek() == 'u') {
                advance();
                for (int i = 0; i < 4 && isHexDigit(peek()); i++) advance();
            } else if (!isAtEnd()) {
                advance();
            }
        } else if (!isAtEnd() && peek() != '\'' && peek() != '\n') {
            advance();
        }
        if (!match('\'')) {
            error("Unterminated character literal");
            return;
        }
        addToken(TokenType.CHARACTER_LITERAL);
    }

    // ============ 数字 ============

    private void number() {
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek()) || peek() == '_') advance();
            integerSuffix();
            return;
        }
        if (source.charAt(start) == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            while (peek() == '0' || peek() == '1' || peek() == '_') advance();
            integerSuffix();
            return;
        }
        advanceDigits();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            fraction();
            return;
        }
        if (peek() == 'e' || peek() == 'E') {
            exponent();
            floatSuffix();
            addToken(TokenType.FLOAT_LITERAL);
            return;
        }
        if (peek() == 'f' || peek() == 'F') {
            advance();
            addToken(TokenType.FLOAT_LITERAL);
            return;
        }
        integerSuffix();
    }

    /** '.' 之后的小数部分，'.' 已消耗 */
    private void fraction() {
        advanceDigits();
        if (peek() == 'e' || peek() == 'E') {
            exponent();
        }
        floatSuffix();
        addToken(TokenType.FLOAT_LITERAL);
    }

    private void exponent() {
        advance();
        if (peek() == '+' || peek() == '-') advance();
        if (!isDigit(peek())) {
            error("Malformed exponent");
            return;
        }
        advanceDigits();
    }

    private void floatSuffix() {
        if (peek() == 'f' || peek() == 'F') advance();
    }

    private void integerSuffix() {
        if (peek() == 'u' || peek() == 'U') advance();
        if (peek() == 'L') advance();
        addToken(TokenType.INTEGER_LITERAL);
    }

    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    // ============ 字符串模式 ============

    private void scanStringPart(Mode mode) {
        char c = peek();
        if (mode.raw && c == '"' && quoteRun() == 3) {
            advance();
            advance();
            advance();
            modes.pop();
            addToken(TokenType.CLOSING_QUOTE);
            return;
        }
        if (!mode.raw && c == '"') {
            advance();
            modes.pop();
            addToken(TokenType.CLOSING_QUOTE);
            return;
        }
        if (!mode.raw && c == '\n') {
            modes.pop();
            error("Unterminated string literal");
            return;
        }
        if (!mode.raw && c == '\\') {
            escape();
            return;
        }
        if (c == '$' && peekNext() == '{') {
            advance();
            advance();
            addToken(TokenType.LONG_TEMPLATE_ENTRY_START);
            modes.push(Mode.code(true));
            return;
        }
        if (c == '$' && (isIdentifierStart(peekNext()) || peekNext() == '`')) {
            advance();
            addToken(TokenType.SHORT_TEMPLATE_ENTRY_START);
            begin();
            if (advance() == '`') {
                backtickIdentifier();
            } else {
                while (!isAtEnd() && isIdentifierPart(peek())) advance();
                String text = source.substring(start, current);
                addToken("this".equals(text) ? TokenType.THIS_KEYWORD : TokenType.IDENTIFIER);
            }
            return;
        }
        regularPart(mode);
    }

    private void regularPart(Mode mode) {
        do {
            char c = peek();
            if (c == '"') {
                if (!mode.raw) break;
                int run = quoteRun();
                if (run == 3) break;
                // 连续多于三个引号时，只有最后三个是结束符
                int literal = run > 3 ? run - 3 : run;
                for (int i = 0; i < literal; i++) advance();
                continue;
            }
            if (!mode.raw && (c == '\\' || c == '\n')) break;
            if (c == '$' && current > start
                    && (peekNext() == '{' || isIdentifierStart(peekNext()) || peekNext() == '`')) {
                break;
            }
            advance();
        } while (!isAtEnd());
        addToken(TokenType.REGULAR_STRING_PART);
    }

    private void escape() {
        advance();
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return;
        }
        char c = advance();
        if (c == 'u') {
            for (int i = 0; i < 4; i++) {
                if (!isHexDigit(peek())) {
                    error("Invalid unicode escape");
                    return;
                }
                advance();
            }
        } else if ("tbnr'\"\\$".indexOf(c) < 0) {
            error("Illegal escape: '\\" + c + "'");
            return;
        }
        addToken(TokenType.ESCAPE_SEQUENCE);
    }

    private int quoteRun() {
        int i = current;
        while (i < source.length() && source.charAt(i) == '"') i++;
        return i - current;
    }

    // ============ 辅助方法 ============

    private void begin() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    /** 匹配紧随的单词，且单词后不再是标识符字符 */
    private boolean matchWord(String word) {
        if (!source.startsWith(word, current)) return false;
        int end = current + word.length();
        if (end < source.length() && isIdentifierPart(source.charAt(end))) return false;
        for (int i = 0; i < word.length(); i++) advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f';
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), startLine, startColumn, start));
    }

    /**
     * 记录错误，已消耗的文本作为 BAD_CHARACTER 保留，保证拼接仍能还原源码
     */
    private void error(String message) {
        errors.add(new ParseError(message, start, startLine, startColumn));
        LOG.fine(String.format("[%s:%d:%d] Lexer error: %s", fileName, startLine, startColumn, message));
        if (current > start) {
            addToken(TokenType.BAD_CHARACTER);
        }
    }

    /**
     * 词法模式：代码（可能位于 ${...} 模板中）或字符串
     */
    private static final class Mode {
        final boolean string;
        final boolean raw;
        final boolean template;
        int braceDepth;

        private Mode(boolean string, boolean raw, boolean template) {
            this.string = string;
            this.raw = raw;
            this.template = template;
        }

        static Mode code(boolean template) {
            return new Mode(false, false, template);
        }

        static Mode string(boolean raw) {
            return new Mode(true, raw, false);
        }
    }
}
