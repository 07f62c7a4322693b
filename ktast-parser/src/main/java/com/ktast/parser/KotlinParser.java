package com.ktast.parser;

import com.ktast.parser.lexer.Lexer;
import com.ktast.parser.lexer.Token;
import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.SyntaxNode;
import com.ktast.parser.tree.TreeBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.ktast.parser.lexer.TokenType.*;

/**
 * Kotlin 语法分析器（递归下降，产出保留全部词法单元的原始语法树）
 *
 * <p>出错的声明或语句被包装为 ERROR_ELEMENT，分析从下一行继续，错误收集到 {@link ParseResult}。</p>
 */
public class KotlinParser {

    private static final Logger LOGGER = Logger.getLogger(KotlinParser.class.getName());

    /**
     * 声明与语句所在的上下文
     */
    enum Context {
        FILE,
        SCRIPT,
        CLASS,
        BLOCK
    }

    final TreeBuilder builder;
    private final String fileName;
    private final List<ParseError> errors = new ArrayList<ParseError>();
    // true 表示忽略换行（括号内），false 表示换行有意义（代码块内）
    private final Deque<Boolean> newlineModes = new ArrayDeque<Boolean>();

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public KotlinParser(String source, String fileName) {
        this.fileName = fileName;
        Lexer lexer = new Lexer(source, fileName);
        List<Token> tokens = lexer.scanTokens();
        errors.addAll(lexer.getErrors());
        this.builder = new TreeBuilder(tokens);
    }

    public KotlinParser(String source) {
        this(source, "<source>");
    }

    // ============ 入口 ============

    /**
     * 解析 .kt 文件：文件注解、包、导入和顶层声明
     */
    public ParseResult parseFile() {
        return parseRoot(SyntaxKind.FILE, Context.FILE);
    }

    /**
     * 解析 .kts 脚本：顶层允许任意语句
     */
    public ParseResult parseScript() {
        return parseRoot(SyntaxKind.SCRIPT, Context.SCRIPT);
    }

    private ParseResult parseRoot(SyntaxKind kind, Context context) {
        TreeBuilder.Marker root = builder.mark();
        parseHeader();
        stmtParser.parseStatements(EOF, context);
        root.done(kind);
        SyntaxNode tree = builder.build();
        if (!errors.isEmpty()) {
            LOGGER.log(Level.FINE, "{0}: {1} syntax errors", new Object[]{fileName, errors.size()});
        }
        return new ParseResult(tree, errors);
    }

    // ============ 包和导入 ============

    private void parseHeader() {
        while (check(AT) && builder.lookAhead(1) == IDENTIFIER && "file".equals(builder.lookAheadText(1))
                && builder.lookAhead(2) == COLON && builder.adjacent(1)) {
            parseTolerant(declParser::parseAnnotationSet);
            skipSemicolons();
        }
        skipSemicolons();
        if (check(PACKAGE_KEYWORD)) {
            parseTolerant(this::parsePackage);
        }
        skipSemicolons();
        while (checkSoft("import")) {
            parseTolerant(this::parseImport);
            skipSemicolons();
        }
    }

    private void parsePackage() {
        TreeBuilder.Marker marker = mark();
        advance();
        expect(IDENTIFIER, "package name");
        while (check(DOT)) {
            advance();
            expect(IDENTIFIER, "package name");
        }
        marker.done(SyntaxKind.PACKAGE_DIRECTIVE);
        expectStatementEnd();
    }

    private void parseImport() {
        TreeBuilder.Marker marker = mark();
        advance();
        expect(IDENTIFIER, "import name");
        while (check(DOT)) {
            if (builder.lookAhead(1) == MUL) {
                advance();
                advance();
                break;
            }
            advance();
            expect(IDENTIFIER, "import name or '*'");
        }
        if (check(AS_KEYWORD)) {
            TreeBuilder.Marker alias = mark();
            advance();
            expect(IDENTIFIER, "import alias");
            alias.done(SyntaxKind.IMPORT_ALIAS);
        }
        marker.done(SyntaxKind.IMPORT_DIRECTIVE);
        expectStatementEnd();
    }

    // ============ 错误恢复 ============

    /**
     * 执行一段分析；失败时记录错误、回滚，并把出错的一行包装为 ERROR_ELEMENT
     */
    void parseTolerant(Runnable action) {
        TreeBuilder.Marker start = mark();
        try {
            action.run();
            start.drop();
        } catch (ParseException e) {
            start.rollbackTo();
            reportError(e);
            recoverLine(EOF);
        }
    }

    void reportError(ParseException e) {
        Token token = e.getToken() != null ? e.getToken() : builder.getToken();
        errors.add(new ParseError(e.getDescription(), token.getOffset(), token.getLine(), token.getColumn()));
        LOGGER.log(Level.FINE, "Syntax error in {0}: {1}", new Object[]{fileName, e.getMessage()});
    }

    /**
     * 跳过到行尾（花括号配平），跳过的单元归入 ERROR_ELEMENT；至少消耗一个单元
     */
    void recoverLine(TokenType closer) {
        if (eof()) return;
        TreeBuilder.Marker marker = mark();
        int depth = 0;
        do {
            if (check(LBRACE)) {
                depth++;
            } else if (check(RBRACE)) {
                if (depth == 0 && closer == RBRACE) break;
                if (depth > 0) depth--;
            }
            advance();
        } while (!eof() && (depth > 0 || (!builder.newlineBefore() && !check(SEMICOLON)
                && !(closer == RBRACE && check(RBRACE)))));
        marker.done(SyntaxKind.ERROR_ELEMENT);
    }

    /**
     * 语句之后必须是换行、分号、右括号或文件结尾
     */
    void expectStatementEnd() {
        if (atStatementEnd()) return;
        throw error("Unexpected tokens", "newline or ';'");
    }

    boolean atStatementEnd() {
        return check(SEMICOLON) || check(RBRACE) || eof() || builder.newlineBefore();
    }

    // ============ 回溯 ============

    /**
     * 试探性分析的一步，返回 false 或抛出 {@link ParseException} 表示不匹配
     */
    interface Attempt {
        boolean run();
    }

    /**
     * 试探分析：匹配时保留结果，否则回滚到起点（包括其间记录的错误）
     */
    boolean attempt(Attempt attempt) {
        TreeBuilder.Marker start = mark();
        int errorCount = errors.size();
        try {
            if (attempt.run()) {
                start.drop();
                return true;
            }
        } catch (ParseException e) {
            LOGGER.log(Level.FINEST, "Backtracking", e);
        }
        start.rollbackTo();
        errors.subList(errorCount, errors.size()).clear();
        return false;
    }

    /**
     * 只向前看：无论是否匹配都回滚
     */
    boolean lookahead(Attempt attempt) {
        TreeBuilder.Marker start = mark();
        int errorCount = errors.size();
        boolean matched;
        try {
            matched = attempt.run();
        } catch (ParseException e) {
            LOGGER.log(Level.FINEST, "Backtracking", e);
            matched = false;
        }
        start.rollbackTo();
        errors.subList(errorCount, errors.size()).clear();
        return matched;
    }

    void skipSemicolons() {
        while (check(SEMICOLON)) {
            advance();
        }
    }

    // ============ 基础方法 ============

    TreeBuilder.Marker mark() {
        return builder.mark();
    }

    TokenType peek() {
        return builder.getTokenType();
    }

    TokenType peek(int n) {
        return builder.lookAhead(n);
    }

    String text() {
        return builder.getTokenText();
    }

    boolean eof() {
        return builder.eof();
    }

    void advance() {
        builder.advance();
    }

    boolean check(TokenType type) {
        return builder.getTokenType() == type;
    }

    boolean checkAny(TokenType... types) {
        TokenType current = builder.getTokenType();
        for (TokenType type : types) {
            if (current == type) return true;
        }
        return false;
    }

    /**
     * 当前单元是给定文本的软关键词
     */
    boolean checkSoft(String word) {
        return check(IDENTIFIER) && word.equals(builder.getTokenText());
    }

    boolean checkSoft(int n, String word) {
        return builder.lookAhead(n) == IDENTIFIER && word.equals(builder.lookAheadText(n));
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    void expect(TokenType type, String expected) {
        if (!check(type)) {
            throw error("Unexpected token", expected);
        }
        advance();
    }

    void expectSoft(String word) {
        if (!checkSoft(word)) {
            throw error("Unexpected token", "'" + word + "'");
        }
        advance();
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, builder.getToken(), expected);
    }

    // ============ 换行处理 ============

    /**
     * 当前单元之前是否有换行；括号内的换行不计
     */
    boolean newlineBefore() {
        Boolean ignore = newlineModes.peek();
        return (ignore == null || !ignore) && builder.newlineBefore();
    }

    void pushNewlineMode(boolean ignore) {
        newlineModes.push(ignore);
    }

    void popNewlineMode() {
        newlineModes.pop();
    }
}
