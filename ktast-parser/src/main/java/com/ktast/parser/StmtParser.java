package com.ktast.parser;

import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.TreeBuilder;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final KotlinParser parser;

    StmtParser(KotlinParser parser) {
        this.parser = parser;
    }

    /**
     * 解析语句序列直到 closer（不消耗 closer）；出错的语句记录错误后跳到下一行继续
     */
    void parseStatements(TokenType closer, KotlinParser.Context context) {
        while (true) {
            parser.skipSemicolons();
            if (parser.eof() || parser.check(closer)) return;
            TreeBuilder.Marker start = parser.mark();
            try {
                parseStatement(context);
                expectSeparator(context);
                start.drop();
            } catch (ParseException e) {
                start.rollbackTo();
                parser.reportError(e);
                parser.recoverLine(closer);
            }
        }
    }

    /**
     * 文件顶层和类体中，后面紧跟另一个声明时可以省略换行或分号；语句之间必须分隔
     */
    private void expectSeparator(KotlinParser.Context context) {
        if (parser.atStatementEnd()) return;
        if ((context == KotlinParser.Context.FILE || context == KotlinParser.Context.CLASS)
                && parser.lookahead(() -> parser.declParser.tryParseDeclaration(context))) {
            return;
        }
        parser.expectStatementEnd();
    }

    private void parseStatement(KotlinParser.Context context) {
        if (parser.declParser.tryParseDeclaration(context)) {
            return;
        }
        switch (context) {
            case FILE:
                throw parser.error("Expecting a top level declaration", null);
            case CLASS:
                throw parser.error("Expecting member declaration", null);
            default:
                parser.exprParser.parseStatementExpression();
        }
    }
}
