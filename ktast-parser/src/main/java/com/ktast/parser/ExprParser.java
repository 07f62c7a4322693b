package com.ktast.parser;

import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.TreeBuilder;

import static com.ktast.parser.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>二元运算符按优先级从低到高逐层解析；除 '&&'、'||'、'?:' 外，换行之后的运算符不再延续表达式。</p>
 */
class ExprParser {

    private static final TokenType[][] BINARY_LEVELS = {
            {OROR},
            {ANDAND},
            {EQEQ, EXCLEQ, EQEQEQ, EXCLEQEQEQ},
            {LT, GT, LTEQ, GTEQ},
            {IN_KEYWORD, NOT_IN, IS_KEYWORD, NOT_IS},
            {ELVIS},
            null, // 中缀函数调用
            {RANGE, RANGE_UNTIL},
            {PLUS, MINUS},
            {MUL, DIV, PERC}
    };
    private static final int INFIX_LEVEL = 6;

    private static final TokenType[] ASSIGNMENT_OPERATORS = {EQ, PLUSEQ, MINUSEQ, MULTEQ, DIVEQ, PERCEQ};

    final KotlinParser parser;
    // 为 true 时调用之后的 '{' 不作为尾随 lambda（委托表达式中）
    private boolean noLambdaArg;

    ExprParser(KotlinParser parser) {
        this.parser = parser;
    }

    // ============ 语句级表达式 ============

    /**
     * 语句位置的表达式：允许赋值；独占一行的注解作用于整条语句
     */
    void parseStatementExpression() {
        if (parser.check(AT) && parser.declParser.isAnnotationStart() && isLineAnnotationAhead()) {
            TreeBuilder.Marker annotated = parser.mark();
            while (parser.check(AT) && parser.declParser.isAnnotationStart()) {
                parser.declParser.parseAnnotationSet();
            }
            parseAssignment();
            annotated.done(SyntaxKind.ANNOTATED_EXPRESSION);
            return;
        }
        parseAssignment();
    }

    private boolean isLineAnnotationAhead() {
        return parser.lookahead(() -> {
            while (parser.check(AT) && parser.declParser.isAnnotationStart()) {
                parser.declParser.parseAnnotationSet();
            }
            return parser.builder.newlineBefore();
        });
    }

    private void parseAssignment() {
        TreeBuilder.Marker assignment = parser.mark();
        parseExpression();
        if (parser.checkAny(ASSIGNMENT_OPERATORS) && !parser.builder.newlineBefore()) {
            parser.advance();
            parseExpression();
            assignment.done(SyntaxKind.BINARY_EXPRESSION);
        } else {
            assignment.drop();
        }
    }

    /**
     * if、when、循环等结构的分支体
     */
    private void parseControlBody() {
        if (parser.check(LBRACE)) {
            parseBlock();
        } else {
            parseStatementExpression();
        }
    }

    void parseBlock() {
        TreeBuilder.Marker block = parser.mark();
        parser.expect(LBRACE, "'{'");
        boolean saved = enterNested(false);
        try {
            parser.stmtParser.parseStatements(RBRACE, KotlinParser.Context.BLOCK);
            parser.expect(RBRACE, "'}'");
        } finally {
            leaveNested(saved);
        }
        block.done(SyntaxKind.BLOCK);
    }

    private boolean enterNested(boolean ignoreNewlines) {
        boolean saved = noLambdaArg;
        noLambdaArg = false;
        parser.pushNewlineMode(ignoreNewlines);
        return saved;
    }

    private void leaveNested(boolean saved) {
        parser.popNewlineMode();
        noLambdaArg = saved;
    }

    // ============ 二元表达式 ============

    void parseExpression() {
        parseBinary(0);
    }

    /**
     * 解析表达式，其后的 '{' 留给外层（如 class A : B by b { }）
     */
    void parseExpressionNoLambda() {
        boolean saved = noLambdaArg;
        noLambdaArg = true;
        try {
            parseExpression();
        } finally {
            noLambdaArg = saved;
        }
    }

    private void parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            parseAs();
            return;
        }
        TreeBuilder.Marker left = parser.mark();
        parseBinary(level + 1);
        while (isBinaryOperator(level)) {
            boolean typeOperand = parser.checkAny(IS_KEYWORD, NOT_IS);
            parser.advance();
            if (typeOperand) {
                parser.typeParser.parseTypeRef();
                left.done(SyntaxKind.BINARY_WITH_TYPE);
            } else {
                parseBinary(level + 1);
                left.done(SyntaxKind.BINARY_EXPRESSION);
            }
            left = left.precede();
        }
        left.drop();
    }

    private boolean isBinaryOperator(int level) {
        if (level == INFIX_LEVEL) {
            return parser.check(IDENTIFIER) && !parser.newlineBefore()
                    && parser.lookahead(() -> {
                        parser.advance();
                        return !parser.newlineBefore() && canStartExpression();
                    });
        }
        if (!parser.checkAny(BINARY_LEVELS[level])) return false;
        if (parser.checkAny(OROR, ANDAND, ELVIS)) return true;
        return !parser.newlineBefore();
    }

    private void parseAs() {
        TreeBuilder.Marker left = parser.mark();
        parsePrefix();
        while (parser.checkAny(AS_KEYWORD, AS_SAFE) && !parser.newlineBefore()) {
            parser.advance();
            parser.typeParser.parseTypeRef();
            left.done(SyntaxKind.BINARY_WITH_TYPE);
            left = left.precede();
        }
        left.drop();
    }

    // ============ 一元表达式 ============

    private void parsePrefix() {
        if (parser.checkAny(MINUS, PLUS, EXCL, PLUSPLUS, MINUSMINUS)) {
            TreeBuilder.Marker prefix = parser.mark();
            parser.advance();
            parsePrefix();
            prefix.done(SyntaxKind.PREFIX_EXPRESSION);
            return;
        }
        if (parser.check(AT) && parser.declParser.isAnnotationStart()) {
            TreeBuilder.Marker annotated = parser.mark();
            while (parser.check(AT) && parser.declParser.isAnnotationStart()) {
                parser.declParser.parseAnnotationSet();
            }
            parsePrefix();
            annotated.done(SyntaxKind.ANNOTATED_EXPRESSION);
            return;
        }
        if (isLabelAhead()) {
            TreeBuilder.Marker labeled = parser.mark();
            parser.advance();
            parser.advance();
            parsePrefix();
            labeled.done(SyntaxKind.LABELED_EXPRESSION);
            return;
        }
        parsePostfix();
    }

    /**
     * name@
     */
    private boolean isLabelAhead() {
        return parser.check(IDENTIFIER) && parser.peek(1) == AT && parser.builder.adjacent(1);
    }

    /**
     * @name，紧跟在 this、return 等之后
     */
    private boolean isLabelReferenceAhead() {
        return parser.check(AT) && parser.builder.adjacent(0)
                && parser.peek(1) == IDENTIFIER && parser.builder.adjacent(1);
    }

    private void parsePostfix() {
        TreeBuilder.Marker expr = parser.mark();
        parsePrimary();
        while (true) {
            if (parseCallSuffix()) {
                expr.done(SyntaxKind.CALL_EXPRESSION);
            } else if (parser.check(LBRACKET) && !parser.builder.newlineBefore()) {
                parseIndices();
                expr.done(SyntaxKind.ARRAY_ACCESS_EXPRESSION);
            } else if (parser.checkAny(DOT, SAFE_ACCESS)) {
                parser.advance();
                parseSelector();
                expr.done(SyntaxKind.BINARY_EXPRESSION);
            } else if (parser.check(COLONCOLON) && !parser.builder.newlineBefore()) {
                parser.advance();
                if (parser.match(CLASS_KEYWORD)) {
                    expr.done(SyntaxKind.CLASS_LITERAL);
                } else {
                    parser.expect(IDENTIFIER, "member name");
                    expr.done(SyntaxKind.CALLABLE_REFERENCE);
                }
            } else if (parser.checkAny(PLUSPLUS, MINUSMINUS, EXCLEXCL) && !parser.builder.newlineBefore()) {
                parser.advance();
                expr.done(SyntaxKind.POSTFIX_EXPRESSION);
            } else {
                break;
            }
            expr = expr.precede();
        }
        expr.drop();
    }

    /**
     * '.' 之后的名字及其调用
     */
    private void parseSelector() {
        TreeBuilder.Marker selector = parser.mark();
        parser.expect(IDENTIFIER, "name");
        while (parseCallSuffix()) {
            selector.done(SyntaxKind.CALL_EXPRESSION);
            selector = selector.precede();
        }
        selector.drop();
    }

    /**
     * [类型实参] [实参列表] [尾随 lambda]，三者至少其一（类型实参不能单独出现）
     */
    private boolean parseCallSuffix() {
        if (parser.check(LT) && !parser.builder.newlineBefore()) {
            parser.attempt(() -> {
                parser.typeParser.parseTypeArgs();
                return parser.check(LPAR) && !parser.builder.newlineBefore() || isLambdaArgAhead();
            });
        }
        boolean found = false;
        if (parser.check(LPAR) && !parser.builder.newlineBefore()) {
            parseValueArgs();
            found = true;
        }
        if (isLambdaArgAhead()) {
            parseLambdaArg();
            found = true;
        }
        return found;
    }

    private boolean isLambdaArgAhead() {
        if (noLambdaArg || parser.builder.newlineBefore()) return false;
        if (parser.check(LBRACE)) return true;
        if (isLabelAhead()) return parser.peek(2) == LBRACE;
        if (parser.check(AT) && parser.declParser.isAnnotationStart()) {
            return parser.lookahead(() -> {
                while (parser.check(AT) && parser.declParser.isAnnotationStart()) {
                    parser.declParser.parseAnnotationSet();
                }
                if (isLabelAhead()) {
                    parser.advance();
                    parser.advance();
                }
                return parser.check(LBRACE);
            });
        }
        return false;
    }

    private void parseLambdaArg() {
        TreeBuilder.Marker arg = parser.mark();
        while (parser.check(AT) && parser.declParser.isAnnotationStart()) {
            parser.declParser.parseAnnotationSet();
        }
        if (isLabelAhead()) {
            parser.advance();
            parser.advance();
        }
        parseLambda();
        arg.done(SyntaxKind.LAMBDA_ARGUMENT);
    }

    void parseValueArgs() {
        TreeBuilder.Marker list = parser.mark();
        parser.expect(LPAR, "'('");
        boolean saved = enterNested(true);
        try {
            while (!parser.check(RPAR)) {
                TreeBuilder.Marker arg = parser.mark();
                if (parser.check(IDENTIFIER) && parser.peek(1) == EQ) {
                    parser.advance();
                    parser.advance();
                }
                parser.match(MUL);
                parseExpression();
                arg.done(SyntaxKind.VALUE_ARGUMENT);
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAR, "')'");
        } finally {
            leaveNested(saved);
        }
        list.done(SyntaxKind.VALUE_ARGUMENT_LIST);
    }

    private void parseIndices() {
        parser.expect(LBRACKET, "'['");
        boolean saved = enterNested(true);
        try {
            do {
                parseExpression();
            } while (parser.match(COMMA) && !parser.check(RBRACKET));
            parser.expect(RBRACKET, "']'");
        } finally {
            leaveNested(saved);
        }
    }

    // ============ 基本表达式 ============

    private void parsePrimary() {
        switch (parser.peek()) {
            case INTEGER_LITERAL:
            case FLOAT_LITERAL:
            case CHARACTER_LITERAL:
            case TRUE_KEYWORD:
            case FALSE_KEYWORD:
            case NULL_KEYWORD:
            case IDENTIFIER:
                parser.advance();
                return;
            case OPEN_QUOTE:
                parseStringTemplate();
                return;
            case THIS_KEYWORD:
                parseThis();
                return;
            case SUPER_KEYWORD:
                parseSuper();
                return;
            case LPAR:
                parseParenthesized();
                return;
            case LBRACE:
                parseLambda();
                return;
            case LBRACKET:
                parseCollectionLiteral();
                return;
            case IF_KEYWORD:
                parseIf();
                return;
            case WHEN_KEYWORD:
                parseWhen();
                return;
            case TRY_KEYWORD:
                parseTry();
                return;
            case FOR_KEYWORD:
                parseFor();
                return;
            case WHILE_KEYWORD:
                parseWhile();
                return;
            case DO_KEYWORD:
                parseDoWhile();
                return;
            case THROW_KEYWORD:
                parseThrow();
                return;
            case RETURN_KEYWORD:
                parseReturn();
                return;
            case BREAK_KEYWORD:
                parseJump(SyntaxKind.BREAK);
                return;
            case CONTINUE_KEYWORD:
                parseJump(SyntaxKind.CONTINUE);
                return;
            case OBJECT_KEYWORD:
                parser.declParser.parseObjectLiteral();
                return;
            case FUN_KEYWORD:
                parser.declParser.parseAnonymousFunction();
                return;
            case COLONCOLON: {
                TreeBuilder.Marker reference = parser.mark();
                parser.advance();
                parser.expect(IDENTIFIER, "member name");
                reference.done(SyntaxKind.CALLABLE_REFERENCE);
                return;
            }
            default:
                throw parser.error("Expecting an expression", null);
        }
    }

    private boolean canStartExpression() {
        switch (parser.peek()) {
            case INTEGER_LITERAL:
            case FLOAT_LITERAL:
            case CHARACTER_LITERAL:
            case TRUE_KEYWORD:
            case FALSE_KEYWORD:
            case NULL_KEYWORD:
            case IDENTIFIER:
            case OPEN_QUOTE:
            case THIS_KEYWORD:
            case SUPER_KEYWORD:
            case LPAR:
            case LBRACE:
            case LBRACKET:
            case IF_KEYWORD:
            case WHEN_KEYWORD:
            case TRY_KEYWORD:
            case FOR_KEYWORD:
            case WHILE_KEYWORD:
            case DO_KEYWORD:
            case THROW_KEYWORD:
            case RETURN_KEYWORD:
            case BREAK_KEYWORD:
            case CONTINUE_KEYWORD:
            case OBJECT_KEYWORD:
            case FUN_KEYWORD:
            case COLONCOLON:
            case MINUS:
            case PLUS:
            case EXCL:
            case PLUSPLUS:
            case MINUSMINUS:
            case AT:
                return true;
            default:
                return false;
        }
    }

    private void parseStringTemplate() {
        TreeBuilder.Marker template = parser.mark();
        parser.advance();
        while (!parser.check(CLOSING_QUOTE)) {
            switch (parser.peek()) {
                case REGULAR_STRING_PART:
                case ESCAPE_SEQUENCE:
                    parser.advance();
                    break;
                case SHORT_TEMPLATE_ENTRY_START: {
                    TreeBuilder.Marker entry = parser.mark();
                    parser.advance();
                    if (parser.check(THIS_KEYWORD)) {
                        TreeBuilder.Marker self = parser.mark();
                        parser.advance();
                        self.done(SyntaxKind.THIS_EXPRESSION);
                    } else {
                        parser.expect(IDENTIFIER, "name");
                    }
                    entry.done(SyntaxKind.SHORT_TEMPLATE_ENTRY);
                    break;
                }
                case LONG_TEMPLATE_ENTRY_START: {
                    TreeBuilder.Marker entry = parser.mark();
                    parser.advance();
                    boolean saved = enterNested(true);
                    try {
                        parseExpression();
                        parser.expect(LONG_TEMPLATE_ENTRY_END, "'}'");
                    } finally {
                        leaveNested(saved);
                    }
                    entry.done(SyntaxKind.LONG_TEMPLATE_ENTRY);
                    break;
                }
                default:
                    throw parser.error("Unterminated string", "'\"'");
            }
        }
        parser.advance();
        template.done(SyntaxKind.STRING_TEMPLATE);
    }

    private void parseThis() {
        TreeBuilder.Marker self = parser.mark();
        parser.advance();
        if (isLabelReferenceAhead()) {
            parser.advance();
            parser.advance();
        }
        self.done(SyntaxKind.THIS_EXPRESSION);
    }

    /**
     * super[<类型>][@标签]
     */
    private void parseSuper() {
        TreeBuilder.Marker sup = parser.mark();
        parser.advance();
        if (parser.check(LT) && parser.builder.adjacent(0)) {
            parser.advance();
            parser.typeParser.parseTypeRef();
            parser.expect(GT, "'>'");
        }
        if (isLabelReferenceAhead()) {
            parser.advance();
            parser.advance();
        }
        sup.done(SyntaxKind.SUPER_EXPRESSION);
    }

    private void parseParenthesized() {
        TreeBuilder.Marker parenthesized = parser.mark();
        parser.advance();
        boolean saved = enterNested(true);
        try {
            parseExpression();
            parser.expect(RPAR, "')'");
        } finally {
            leaveNested(saved);
        }
        parenthesized.done(SyntaxKind.PARENTHESIZED);
    }

    private void parseCollectionLiteral() {
        TreeBuilder.Marker literal = parser.mark();
        parser.advance();
        boolean saved = enterNested(true);
        try {
            while (!parser.check(RBRACKET)) {
                parseExpression();
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RBRACKET, "']'");
        } finally {
            leaveNested(saved);
        }
        literal.done(SyntaxKind.COLLECTION_LITERAL);
    }

    // ============ lambda ============

    private void parseLambda() {
        TreeBuilder.Marker lambda = parser.mark();
        parser.expect(LBRACE, "'{'");
        boolean saved = enterNested(false);
        try {
            if (parser.check(ARROW)) {
                parser.advance();
            } else {
                parser.attempt(() -> {
                    TreeBuilder.Marker params = parser.mark();
                    do {
                        parseLambdaParam();
                    } while (parser.match(COMMA) && !parser.check(ARROW));
                    if (!parser.check(ARROW)) return false;
                    params.done(SyntaxKind.LAMBDA_PARAMETER_LIST);
                    parser.advance();
                    return true;
                });
            }
            TreeBuilder.Marker body = parser.mark();
            parser.stmtParser.parseStatements(RBRACE, KotlinParser.Context.BLOCK);
            body.done(SyntaxKind.LAMBDA_BODY);
            parser.expect(RBRACE, "'}'");
        } finally {
            leaveNested(saved);
        }
        lambda.done(SyntaxKind.LAMBDA_EXPRESSION);
    }

    /**
     * x | x: T | (a, b) [: T]，也用于 for 循环变量
     */
    private void parseLambdaParam() {
        TreeBuilder.Marker param = parser.mark();
        if (parser.match(LPAR)) {
            parser.pushNewlineMode(true);
            try {
                do {
                    parser.declParser.parseVariable(true);
                } while (parser.match(COMMA) && !parser.check(RPAR));
                parser.expect(RPAR, "')'");
            } finally {
                parser.popNewlineMode();
            }
            if (parser.match(COLON)) {
                parser.typeParser.parseTypeRef();
            }
        } else {
            parser.declParser.parseVariable(false);
        }
        param.done(SyntaxKind.LAMBDA_PARAMETER);
    }

    // ============ 控制结构 ============

    /**
     * '(' 表达式 ')'
     */
    private void parseCondition() {
        parser.expect(LPAR, "'('");
        boolean saved = enterNested(true);
        try {
            parseExpression();
            parser.expect(RPAR, "')'");
        } finally {
            leaveNested(saved);
        }
    }

    private void parseIf() {
        TreeBuilder.Marker ifExpr = parser.mark();
        parser.advance();
        parseCondition();
        parseControlBody();
        if (parser.check(SEMICOLON) && parser.peek(1) == ELSE_KEYWORD) {
            parser.advance();
        }
        if (parser.match(ELSE_KEYWORD)) {
            parseControlBody();
        }
        ifExpr.done(SyntaxKind.IF);
    }

    private void parseWhen() {
        TreeBuilder.Marker when = parser.mark();
        parser.advance();
        if (parser.match(LPAR)) {
            boolean saved = enterNested(true);
            try {
                if (!parser.declParser.tryParseDeclaration(KotlinParser.Context.BLOCK)) {
                    parseExpression();
                }
                parser.expect(RPAR, "')'");
            } finally {
                leaveNested(saved);
            }
        }
        parser.expect(LBRACE, "'{'");
        boolean saved = enterNested(false);
        try {
            while (true) {
                parser.skipSemicolons();
                if (parser.check(RBRACE) || parser.eof()) break;
                parseWhenEntry();
            }
            parser.expect(RBRACE, "'}'");
        } finally {
            leaveNested(saved);
        }
        when.done(SyntaxKind.WHEN);
    }

    private void parseWhenEntry() {
        TreeBuilder.Marker entry = parser.mark();
        if (parser.match(ELSE_KEYWORD)) {
            parser.expect(ARROW, "'->'");
        } else {
            do {
                parseWhenCondition();
            } while (parser.match(COMMA) && !parser.check(ARROW));
            parser.expect(ARROW, "'->'");
        }
        parseControlBody();
        entry.done(SyntaxKind.WHEN_ENTRY);
        if (!parser.checkAny(SEMICOLON, RBRACE) && !parser.builder.newlineBefore()) {
            throw parser.error("Unexpected tokens", "newline or ';'");
        }
    }

    private void parseWhenCondition() {
        TreeBuilder.Marker condition = parser.mark();
        if (parser.checkAny(IN_KEYWORD, NOT_IN)) {
            parser.advance();
            parseExpression();
        } else if (parser.checkAny(IS_KEYWORD, NOT_IS)) {
            parser.advance();
            parser.typeParser.parseTypeRef();
        } else {
            parseExpression();
        }
        condition.done(SyntaxKind.WHEN_CONDITION);
    }

    private void parseTry() {
        TreeBuilder.Marker tryExpr = parser.mark();
        parser.advance();
        parseBlock();
        boolean handled = false;
        while (parser.checkSoft("catch") && parser.peek(1) == LPAR) {
            TreeBuilder.Marker catchClause = parser.mark();
            parser.advance();
            parser.declParser.parseValueParams();
            parseBlock();
            catchClause.done(SyntaxKind.CATCH);
            handled = true;
        }
        if (parser.checkSoft("finally") && parser.peek(1) == LBRACE) {
            parser.advance();
            parseBlock();
            handled = true;
        }
        if (!handled) {
            throw parser.error("Expecting 'catch' or 'finally'", "'catch' or 'finally'");
        }
        tryExpr.done(SyntaxKind.TRY);
    }

    private void parseFor() {
        TreeBuilder.Marker forExpr = parser.mark();
        parser.advance();
        parser.expect(LPAR, "'('");
        boolean saved = enterNested(true);
        try {
            parseLambdaParam();
            parser.expect(IN_KEYWORD, "'in'");
            parseExpression();
            parser.expect(RPAR, "')'");
        } finally {
            leaveNested(saved);
        }
        parseControlBody();
        forExpr.done(SyntaxKind.FOR);
    }

    private void parseWhile() {
        TreeBuilder.Marker whileExpr = parser.mark();
        parser.advance();
        parseCondition();
        parseControlBody();
        whileExpr.done(SyntaxKind.WHILE);
    }

    private void parseDoWhile() {
        TreeBuilder.Marker doWhile = parser.mark();
        parser.advance();
        parseControlBody();
        parser.skipSemicolons();
        parser.expect(WHILE_KEYWORD, "'while'");
        parseCondition();
        doWhile.done(SyntaxKind.DO_WHILE);
    }

    private void parseThrow() {
        TreeBuilder.Marker throwExpr = parser.mark();
        parser.advance();
        parseExpression();
        throwExpr.done(SyntaxKind.THROW);
    }

    private void parseReturn() {
        TreeBuilder.Marker returnExpr = parser.mark();
        parser.advance();
        if (isLabelReferenceAhead()) {
            parser.advance();
            parser.advance();
        }
        if (!parser.builder.newlineBefore() && canStartExpression()) {
            parseExpression();
        }
        returnExpr.done(SyntaxKind.RETURN);
    }

    private void parseJump(SyntaxKind kind) {
        TreeBuilder.Marker jump = parser.mark();
        parser.advance();
        if (isLabelReferenceAhead()) {
            parser.advance();
            parser.advance();
        }
        jump.done(kind);
    }
}
