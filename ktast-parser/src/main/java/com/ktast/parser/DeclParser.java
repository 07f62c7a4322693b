package com.ktast.parser;

import com.ktast.ast.modifier.Keyword;
import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.TreeBuilder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.ktast.parser.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    /**
     * 修饰符列表出现的位置，决定哪些单词可以作为修饰符
     */
    enum ModifierMode {
        DECLARATION,
        PARAM,
        TYPE_PARAM,
        TYPE,
        TYPE_ARG
    }

    /** 修饰符集合中代表注解的记号 */
    static final String ANNOTATION = "@";

    final KotlinParser parser;

    DeclParser(KotlinParser parser) {
        this.parser = parser;
    }

    // ============ 修饰符与注解 ============

    /**
     * 解析修饰符列表（可能为空，为空时不产生节点）
     *
     * @return 出现的修饰符文本，注解记为 {@link #ANNOTATION}
     */
    Set<String> parseModifierList(ModifierMode mode) {
        Set<String> found = new LinkedHashSet<String>();
        TreeBuilder.Marker list = parser.mark();
        while (true) {
            if (parser.check(AT) && isAnnotationStart()) {
                parseAnnotationSet();
                found.add(ANNOTATION);
            } else if (mode == ModifierMode.DECLARATION && isContextReceiversAhead()) {
                parseContextReceivers();
                found.add("context");
            } else if (isModifierAhead(mode)) {
                found.add(parser.text());
                parser.advance();
            } else {
                break;
            }
        }
        if (found.isEmpty()) {
            list.drop();
        } else {
            list.done(SyntaxKind.MODIFIER_LIST);
        }
        return found;
    }

    boolean isAnnotationStart() {
        TokenType next = parser.peek(1);
        return (next == IDENTIFIER || next == LBRACKET) && parser.builder.adjacent(1);
    }

    private boolean isModifierAhead(ModifierMode mode) {
        TokenType next = parser.peek(1);
        switch (mode) {
            case DECLARATION:
                if (parser.check(FUN_KEYWORD)) {
                    return next == INTERFACE_KEYWORD;
                }
                return parser.check(IDENTIFIER) && Keyword.Type.isModifierText(parser.text())
                        && isDeclarationFollower(next);
            case PARAM:
                return parser.check(IDENTIFIER) && Keyword.Type.isModifierText(parser.text())
                        && (next == IDENTIFIER || next == AT || next == VAL_KEYWORD || next == VAR_KEYWORD);
            case TYPE_PARAM:
                return (parser.check(IN_KEYWORD) || parser.checkSoft("out") || parser.checkSoft("reified"))
                        && (next == IDENTIFIER || next == AT);
            case TYPE:
                return parser.checkSoft("suspend") && (next == LPAR || next == IDENTIFIER || next == AT);
            case TYPE_ARG:
                return (parser.check(IN_KEYWORD) || parser.checkSoft("out"))
                        && (next == IDENTIFIER || next == AT || next == LPAR);
            default:
                return false;
        }
    }

    private static boolean isDeclarationFollower(TokenType next) {
        switch (next) {
            case IDENTIFIER:
            case AT:
            case FUN_KEYWORD:
            case VAL_KEYWORD:
            case VAR_KEYWORD:
            case CLASS_KEYWORD:
            case INTERFACE_KEYWORD:
            case OBJECT_KEYWORD:
            case TYPEALIAS_KEYWORD:
                return true;
            default:
                return false;
        }
    }

    private boolean isContextReceiversAhead() {
        return parser.checkSoft("context") && parser.peek(1) == LPAR && parser.builder.adjacent(1)
                && parser.lookahead(() -> {
                    parseContextReceivers();
                    return !parser.builder.newlineBefore() || parser.checkAny(FUN_KEYWORD, VAL_KEYWORD, VAR_KEYWORD,
                            CLASS_KEYWORD, INTERFACE_KEYWORD, OBJECT_KEYWORD, AT, IDENTIFIER);
                });
    }

    /**
     * context(A, B)，转换时报告为不支持
     */
    private void parseContextReceivers() {
        TreeBuilder.Marker list = parser.mark();
        parser.advance();
        parser.expect(LPAR, "'('");
        parser.pushNewlineMode(true);
        try {
            do {
                parser.typeParser.parseTypeRef();
            } while (parser.match(COMMA) && !parser.check(RPAR));
            parser.expect(RPAR, "')'");
        } finally {
            parser.popNewlineMode();
        }
        list.done(SyntaxKind.CONTEXT_RECEIVER_LIST);
    }

    /**
     * '@' [目标 ':'] (注解 | '[' 注解+ ']')
     */
    void parseAnnotationSet() {
        TreeBuilder.Marker set = parser.mark();
        parser.expect(AT, "'@'");
        if (parser.check(IDENTIFIER) && parser.peek(1) == COLON && parser.builder.adjacent(1)
                && (parser.peek(2) == IDENTIFIER || parser.peek(2) == LBRACKET)) {
            parser.advance();
            parser.advance();
        }
        if (parser.check(LBRACKET)) {
            parser.advance();
            parser.pushNewlineMode(true);
            try {
                do {
                    parseAnnotation();
                } while (!parser.check(RBRACKET));
                parser.expect(RBRACKET, "']'");
            } finally {
                parser.popNewlineMode();
            }
        } else {
            parseAnnotation();
        }
        set.done(SyntaxKind.ANNOTATION_SET);
    }

    private void parseAnnotation() {
        TreeBuilder.Marker annotation = parser.mark();
        TreeBuilder.Marker type = parser.mark();
        while (true) {
            TreeBuilder.Marker qualifier = parser.mark();
            parser.expect(IDENTIFIER, "annotation name");
            if (parser.check(LT) && parser.builder.adjacent(0)) {
                parser.typeParser.parseTypeArgs();
            }
            if (parser.check(DOT) && parser.builder.adjacent(0) && parser.peek(1) == IDENTIFIER) {
                qualifier.done(SyntaxKind.TYPE_QUALIFIER);
                parser.advance();
            } else {
                qualifier.drop();
                break;
            }
        }
        type.done(SyntaxKind.USER_TYPE);
        if (parser.check(LPAR) && parser.builder.adjacent(0)) {
            parser.exprParser.parseValueArgs();
        }
        annotation.done(SyntaxKind.ANNOTATION);
    }

    // ============ 声明 ============

    /**
     * 尝试解析一个声明；当前位置不是声明时回滚并返回 false
     */
    boolean tryParseDeclaration(KotlinParser.Context context) {
        TreeBuilder.Marker decl = parser.mark();
        Set<String> modifiers = parseModifierList(ModifierMode.DECLARATION);
        SyntaxKind kind = parseDeclarationRest(context, modifiers);
        if (kind == null) {
            decl.rollbackTo();
            return false;
        }
        decl.done(kind);
        return true;
    }

    private SyntaxKind parseDeclarationRest(KotlinParser.Context context, Set<String> modifiers) {
        boolean member = context == KotlinParser.Context.FILE || context == KotlinParser.Context.CLASS;
        switch (parser.peek()) {
            case CLASS_KEYWORD:
            case INTERFACE_KEYWORD:
                parseClass(modifiers);
                return SyntaxKind.CLASS;
            case OBJECT_KEYWORD:
                if (parser.peek(1) != IDENTIFIER && modifiers.isEmpty() && !member) {
                    // 对象表达式
                    return null;
                }
                parseClass(modifiers);
                return SyntaxKind.CLASS;
            case FUN_KEYWORD:
                if (!member && modifiers.isEmpty() && parser.peek(1) == LPAR) {
                    // 匿名函数
                    return null;
                }
                parseFunction();
                return SyntaxKind.FUN;
            case VAL_KEYWORD:
            case VAR_KEYWORD:
                parseProperty(member);
                return SyntaxKind.PROPERTY;
            case TYPEALIAS_KEYWORD:
                parseTypeAlias();
                return SyntaxKind.TYPEALIAS;
            default:
                if (context == KotlinParser.Context.CLASS) {
                    if (parser.checkSoft("constructor") && parser.peek(1) == LPAR) {
                        parseSecondaryConstructor();
                        return SyntaxKind.SECONDARY_CONSTRUCTOR;
                    }
                    if (parser.checkSoft("init") && parser.peek(1) == LBRACE) {
                        parser.advance();
                        parser.exprParser.parseBlock();
                        return SyntaxKind.CLASS_INITIALIZER;
                    }
                }
                return null;
        }
    }

    // ============ 类与对象 ============

    /**
     * class / interface / object，包括对象表达式里的匿名对象
     */
    void parseClass(Set<String> modifiers) {
        boolean isClass = parser.check(CLASS_KEYWORD);
        boolean isObject = parser.check(OBJECT_KEYWORD);
        parser.advance();
        if (parser.check(IDENTIFIER)) {
            parser.advance();
        } else if (!isObject) {
            throw parser.error("Expecting a name", "class name");
        }
        if (parser.check(LT)) {
            parser.typeParser.parseTypeParams();
        }
        if (isClass) {
            parsePrimaryConstructor();
        }
        if (parser.check(COLON)) {
            parser.advance();
            parseSuperTypes();
        }
        if (parser.checkSoft("where")) {
            parser.typeParser.parseTypeConstraints();
        }
        if (parser.check(LBRACE)) {
            parseClassBody(modifiers.contains("enum"));
        }
    }

    private void parsePrimaryConstructor() {
        parser.attempt(() -> {
            if (parser.builder.newlineBefore()) return false;
            TreeBuilder.Marker constructor = parser.mark();
            Set<String> modifiers = parseModifierList(ModifierMode.DECLARATION);
            if (parser.checkSoft("constructor")) {
                parser.advance();
            } else if (!modifiers.isEmpty() || !parser.check(LPAR)) {
                return false;
            }
            parseValueParams();
            constructor.done(SyntaxKind.PRIMARY_CONSTRUCTOR);
            return true;
        });
    }

    private void parseSuperTypes() {
        TreeBuilder.Marker list = parser.mark();
        do {
            TreeBuilder.Marker entry = parser.mark();
            parser.typeParser.parseTypeRef();
            if (parser.check(LPAR) && !parser.builder.newlineBefore()) {
                parser.exprParser.parseValueArgs();
                entry.done(SyntaxKind.SUPER_TYPE_CALL_ENTRY);
            } else if (parser.checkSoft("by")) {
                parser.advance();
                parser.exprParser.parseExpressionNoLambda();
                entry.done(SyntaxKind.DELEGATED_SUPER_TYPE_ENTRY);
            } else {
                entry.done(SyntaxKind.SUPER_TYPE_ENTRY);
            }
        } while (parser.match(COMMA));
        list.done(SyntaxKind.SUPER_TYPE_LIST);
    }

    void parseClassBody(boolean isEnum) {
        TreeBuilder.Marker body = parser.mark();
        parser.expect(LBRACE, "'{'");
        parser.pushNewlineMode(false);
        try {
            if (isEnum) {
                parseEnumEntries();
            }
            parser.stmtParser.parseStatements(RBRACE, KotlinParser.Context.CLASS);
            parser.expect(RBRACE, "'}'");
        } finally {
            parser.popNewlineMode();
        }
        body.done(SyntaxKind.CLASS_BODY);
    }

    private void parseEnumEntries() {
        parser.skipSemicolons();
        while (isEnumEntryStart()) {
            TreeBuilder.Marker entry = parser.mark();
            parseModifierList(ModifierMode.DECLARATION);
            parser.expect(IDENTIFIER, "enum entry name");
            if (parser.check(LPAR)) {
                parser.exprParser.parseValueArgs();
            }
            if (parser.check(LBRACE)) {
                parseClassBody(false);
            }
            entry.done(SyntaxKind.ENUM_ENTRY);
            if (!parser.check(COMMA)) break;
            boolean more = parser.lookahead(() -> {
                parser.advance();
                return isEnumEntryStart();
            });
            if (!more) {
                // 最后一项之后的逗号作为附加信息保留
                parser.builder.remapCurrent(TRAILING_COMMA);
                break;
            }
            parser.advance();
        }
    }

    private boolean isEnumEntryStart() {
        return parser.lookahead(() -> {
            parseModifierList(ModifierMode.DECLARATION);
            if (!parser.check(IDENTIFIER)) return false;
            parser.advance();
            return parser.checkAny(LPAR, LBRACE, COMMA, SEMICOLON, RBRACE) || parser.eof()
                    || parser.builder.newlineBefore();
        });
    }

    // ============ 函数 ============

    /**
     * fun 声明，名字缺省时为匿名函数
     */
    void parseFunction() {
        parser.expect(FUN_KEYWORD, "'fun'");
        if (parser.check(LT)) {
            parser.typeParser.parseTypeParams();
        }
        parser.attempt(() -> {
            boolean safeAccess = parser.typeParser.parseTypeRef(true);
            if (!safeAccess && !parser.match(DOT)) return false;
            return parser.check(IDENTIFIER) || parser.check(LPAR);
        });
        if (parser.check(IDENTIFIER)) {
            parser.advance();
        }
        parseValueParams();
        if (parser.match(COLON)) {
            parser.typeParser.parseTypeRef();
        }
        parsePostModifiers();
        if (parser.match(EQ)) {
            parser.exprParser.parseExpression();
        } else if (parser.check(LBRACE)) {
            parser.exprParser.parseBlock();
        }
    }

    /**
     * 签名之后的 where 约束与 contract 效果
     */
    private void parsePostModifiers() {
        while (true) {
            if (parser.checkSoft("where")) {
                parser.typeParser.parseTypeConstraints();
            } else if (parser.checkSoft("contract") && parser.peek(1) == LBRACKET) {
                parseContract();
            } else {
                return;
            }
        }
    }

    private void parseContract() {
        TreeBuilder.Marker contract = parser.mark();
        parser.advance();
        TreeBuilder.Marker effects = parser.mark();
        parser.expect(LBRACKET, "'['");
        parser.pushNewlineMode(true);
        try {
            while (!parser.check(RBRACKET)) {
                TreeBuilder.Marker effect = parser.mark();
                parser.exprParser.parseExpression();
                effect.done(SyntaxKind.CONTRACT_EFFECT);
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RBRACKET, "']'");
        } finally {
            parser.popNewlineMode();
        }
        effects.done(SyntaxKind.CONTRACT_EFFECTS);
        contract.done(SyntaxKind.CONTRACT);
    }

    void parseValueParams() {
        TreeBuilder.Marker list = parser.mark();
        parser.expect(LPAR, "'('");
        parser.pushNewlineMode(true);
        try {
            while (!parser.check(RPAR)) {
                TreeBuilder.Marker param = parser.mark();
                parseModifierList(ModifierMode.PARAM);
                if (parser.checkAny(VAL_KEYWORD, VAR_KEYWORD)) {
                    parser.advance();
                }
                parser.expect(IDENTIFIER, "parameter name");
                if (parser.match(COLON)) {
                    parser.typeParser.parseTypeRef();
                }
                if (parser.match(EQ)) {
                    parser.exprParser.parseExpression();
                }
                param.done(SyntaxKind.VALUE_PARAMETER);
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAR, "')'");
        } finally {
            parser.popNewlineMode();
        }
        list.done(SyntaxKind.VALUE_PARAMETER_LIST);
    }

    // ============ 属性 ============

    /**
     * @param member 文件或类成员，只有成员属性可以带访问器
     */
    private void parseProperty(boolean member) {
        parser.advance();
        if (parser.check(LT)) {
            parser.typeParser.parseTypeParams();
        }
        if (!parser.check(LPAR)) {
            parser.attempt(() -> {
                boolean safeAccess = parser.typeParser.parseTypeRef(true);
                if (!safeAccess && !parser.match(DOT)) return false;
                return parser.check(IDENTIFIER);
            });
        }
        if (parser.check(LPAR)) {
            parser.advance();
            parser.pushNewlineMode(true);
            try {
                do {
                    parseVariable(true);
                } while (parser.match(COMMA) && !parser.check(RPAR));
                parser.expect(RPAR, "')'");
            } finally {
                parser.popNewlineMode();
            }
        } else {
            parseVariable(false);
        }
        if (parser.checkSoft("where")) {
            parser.typeParser.parseTypeConstraints();
        }
        if (parser.match(EQ)) {
            parser.exprParser.parseExpression();
        } else if (parser.checkSoft("by")) {
            TreeBuilder.Marker delegate = parser.mark();
            parser.advance();
            parser.exprParser.parseExpression();
            delegate.done(SyntaxKind.PROPERTY_DELEGATE);
        }
        if (member) {
            parseAccessors();
        }
    }

    /**
     * 单个变量；解构声明中的变量可以带修饰符
     */
    void parseVariable(boolean destructuring) {
        TreeBuilder.Marker variable = parser.mark();
        if (destructuring) {
            parseModifierList(ModifierMode.PARAM);
        }
        parser.expect(IDENTIFIER, "variable name");
        if (parser.match(COLON)) {
            parser.typeParser.parseTypeRef();
        }
        variable.done(SyntaxKind.VARIABLE);
    }

    private void parseAccessors() {
        while (parser.lookahead(this::isAccessorAhead)) {
            parser.skipSemicolons();
            TreeBuilder.Marker accessor = parser.mark();
            parseModifierList(ModifierMode.DECLARATION);
            if (parser.checkSoft("get")) {
                parseGetter();
                accessor.done(SyntaxKind.GETTER);
            } else {
                parseSetter();
                accessor.done(SyntaxKind.SETTER);
            }
        }
    }

    private boolean isAccessorAhead() {
        parser.skipSemicolons();
        parseModifierList(ModifierMode.DECLARATION);
        if (!parser.checkSoft("get") && !parser.checkSoft("set")) return false;
        TokenType next = parser.peek(1);
        return next == LPAR || next == EQ || next == LBRACE || next == SEMICOLON || next == RBRACE
                || next == EOF || parser.builder.newlineAfterCurrent();
    }

    private void parseGetter() {
        parser.advance();
        if (!parser.check(LPAR)) return;
        parser.advance();
        parser.expect(RPAR, "')'");
        if (parser.match(COLON)) {
            parser.typeParser.parseTypeRef();
        }
        parsePostModifiers();
        parseAccessorBody();
    }

    private void parseSetter() {
        parser.advance();
        if (!parser.check(LPAR)) return;
        parseValueParams();
        parsePostModifiers();
        parseAccessorBody();
    }

    private void parseAccessorBody() {
        if (parser.match(EQ)) {
            parser.exprParser.parseExpression();
        } else if (parser.check(LBRACE)) {
            parser.exprParser.parseBlock();
        } else {
            throw parser.error("Expecting accessor body", "'=' or '{'");
        }
    }

    // ============ 其它声明 ============

    private void parseTypeAlias() {
        parser.advance();
        parser.expect(IDENTIFIER, "type alias name");
        if (parser.check(LT)) {
            parser.typeParser.parseTypeParams();
        }
        parser.expect(EQ, "'='");
        parser.typeParser.parseTypeRef();
    }

    private void parseSecondaryConstructor() {
        parser.advance();
        parseValueParams();
        if (parser.match(COLON)) {
            TreeBuilder.Marker call = parser.mark();
            if (!parser.checkAny(THIS_KEYWORD, SUPER_KEYWORD)) {
                throw parser.error("Expecting a delegation call", "'this' or 'super'");
            }
            parser.advance();
            parser.exprParser.parseValueArgs();
            call.done(SyntaxKind.CONSTRUCTOR_DELEGATION_CALL);
        }
        if (parser.check(LBRACE)) {
            parser.exprParser.parseBlock();
        }
    }

    /**
     * 对象表达式 object : A { ... }
     */
    void parseObjectLiteral() {
        TreeBuilder.Marker literal = parser.mark();
        TreeBuilder.Marker declaration = parser.mark();
        parseClass(Collections.<String>emptySet());
        declaration.done(SyntaxKind.CLASS);
        literal.done(SyntaxKind.OBJECT_LITERAL);
    }

    /**
     * 匿名函数 fun(x: Int) = ...
     */
    void parseAnonymousFunction() {
        TreeBuilder.Marker function = parser.mark();
        TreeBuilder.Marker declaration = parser.mark();
        parseFunction();
        declaration.done(SyntaxKind.FUN);
        function.done(SyntaxKind.ANONYMOUS_FUNCTION);
    }
}
