package com.ktast.parser;

import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.TreeBuilder;

import static com.ktast.parser.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final KotlinParser parser;

    TypeParser(KotlinParser parser) {
        this.parser = parser;
    }

    void parseTypeRef() {
        parseTypeRef(false);
    }

    /**
     * 解析类型引用
     *
     * @param receiver 接收者模式：限定名只在后面还有类型部分时继续，'?.' 被吞作可空标记
     * @return 是否吞掉了 '?.'
     */
    boolean parseTypeRef(boolean receiver) {
        TreeBuilder.Marker ref = parser.mark();
        boolean safeAccess = false;
        if (parser.check(LPAR) && !isFunctionTypeAhead()) {
            TreeBuilder.Marker nullable = parser.mark();
            parser.advance();
            parser.pushNewlineMode(true);
            try {
                parser.declParser.parseModifierList(DeclParser.ModifierMode.TYPE);
                parseTypeElement(false);
                parser.expect(RPAR, "')'");
            } finally {
                parser.popNewlineMode();
            }
            if (parser.check(QUEST) && !parser.builder.newlineBefore()) {
                parser.advance();
                nullable.done(SyntaxKind.NULLABLE_TYPE);
            } else if (receiver && parser.check(SAFE_ACCESS)) {
                parser.advance();
                nullable.done(SyntaxKind.NULLABLE_TYPE);
                safeAccess = true;
            } else {
                nullable.drop();
            }
        } else {
            parser.declParser.parseModifierList(DeclParser.ModifierMode.TYPE);
            safeAccess = parseTypeElement(receiver);
        }
        ref.done(SyntaxKind.TYPE_REFERENCE);
        return safeAccess;
    }

    private boolean parseTypeElement(boolean receiver) {
        TreeBuilder.Marker type = parser.mark();
        if (parser.check(LPAR)) {
            if (isFunctionTypeAhead()) {
                parseFunctionTypeTail();
                type.done(SyntaxKind.FUNCTION_TYPE);
                return false;
            }
            // 多层括号，转换时报告为不支持
            type.drop();
            return parseTypeRef(receiver);
        }
        if (parser.checkSoft("dynamic") && parser.peek(1) != DOT && parser.peek(1) != LT) {
            parser.advance();
            type.done(SyntaxKind.DYNAMIC_TYPE);
        } else {
            parseUserType(receiver);
            type.done(SyntaxKind.USER_TYPE);
        }

        boolean safeAccess = false;
        if (parser.check(QUEST) && !parser.builder.newlineBefore()) {
            TreeBuilder.Marker nullable = type.precede();
            parser.advance();
            nullable.done(SyntaxKind.NULLABLE_TYPE);
            type = nullable;
        } else if (parser.check(SAFE_ACCESS) && (receiver || parser.peek(1) == LPAR)) {
            TreeBuilder.Marker nullable = type.precede();
            parser.advance();
            nullable.done(SyntaxKind.NULLABLE_TYPE);
            type = nullable;
            safeAccess = true;
        }

        // 带接收者的函数类型 A.() -> B
        boolean receiverAhead = safeAccess ? parser.check(LPAR) : parser.check(DOT) && parser.peek(1) == LPAR;
        if (!receiver && receiverAhead) {
            TreeBuilder.Marker ref = type.precede();
            ref.done(SyntaxKind.TYPE_REFERENCE);
            TreeBuilder.Marker functionReceiver = ref.precede();
            functionReceiver.done(SyntaxKind.FUNCTION_TYPE_RECEIVER);
            TreeBuilder.Marker function = functionReceiver.precede();
            if (!safeAccess) {
                parser.advance();
            }
            parseFunctionTypeTail();
            function.done(SyntaxKind.FUNCTION_TYPE);
            return false;
        }

        if (!receiver && parser.check(AND)) {
            TreeBuilder.Marker intersection = type.precede();
            parser.advance();
            parseTypeElement(false);
            intersection.done(SyntaxKind.DEFINITELY_NON_NULLABLE_TYPE);
        }
        return safeAccess;
    }

    private void parseUserType(boolean receiver) {
        while (true) {
            TreeBuilder.Marker qualifier = parser.mark();
            parser.expect(IDENTIFIER, "type name");
            if (parser.check(LT)) {
                parseTypeArgs();
            }
            boolean more = parser.check(DOT) && parser.peek(1) == IDENTIFIER;
            if (more && receiver) {
                // 接收者类型之后是 '.名字'，只有后面还有类型部分时才继续限定名
                more = parser.peek(2) == DOT || parser.peek(2) == LT
                        || parser.peek(2) == QUEST || parser.peek(2) == SAFE_ACCESS;
            }
            if (!more) {
                qualifier.drop();
                return;
            }
            qualifier.done(SyntaxKind.TYPE_QUALIFIER);
            parser.advance();
        }
    }

    // ============ 函数类型 ============

    boolean isFunctionTypeAhead() {
        return parser.lookahead(() -> {
            parseFunctionTypeParams();
            return parser.check(ARROW);
        });
    }

    private void parseFunctionTypeTail() {
        parseFunctionTypeParams();
        parser.expect(ARROW, "'->'");
        parseTypeRef();
    }

    private void parseFunctionTypeParams() {
        TreeBuilder.Marker params = parser.mark();
        parser.expect(LPAR, "'('");
        parser.pushNewlineMode(true);
        try {
            while (!parser.check(RPAR)) {
                TreeBuilder.Marker param = parser.mark();
                if (parser.check(IDENTIFIER) && parser.peek(1) == COLON) {
                    parser.advance();
                    parser.advance();
                }
                parseTypeRef();
                param.done(SyntaxKind.FUNCTION_TYPE_PARAM);
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAR, "')'");
        } finally {
            parser.popNewlineMode();
        }
        params.done(SyntaxKind.FUNCTION_TYPE_PARAMS);
    }

    // ============ 类型参数与类型实参 ============

    void parseTypeArgs() {
        TreeBuilder.Marker args = parser.mark();
        parser.expect(LT, "'<'");
        parser.pushNewlineMode(true);
        try {
            do {
                TreeBuilder.Marker arg = parser.mark();
                if (!parser.match(MUL)) {
                    parser.declParser.parseModifierList(DeclParser.ModifierMode.TYPE_ARG);
                    parseTypeRef();
                }
                arg.done(SyntaxKind.TYPE_ARGUMENT);
            } while (parser.match(COMMA) && !parser.check(GT));
            parser.expect(GT, "'>'");
        } finally {
            parser.popNewlineMode();
        }
        args.done(SyntaxKind.TYPE_ARGUMENT_LIST);
    }

    void parseTypeParams() {
        TreeBuilder.Marker params = parser.mark();
        parser.expect(LT, "'<'");
        parser.pushNewlineMode(true);
        try {
            do {
                TreeBuilder.Marker param = parser.mark();
                parser.declParser.parseModifierList(DeclParser.ModifierMode.TYPE_PARAM);
                parser.expect(IDENTIFIER, "type parameter name");
                if (parser.match(COLON)) {
                    parseTypeRef();
                }
                param.done(SyntaxKind.TYPE_PARAMETER);
            } while (parser.match(COMMA) && !parser.check(GT));
            parser.expect(GT, "'>'");
        } finally {
            parser.popNewlineMode();
        }
        params.done(SyntaxKind.TYPE_PARAMETER_LIST);
    }

    /**
     * where T : A, U : B
     */
    void parseTypeConstraints() {
        TreeBuilder.Marker set = parser.mark();
        parser.expectSoft("where");
        TreeBuilder.Marker constraints = parser.mark();
        do {
            TreeBuilder.Marker constraint = parser.mark();
            while (parser.check(AT)) {
                parser.declParser.parseAnnotationSet();
            }
            parser.expect(IDENTIFIER, "type parameter name");
            parser.expect(COLON, "':'");
            parseTypeRef();
            constraint.done(SyntaxKind.TYPE_CONSTRAINT);
        } while (parser.match(COMMA));
        constraints.done(SyntaxKind.TYPE_CONSTRAINTS);
        set.done(SyntaxKind.TYPE_CONSTRAINT_SET);
    }
}
