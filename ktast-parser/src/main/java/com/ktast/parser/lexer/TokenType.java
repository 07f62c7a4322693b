package com.ktast.parser.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kotlin 词法单元类型
 */
public enum TokenType {
    // === 附加信息（空白、注释） ===
    WHITE_SPACE,
    EOL_COMMENT,
    BLOCK_COMMENT,
    TRAILING_COMMA,         // 由语法分析器重新标记的枚举项尾随逗号

    // === 字面量 ===
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    CHARACTER_LITERAL,

    // === 字符串 ===
    OPEN_QUOTE,             // " 或 """
    CLOSING_QUOTE,
    REGULAR_STRING_PART,
    ESCAPE_SEQUENCE,
    SHORT_TEMPLATE_ENTRY_START,   // $
    LONG_TEMPLATE_ENTRY_START,    // ${
    LONG_TEMPLATE_ENTRY_END,      // }

    // === 标识符 ===
    IDENTIFIER,

    // === 硬关键词 ===
    AS_KEYWORD("as"),
    AS_SAFE("as?"),
    BREAK_KEYWORD("break"),
    CLASS_KEYWORD("class"),
    CONTINUE_KEYWORD("continue"),
    DO_KEYWORD("do"),
    ELSE_KEYWORD("else"),
    FALSE_KEYWORD("false"),
    FOR_KEYWORD("for"),
    FUN_KEYWORD("fun"),
    IF_KEYWORD("if"),
    IN_KEYWORD("in"),
    INTERFACE_KEYWORD("interface"),
    IS_KEYWORD("is"),
    NULL_KEYWORD("null"),
    OBJECT_KEYWORD("object"),
    PACKAGE_KEYWORD("package"),
    RETURN_KEYWORD("return"),
    SUPER_KEYWORD("super"),
    THIS_KEYWORD("this"),
    THROW_KEYWORD("throw"),
    TRUE_KEYWORD("true"),
    TRY_KEYWORD("try"),
    TYPEALIAS_KEYWORD("typealias"),
    VAL_KEYWORD("val"),
    VAR_KEYWORD("var"),
    WHEN_KEYWORD("when"),
    WHILE_KEYWORD("while"),

    // === 分隔符 ===
    LPAR, RPAR,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COMMA,
    SEMICOLON,
    COLON,
    COLONCOLON,
    DOT,
    SAFE_ACCESS,            // ?.
    ARROW,                  // ->
    AT,
    QUEST,

    // === 运算符 ===
    PLUS, MINUS, MUL, DIV, PERC,
    PLUSPLUS, MINUSMINUS,
    EXCL,                   // !
    EXCLEXCL,               // !!
    EQ,                     // =
    PLUSEQ, MINUSEQ, MULTEQ, DIVEQ, PERCEQ,
    EQEQ, EXCLEQ, EQEQEQ, EXCLEQEQEQ,
    LT, GT, LTEQ, GTEQ,
    ANDAND, OROR,
    AND,                    // & （仅用于确定非空类型）
    ELVIS,                  // ?:
    RANGE,                  // ..
    RANGE_UNTIL,            // ..<
    NOT_IN,                 // !in
    NOT_IS,                 // !is

    // === 特殊 ===
    BAD_CHARACTER,
    EOF;

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();
        for (TokenType t : values()) {
            if (t.keywordText != null && t != AS_SAFE) {
                map.put(t.keywordText, t);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    private final String keywordText;

    TokenType() {
        this(null);
    }

    TokenType(String keywordText) {
        this.keywordText = keywordText;
    }

    /**
     * 硬关键词文本，其它类型为 null
     */
    public String getKeywordText() {
        return keywordText;
    }

    public boolean isKeyword() {
        return keywordText != null;
    }

    /**
     * 空白、注释与重新标记的尾随逗号，语法分析时跳过
     */
    public boolean isTrivia() {
        return this == WHITE_SPACE || this == EOL_COMMENT || this == BLOCK_COMMENT || this == TRAILING_COMMA;
    }

    public boolean isComment() {
        return this == EOL_COMMENT || this == BLOCK_COMMENT;
    }

    /**
     * 按文本查找硬关键词，不是关键词时返回 null
     */
    public static TokenType keyword(String text) {
        return KEYWORDS.get(text);
    }
}
