package com.ktast.parser.lexer;

import com.ktast.parser.ParseError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    private static List<Token> scan(String source) {
        return new Lexer(source).scanTokens();
    }

    private static List<TokenType> types(String source) {
        List<TokenType> types = new ArrayList<TokenType>();
        for (Token token : scan(source)) {
            types.add(token.getType());
        }
        return types;
    }

    private static String concat(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getLexeme());
        }
        return sb.toString();
    }

    @Nested
    @DisplayName("基本词法单元")
    class BasicTests {

        @Test
        @DisplayName("空白也是词法单元，以 EOF 结尾")
        void testPropertyTokens() {
            assertThat(types("val x = 1")).containsExactly(
                    TokenType.VAL_KEYWORD, TokenType.WHITE_SPACE, TokenType.IDENTIFIER, TokenType.WHITE_SPACE,
                    TokenType.EQ, TokenType.WHITE_SPACE, TokenType.INTEGER_LITERAL, TokenType.EOF);
        }

        @Test
        @DisplayName("拼接全部词法单元还原源码")
        void testConcatenationRestoresSource() {
            String source = "fun f(a: Int) {\n    // note\n    return a /* x */ + 1\n}\n";
            List<Token> tokens = scan(source);
            assertThat(concat(tokens)).isEqualTo(source);
            assertThat(tokens.get(tokens.size() - 1).getLexeme()).isEmpty();
        }

        @Test
        @DisplayName("多字符运算符")
        void testOperators() {
            assertThat(types("a !in b")).contains(TokenType.NOT_IN);
            assertThat(types("a !is B")).contains(TokenType.NOT_IS);
            assertThat(types("!inside")).startsWith(TokenType.EXCL, TokenType.IDENTIFIER);
            assertThat(types("a as? B")).contains(TokenType.AS_SAFE);
            assertThat(types("a?.b ?: c")).contains(TokenType.SAFE_ACCESS, TokenType.ELVIS);
            assertThat(types("a ..< b")).contains(TokenType.RANGE_UNTIL);
            assertThat(types("a === b")).contains(TokenType.EQEQEQ);
        }

        @Test
        @DisplayName("数字字面量")
        void testNumbers() {
            assertThat(types("0x1F")).containsExactly(TokenType.INTEGER_LITERAL, TokenType.EOF);
            assertThat(types("1_000L")).containsExactly(TokenType.INTEGER_LITERAL, TokenType.EOF);
            assertThat(types("1.5e3f")).containsExactly(TokenType.FLOAT_LITERAL, TokenType.EOF);
            assertThat(types(".5")).containsExactly(TokenType.FLOAT_LITERAL, TokenType.EOF);
            assertThat(types("1..2")).containsExactly(
                    TokenType.INTEGER_LITERAL, TokenType.RANGE, TokenType.INTEGER_LITERAL, TokenType.EOF);
        }

        @Test
        @DisplayName("嵌套块注释是一个单元")
        void testNestedBlockComment() {
            assertThat(types("/* a /* b */ c */")).containsExactly(TokenType.BLOCK_COMMENT, TokenType.EOF);
        }

        @Test
        @DisplayName("记录行号和列号")
        void testPositions() {
            List<Token> tokens = scan("val x\n  = 1");
            Token eq = null;
            for (Token token : tokens) {
                if (token.is(TokenType.EQ)) eq = token;
            }
            assertThat(eq).isNotNull();
            assertThat(eq.getLine()).isEqualTo(2);
            assertThat(eq.getColumn()).isEqualTo(3);
            assertThat(eq.getOffset()).isEqualTo(8);
        }
    }

    @Nested
    @DisplayName("字符串")
    class StringTests {

        @Test
        @DisplayName("短模板和长模板")
        void testTemplates() {
            assertThat(types("\"a$b${c}\"")).containsExactly(
                    TokenType.OPEN_QUOTE, TokenType.REGULAR_STRING_PART,
                    TokenType.SHORT_TEMPLATE_ENTRY_START, TokenType.IDENTIFIER,
                    TokenType.LONG_TEMPLATE_ENTRY_START, TokenType.IDENTIFIER, TokenType.LONG_TEMPLATE_ENTRY_END,
                    TokenType.CLOSING_QUOTE, TokenType.EOF);
        }

        @Test
        @DisplayName("模板中的花括号配对")
        void testBracesInsideTemplate() {
            String source = "\"${f { 1 }}\"";
            List<TokenType> types = types(source);
            assertThat(types).containsSubsequence(
                    TokenType.LONG_TEMPLATE_ENTRY_START, TokenType.LBRACE, TokenType.RBRACE,
                    TokenType.LONG_TEMPLATE_ENTRY_END, TokenType.CLOSING_QUOTE);
            assertThat(concat(scan(source))).isEqualTo(source);
        }

        @Test
        @DisplayName("转义序列")
        void testEscape() {
            assertThat(types("\"a\\n\"")).containsExactly(
                    TokenType.OPEN_QUOTE, TokenType.REGULAR_STRING_PART, TokenType.ESCAPE_SEQUENCE,
                    TokenType.CLOSING_QUOTE, TokenType.EOF);
        }

        @Test
        @DisplayName("原始字符串中的单个引号是普通文本")
        void testRawString() {
            List<Token> tokens = scan("\"\"\"a\"b\"\"\"");
            assertThat(tokens).extracting(Token::getLexeme).containsExactly("\"\"\"", "a\"b", "\"\"\"", "");
            assertThat(tokens.get(2).getType()).isEqualTo(TokenType.CLOSING_QUOTE);
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("未知字符保留为 BAD_CHARACTER")
        void testBadCharacter() {
            Lexer lexer = new Lexer("val # = 1");
            List<Token> tokens = lexer.scanTokens();

            assertThat(lexer.getErrors()).hasSize(1);
            ParseError error = lexer.getErrors().get(0);
            assertThat(error.getOffset()).isEqualTo(4);
            assertThat(error.getDescription()).contains("'#'");
            assertThat(tokens).extracting(Token::getType).contains(TokenType.BAD_CHARACTER);
            assertThat(concat(tokens)).isEqualTo("val # = 1");
        }

        @Test
        @DisplayName("未结束的字符串")
        void testUnterminatedString() {
            Lexer lexer = new Lexer("\"abc");
            List<Token> tokens = lexer.scanTokens();

            assertThat(lexer.getErrors()).hasSize(1);
            assertThat(lexer.getErrors().get(0).getDescription()).isEqualTo("Unterminated string literal");
            assertThat(lexer.getErrors().get(0).getOffset()).isEqualTo(4);
            assertThat(concat(tokens)).isEqualTo("\"abc");
        }

        @Test
        @DisplayName("未结束的块注释")
        void testUnterminatedBlockComment() {
            Lexer lexer = new Lexer("/* open");
            List<Token> tokens = lexer.scanTokens();

            assertThat(lexer.getErrors()).extracting(ParseError::getDescription)
                    .containsExactly("Unterminated block comment");
            assertThat(tokens.get(0).getType()).isEqualTo(TokenType.BAD_CHARACTER);
            assertThat(concat(tokens)).isEqualTo("/* open");
        }
    }
}
