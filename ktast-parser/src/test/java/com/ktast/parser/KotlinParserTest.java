package com.ktast.parser;

import com.ktast.parser.lexer.TokenType;
import com.ktast.parser.tree.SyntaxKind;
import com.ktast.parser.tree.SyntaxNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 原始语法树与错误恢复测试
 */
class KotlinParserTest {

    private static SyntaxNode find(SyntaxNode node, SyntaxKind kind) {
        if (node.is(kind)) return node;
        for (SyntaxNode child : node.getChildren()) {
            SyntaxNode found = find(child, kind);
            if (found != null) return found;
        }
        return null;
    }

    private static List<SyntaxKind> kinds(List<SyntaxNode> nodes) {
        List<SyntaxKind> kinds = new ArrayList<SyntaxKind>();
        for (SyntaxNode node : nodes) {
            if (!node.isLeaf()) kinds.add(node.getKind());
        }
        return kinds;
    }

    @Nested
    @DisplayName("树结构")
    class StructureTests {

        @Test
        @DisplayName("属性声明的叶子包含空白")
        void testProperty() {
            ParseResult result = new KotlinParser("val x = 1").parseFile();
            SyntaxNode root = result.getRoot();

            assertThat(result.hasErrors()).isFalse();
            assertThat(root.getKind()).isEqualTo(SyntaxKind.FILE);
            SyntaxNode property = root.child(SyntaxKind.PROPERTY);
            assertThat(property).isNotNull();
            assertThat(property.getText()).isEqualTo("val x = 1");
            assertThat(kinds(property.getChildren())).containsExactly(SyntaxKind.VARIABLE);
            assertThat(property.getSignificantChildren()).hasSize(4);
        }

        @Test
        @DisplayName("首尾的附加信息留在外层节点")
        void testTriviaOutsideMarkers() {
            String source = "// head\nfun f() {}\n";
            SyntaxNode root = new KotlinParser(source).parseFile().getRoot();

            SyntaxNode function = root.child(SyntaxKind.FUN);
            assertThat(function.getText()).isEqualTo("fun f() {}");
            assertThat(root.getChildren().get(0).is(TokenType.EOL_COMMENT)).isTrue();
            assertThat(root.getText()).isEqualTo(source);
        }

        @Test
        @DisplayName("根节点文本等于源码")
        void testRootTextEqualsSource() {
            String source = "package a.b\n\nimport c.*\n\nclass A(val x: Int) : B(x) {\n"
                    + "    fun f(): Int = x * 2 // twice\n}\n";
            ParseResult result = new KotlinParser(source).parseFile();
            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getRoot().getText()).isEqualTo(source);
        }

        @Test
        @DisplayName("运算符优先级")
        void testPrecedence() {
            SyntaxNode root = new KotlinParser("val r = a + b * c").parseFile().getRoot();
            SyntaxNode binary = find(root, SyntaxKind.BINARY_EXPRESSION);

            assertThat(binary.getText()).isEqualTo("a + b * c");
            assertThat(binary.getSignificantChildren().get(1).is(TokenType.PLUS)).isTrue();
            assertThat(binary.getSignificantChildren().get(2).getText()).isEqualTo("b * c");
        }

        @Test
        @DisplayName("枚举最后一项后的逗号重新标记为尾随逗号")
        void testEnumTrailingComma() {
            SyntaxNode root = new KotlinParser("enum class E { A, B, }").parseFile().getRoot();
            SyntaxNode body = find(root, SyntaxKind.CLASS_BODY);

            assertThat(body.leaf(TokenType.TRAILING_COMMA)).isNotNull();
            assertThat(kinds(body.getChildren())).containsExactly(SyntaxKind.ENUM_ENTRY, SyntaxKind.ENUM_ENTRY);
        }

        @Test
        @DisplayName("类体中同一行的成员声明之间可以不写分隔符")
        void testAdjacentMembers() {
            ParseResult result = new KotlinParser("class A { fun a() {} fun b() {} }").parseFile();
            SyntaxNode body = find(result.getRoot(), SyntaxKind.CLASS_BODY);

            assertThat(result.getErrors()).isEmpty();
            assertThat(kinds(body.getChildren())).containsExactly(SyntaxKind.FUN, SyntaxKind.FUN);
        }

        @Test
        @DisplayName("构造函数与初始化块写在同一行")
        void testAdjacentConstructorAndInit() {
            ParseResult result = new KotlinParser("class A(x: Int) { constructor() : this(1) { } init { } }")
                    .parseFile();
            SyntaxNode body = find(result.getRoot(), SyntaxKind.CLASS_BODY);

            assertThat(result.getErrors()).isEmpty();
            assertThat(kinds(body.getChildren()))
                    .containsExactly(SyntaxKind.SECONDARY_CONSTRUCTOR, SyntaxKind.CLASS_INITIALIZER);
        }

        @Test
        @DisplayName("文件顶层的声明之间可以不写分隔符")
        void testAdjacentTopLevelDeclarations() {
            ParseResult result = new KotlinParser("fun a() {} val b = 1 fun c() = 2").parseFile();

            assertThat(result.getErrors()).isEmpty();
            assertThat(kinds(result.getRoot().getChildren()))
                    .containsExactly(SyntaxKind.FUN, SyntaxKind.PROPERTY, SyntaxKind.FUN);
        }

        @Test
        @DisplayName("脚本顶层允许语句")
        void testScript() {
            ParseResult result = new KotlinParser("println(\"hi\")").parseScript();
            assertThat(result.hasErrors()).isFalse();
            assertThat(result.getRoot().getKind()).isEqualTo(SyntaxKind.SCRIPT);
            assertThat(result.getRoot().child(SyntaxKind.CALL_EXPRESSION)).isNotNull();
        }
    }

    @Nested
    @DisplayName("错误恢复")
    class RecoveryTests {

        @Test
        @DisplayName("文件顶层不允许表达式")
        void testTopLevelExpression() {
            ParseResult result = new KotlinParser("println(\"hi\")").parseFile();

            assertThat(result.getErrors()).hasSize(1);
            ParseError error = result.getErrors().get(0);
            assertThat(error.getDescription()).isEqualTo("Expecting a top level declaration");
            assertThat(error.getOffset()).isZero();
            assertThat(result.getRoot().child(SyntaxKind.ERROR_ELEMENT)).isNotNull();
        }

        @Test
        @DisplayName("出错的行包装为错误元素，分析从下一行继续")
        void testRecoverAtNextLine() {
            String source = "val = 1\nval y = 2";
            ParseResult result = new KotlinParser(source).parseFile();

            assertThat(result.getErrors()).hasSize(1);
            ParseError error = result.getErrors().get(0);
            assertThat(error.getOffset()).isEqualTo(4);
            assertThat(error.getLine()).isEqualTo(1);
            assertThat(error.getColumn()).isEqualTo(5);
            assertThat(error.getDescription()).contains("variable name");

            SyntaxNode root = result.getRoot();
            assertThat(root.child(SyntaxKind.ERROR_ELEMENT).getText()).isEqualTo("val = 1");
            assertThat(root.child(SyntaxKind.PROPERTY).getText()).isEqualTo("val y = 2");
            assertThat(root.getText()).isEqualTo(source);
        }

        @Test
        @DisplayName("同一行的多条语句之间需要分号")
        void testMissingSeparator() {
            ParseResult result = new KotlinParser("fun f() { a b }").parseFile();
            assertThat(result.getErrors()).extracting(ParseError::getDescription)
                    .containsExactly("Unexpected tokens, expected: newline or ';'");
        }

        @Test
        @DisplayName("顶层声明后面同一行不是声明时仍然要求分隔符")
        void testDeclarationFollowedByExpression() {
            ParseResult result = new KotlinParser("fun a() {} 1").parseFile();
            assertThat(result.getErrors()).extracting(ParseError::getDescription)
                    .containsExactly("Unexpected tokens, expected: newline or ';'");
        }

        @Test
        @DisplayName("词法错误同样收集")
        void testLexerErrors() {
            ParseResult result = new KotlinParser("val x = \"open").parseFile();
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.getErrors()).extracting(ParseError::getDescription)
                    .contains("Unterminated string literal");
        }
    }
}
