package com.ktast.ast;

import com.ktast.ast.decl.FunctionDeclaration;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.extra.BlankLines;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Extra;
import com.ktast.ast.extra.Semicolon;
import com.ktast.ast.extra.Whitespace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.ktast.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Writer 单元测试
 */
class WriterTest {

    private static List<Extra> ws(String text) {
        return Collections.<Extra>singletonList(new Whitespace(text));
    }

    @Nested
    @DisplayName("启发式输出")
    class HeuristicTests {

        @Test
        @DisplayName("空函数不补多余的空白")
        void testEmptyFunction() {
            assertThat(Writer.write(file(fun("setup")))).isEqualTo("fun setup(){}");
        }

        @Test
        @DisplayName("只在单词相邻时补空格")
        void testProperty() {
            assertThat(Writer.write(file(val("x", integer("1"))))).isEqualTo("val x=1");
        }

        @Test
        @DisplayName("后续声明另起一行")
        void testDeclarationsOnSeparateLines() {
            assertThat(Writer.write(file(val("x", integer("1")), val("y", integer("2")))))
                    .isEqualTo("val x=1\nval y=2");
        }

        @Test
        @DisplayName("块中语句另起一行")
        void testStatementsOnSeparateLines() {
            assertThat(Writer.write(fun("run", name("a"), name("b")))).isEqualTo("fun run(){a\nb}");
        }

        @Test
        @DisplayName("空格规则")
        void testSpaceRules() {
            assertThat(Writer.ADJACENT_WORDS.needsSpace("val", "x")).isTrue();
            assertThat(Writer.ADJACENT_WORDS.needsSpace("x", "=")).isFalse();
            assertThat(Writer.GREATER_BEFORE_EQUALS.needsSpace(">", "=")).isTrue();
            assertThat(Writer.DOUBLED_SIGN.needsSpace("-", "-1")).isTrue();
            assertThat(Writer.DOUBLED_SIGN.needsSpace("-", "+1")).isFalse();
            assertThat(Writer.SLASH_BEFORE_COMMENT.needsSpace("/", "/* c */")).isTrue();
            assertThat(Writer.WORD_BEFORE_AT.needsSpace("fun", "@Suppress")).isTrue();
        }
    }

    @Nested
    @DisplayName("附加信息")
    class ExtrasTests {

        @Test
        @DisplayName("空白原样输出")
        void testWhitespaceVerbatim() {
            PropertyDeclaration property = val("x", integer("1"));
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addAfter(property.getValOrVarKeyword(), ws(" "));
            extras.addAfter(property.getVariables().get(0), ws("  "));
            extras.addAfter(property.getEquals(), ws("\t"));

            assertThat(Writer.write(file(property), extras)).isEqualTo("val x  =\t1");
        }

        @Test
        @DisplayName("内部附加信息写在右花括号之前")
        void testWithinBeforeClosingBrace() {
            FunctionDeclaration function = fun("setup");
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addAfter(function.getFunKeyword(), ws(" "));
            extras.addAfter(function.getParams(), ws(" "));
            extras.addWithin(function.getBody(), Arrays.<Extra>asList(
                    new Whitespace("\n    "), new Comment("// do something", true, true), new Whitespace("\n")));

            assertThat(Writer.write(file(function), extras)).isEqualTo("fun setup() {\n    // do something\n}");
        }

        @Test
        @DisplayName("行注释之后补换行")
        void testLineCommentEndsLine() {
            KotlinFile file = file(val("x", integer("1")), val("y", integer("2")));
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addAfter(file.getDeclarations().get(0), Collections.<Extra>singletonList(
                    new Comment("// first", false, true)));

            assertThat(Writer.write(file, extras)).isEqualTo("val x=1// first\nval y=2");
        }

        @Test
        @DisplayName("已有分号时不再补换行")
        void testSemicolonSeparates() {
            KotlinFile file = file(val("x", integer("1")), val("y", integer("2")));
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addAfter(file.getDeclarations().get(0), Arrays.<Extra>asList(new Semicolon(), new Whitespace(" ")));

            assertThat(Writer.write(file, extras)).isEqualTo("val x=1; val y=2");
        }

        @Test
        @DisplayName("以代码块结尾的声明之后带同一行空白的声明不补换行")
        void testAdjacentMemberAfterBlock() {
            KotlinFile file = file(fun("a"), fun("b"), val("x", integer("1")), val("y", integer("2")));
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addBefore(file.getDeclarations().get(1), ws(" "));

            assertThat(Writer.write(file, extras)).isEqualTo("fun a(){} fun b(){}\nval x=1\nval y=2");
            assertThat(Writer.write(file)).isEqualTo("fun a(){}\nfun b(){}\nval x=1\nval y=2");
        }

        @Test
        @DisplayName("折叠的空行展开为换行")
        void testBlankLines() {
            KotlinFile file = file(val("x", integer("1")), val("y", integer("2")));
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addBefore(file.getDeclarations().get(1), Collections.<Extra>singletonList(new BlankLines(1)));

            assertThat(Writer.write(file, extras)).isEqualTo("val x=1\n\nval y=2");
        }

        @Test
        @DisplayName("注释与单词之间不补空格")
        void testCommentAfterWord() {
            PropertyDeclaration property = val("x", integer("1"));
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addBefore(property.getValOrVarKeyword(), Collections.<Extra>singletonList(
                    new Comment("/** doc */", true, false)));

            assertThat(Writer.write(file(property), extras)).isEqualTo("/** doc */val x=1");
        }
    }
}
