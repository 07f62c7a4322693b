package com.ktast.parser;

import com.ktast.ast.MutableVisitor;
import com.ktast.ast.Node;
import com.ktast.ast.NodeTransformer;
import com.ktast.ast.Writer;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.KotlinScript;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.expr.ConstantLiteralExpression;
import com.ktast.ast.expr.NameExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Parser 入口测试：错误处理、改写后输出
 */
class ParserTest {

    private static NodeTransformer rename(String from, String to) {
        return path -> {
            Node node = path.getNode();
            if (node instanceof NameExpression && from.equals(((NameExpression) node).getText())) {
                return new NameExpression(to);
            }
            return node;
        };
    }

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("默认遇到语法错误时抛出异常")
        void testFailOnError() {
            ParserConfig config = new ParserConfig();
            config.setFileName("Broken.kt");

            ParseFailedException e = catchThrowableOfType(
                    () -> new Parser(config).parseFile("val = 1"), ParseFailedException.class);

            assertThat(e.getFileName()).isEqualTo("Broken.kt");
            assertThat(e.getErrors()).hasSize(1);
            assertThat(e.getErrors().get(0).getOffset()).isEqualTo(4);
            assertThat(e.getMessage()).contains("Broken.kt");
        }

        @Test
        @DisplayName("宽松模式跳过出错的元素")
        void testLenient() {
            ParserConfig config = new ParserConfig();
            config.setFailOnError(false);

            KotlinFile file = new Parser(config).parseFile("val = 1\nval y = 2");

            assertThat(file.getDeclarations()).hasSize(1);
            PropertyDeclaration property = (PropertyDeclaration) file.getDeclarations().get(0);
            assertThat(property.getVariables().get(0).getName().getText()).isEqualTo("y");
        }

        @Test
        @DisplayName("原始分析不抛出异常")
        void testParseRaw() {
            ParseResult result = new Parser().parseRaw("val = 1", false);
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.getRoot().getText()).isEqualTo("val = 1");
        }

        @Test
        @DisplayName("默认配置")
        void testDefaults() {
            ParserConfig config = new Parser().getConfig();
            assertThat(config.getFileName()).isEqualTo("<source>");
            assertThat(config.isFailOnError()).isTrue();
            assertThat(config.isCollapseBlankLines()).isFalse();
        }
    }

    @Nested
    @DisplayName("改写")
    class RewriteTests {

        @Test
        @DisplayName("重命名保留原有空白和分号")
        void testRenameKeepsFormatting() {
            Parsed<KotlinFile> parsed = new Parser().parseFileWithExtras("val x = 1; val y = 2");

            KotlinFile renamed = MutableVisitor.traverse(parsed.getRoot(), parsed.getExtrasMap(), path -> {
                Node node = path.getNode();
                if (node instanceof NameExpression) {
                    String text = ((NameExpression) node).getText();
                    if (text.equals("x")) return new NameExpression("a");
                    if (text.equals("y")) return new NameExpression("b");
                }
                return node;
            });

            assertThat(Writer.write(renamed, parsed.getExtrasMap())).isEqualTo("val a = 1; val b = 2");
        }

        @Test
        @DisplayName("附加信息跟随被替换的节点")
        void testExtrasFollowReplacement() {
            Parsed<KotlinFile> parsed = new Parser().parseFileWithExtras("val x = 1 // one\nval y = x");

            KotlinFile result = MutableVisitor.traverse(parsed.getRoot(), parsed.getExtrasMap(), path -> {
                Node node = path.getNode();
                if (node instanceof ConstantLiteralExpression) {
                    return new ConstantLiteralExpression("2", ConstantLiteralExpression.Kind.INTEGER);
                }
                return node;
            });

            assertThat(Writer.write(result, parsed.getExtrasMap())).isEqualTo("val x = 2 // one\nval y = x");
        }

        @Test
        @DisplayName("所有同名引用一起改写")
        void testRenameReferences() {
            Parsed<KotlinFile> parsed = new Parser().parseFileWithExtras("fun f(x: Int) = x * x");
            KotlinFile result = MutableVisitor.traverse(parsed.getRoot(), parsed.getExtrasMap(), rename("x", "n"));
            assertThat(Writer.write(result, parsed.getExtrasMap())).isEqualTo("fun f(n: Int) = n * n");
        }

        @Test
        @DisplayName("块内注释原样还原，不带附加信息时输出紧凑形式")
        void testBlockComment() {
            String source = "fun setup() {\n    // do something\n}";
            Parsed<KotlinFile> parsed = new Parser().parseFileWithExtras(source);

            assertThat(Writer.write(parsed.getRoot(), parsed.getExtrasMap())).isEqualTo(source);
            assertThat(Writer.write(parsed.getRoot())).isEqualTo("fun setup(){}");
        }

        @Test
        @DisplayName("脚本同样可以带附加信息还原")
        void testScript() {
            String source = "val x = 1\nprintln(x) // show\n";
            Parsed<KotlinScript> parsed = new Parser().parseScriptWithExtras(source);

            assertThat(parsed.getRoot().getStatements()).hasSize(2);
            assertThat(Writer.write(parsed.getRoot(), parsed.getExtrasMap())).isEqualTo(source);
        }

        @Test
        @DisplayName("折叠空行后仍然逐字节还原")
        void testCollapsedBlankLinesRoundTrip() {
            ParserConfig config = new ParserConfig();
            config.setCollapseBlankLines(true);
            String source = "val x = 1\n\n\nval y = 2\n";
            Parsed<KotlinFile> parsed = new Parser(config).parseFileWithExtras(source);

            assertThat(Writer.write(parsed.getRoot(), parsed.getExtrasMap())).isEqualTo(source);
        }

        @Test
        @DisplayName("同一行的成员声明原样还原，不带附加信息时分行输出")
        void testAdjacentMembers() {
            String source = "class A { fun a() {} fun b() {} }\nfun c() {} val d = 1\n";
            Parsed<KotlinFile> parsed = new Parser().parseFileWithExtras(source);

            assertThat(parsed.getRoot().getDeclarations()).hasSize(3);
            assertThat(Writer.write(parsed.getRoot(), parsed.getExtrasMap())).isEqualTo(source);
            String written = Writer.write(parsed.getRoot());
            assertThat(written).isEqualTo("class A{fun a(){}\nfun b(){}}\nfun c(){}\nval d=1");
            assertThat(new Parser().parseFile(written)).isEqualTo(parsed.getRoot());
        }

        @Test
        @DisplayName("折叠空行时保留下一行的缩进")
        void testCollapsedBlankLinesKeepIndent() {
            ParserConfig config = new ParserConfig();
            config.setCollapseBlankLines(true);
            String source = "fun f() {\n\n\n    a()\n}\n";
            Parsed<KotlinFile> parsed = new Parser(config).parseFileWithExtras(source);

            assertThat(Writer.write(parsed.getRoot(), parsed.getExtrasMap())).isEqualTo(source);
        }
    }
}
