package com.ktast.parser;

import com.ktast.ast.Dumper;
import com.ktast.ast.NodeExtrasMap;
import com.ktast.ast.Writer;
import com.ktast.ast.decl.FunctionDeclaration;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.extra.BlankLines;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Extra;
import com.ktast.ast.extra.Semicolon;
import com.ktast.ast.extra.Whitespace;
import com.ktast.parser.tree.SyntaxNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 附加信息归属测试
 */
class ConverterWithExtrasTest {

    private static Parsed<KotlinFile> parse(String source) {
        return new Parser().parseFileWithExtras(source);
    }

    private static PropertyDeclaration property(KotlinFile file, int index) {
        return (PropertyDeclaration) file.getDeclarations().get(index);
    }

    @Test
    @DisplayName("行尾注释归属前一个节点")
    void testTrailingComment() {
        Parsed<KotlinFile> parsed = parse("val x = 1 // one");
        NodeExtrasMap extras = parsed.getExtrasMap();

        assertThat(extras.extrasAfter(property(parsed.getRoot(), 0).getInitializer()))
                .containsExactly(new Whitespace(" "), new Comment("// one", false, true));
    }

    @Test
    @DisplayName("文件开头的注释归属第一个声明")
    void testLeadingComment() {
        Parsed<KotlinFile> parsed = parse("// header\nval x = 1");
        List<Extra> before = parsed.getExtrasMap().extrasBefore(property(parsed.getRoot(), 0));

        assertThat(before).containsExactly(new Comment("// header", true, true), new Whitespace("\n"));
    }

    @Test
    @DisplayName("换行之前的部分归前一个节点，之后的部分归后一个节点")
    void testSplitAtLineBreak() {
        Parsed<KotlinFile> parsed = parse("val x = 1 // one\n    val y = 2");
        NodeExtrasMap extras = parsed.getExtrasMap();

        assertThat(extras.extrasAfter(property(parsed.getRoot(), 0).getInitializer())).containsExactly(
                new Whitespace(" "), new Comment("// one", false, true), new Whitespace("\n"));
        assertThat(extras.extrasBefore(property(parsed.getRoot(), 1))).containsExactly(new Whitespace("    "));
    }

    @Test
    @DisplayName("右花括号之前的附加信息归入代码块内部")
    void testWithinBlock() {
        Parsed<KotlinFile> parsed = parse("fun setup() {\n    // do something\n}");
        FunctionDeclaration function = (FunctionDeclaration) parsed.getRoot().getDeclarations().get(0);

        assertThat(parsed.getExtrasMap().extrasWithin(function.getBody())).containsExactly(
                new Whitespace("\n    "), new Comment("// do something", true, true), new Whitespace("\n"));
    }

    @Test
    @DisplayName("分号和尾随逗号也是附加信息")
    void testSemicolonAndTrailingComma() {
        Parsed<KotlinFile> parsed = parse("val x = 1; val y = 2\nenum class E { A, }");
        NodeExtrasMap extras = parsed.getExtrasMap();

        assertThat(extras.extrasBefore(property(parsed.getRoot(), 1)))
                .containsExactly(new Semicolon(), new Whitespace(" "));
        assertThat(Dumper.dump(parsed.getRoot(), extras, false))
                .contains("AFTER: TrailingComma");
    }

    @Test
    @DisplayName("行尾注释在简要输出中的位置")
    void testDumpOfTrailingComment() {
        Parsed<KotlinFile> parsed = parse("val x = \"\" // x is empty");
        String dump = Dumper.dump(parsed.getRoot(), parsed.getExtrasMap(), false);

        assertThat(dump).contains("    StringLiteralExpression\n    AFTER: Whitespace\n    AFTER: Comment\n");
    }

    @Test
    @DisplayName("按需把多个换行折叠为空行")
    void testCollapseBlankLines() {
        ParserConfig config = new ParserConfig();
        config.setCollapseBlankLines(true);
        Parsed<KotlinFile> parsed = new Parser(config).parseFileWithExtras("val x = 1\n\n\nval y = 2");

        assertThat(parsed.getExtrasMap().extrasBefore(property(parsed.getRoot(), 1)))
                .containsExactly(new BlankLines(1));
        assertThat(parsed.getExtrasMap().extrasAfter(property(parsed.getRoot(), 0).getInitializer()))
                .containsExactly(new Whitespace("\n"));
    }

    /**
     * 同一个原始属性节点转换两次，两个结果都报告给 onNode
     */
    private static class DoubleConverter extends ConverterWithExtras {
        private PropertyDeclaration first;

        @Override
        protected PropertyDeclaration convertProperty(SyntaxNode raw) {
            first = super.convertProperty(raw);
            return super.convertProperty(raw);
        }
    }

    @Test
    @DisplayName("同一原始节点对应多个节点时，附加信息只归最后一个")
    void testLastReportedNodeWins() {
        String source = "// lead\nval x = 1 // one\n";
        DoubleConverter converter = new DoubleConverter();
        KotlinFile file = converter.convertFile(new KotlinParser(source).parseFile().getRoot());
        PropertyDeclaration second = property(file, 0);

        assertThat(converter.first).isEqualTo(second).isNotSameAs(second);
        assertThat(converter.extrasBefore(second))
                .containsExactly(new Comment("// lead", true, true), new Whitespace("\n"));
        assertThat(converter.extrasBefore(converter.first)).isEmpty();
        assertThat(converter.extrasAfter(converter.first.getInitializer())).isEmpty();
        assertThat(Writer.write(file, converter.getExtrasMap())).isEqualTo(source);
    }

    @Test
    @DisplayName("折叠空行后缩进单独保留，夹有空格的空行不折叠")
    void testCollapseBlankLinesWithIndent() {
        ParserConfig config = new ParserConfig();
        config.setCollapseBlankLines(true);
        Parsed<KotlinFile> parsed = new Parser(config).parseFileWithExtras("val x = 1\n\n\n    val y = 2\n  \n  val z = 3");

        assertThat(parsed.getExtrasMap().extrasBefore(property(parsed.getRoot(), 1)))
                .containsExactly(new BlankLines(1), new Whitespace("    "));
        assertThat(parsed.getExtrasMap().extrasBefore(property(parsed.getRoot(), 2)))
                .containsExactly(new Whitespace("  \n  "));
    }
}
