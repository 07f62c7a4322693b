package com.ktast.parser;

import com.ktast.ast.MutableVisitor;
import com.ktast.ast.Node;
import com.ktast.ast.NodeTransformer;
import com.ktast.ast.Writer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * 样例源码的往返测试
 */
class RoundTripTest {

    private final Parser parser = new Parser();

    private static String load(String name) throws IOException, URISyntaxException {
        URL url = RoundTripTest.class.getResource("/fixtures/" + name);
        assertThat(url).as("fixture %s", name).isNotNull();
        return new String(Files.readAllBytes(Paths.get(url.toURI())), StandardCharsets.UTF_8);
    }

    private Parsed<? extends Node> parseWithExtras(String name, String source) {
        return name.endsWith(".kts") ? parser.parseScriptWithExtras(source) : parser.parseFileWithExtras(source);
    }

    private Node parse(String name, String source) {
        return name.endsWith(".kts") ? parser.parseScript(source) : parser.parseFile(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"basics.kt", "classes.kt", "semicolons.kt", "build.kts"})
    @DisplayName("带附加信息输出与源码逐字节相同")
    void testExactRoundTrip(String name) throws Exception {
        String source = load(name);
        Parsed<? extends Node> parsed = parseWithExtras(name, source);

        assertThat(Writer.write(parsed.getRoot(), parsed.getExtrasMap())).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"basics.kt", "classes.kt", "semicolons.kt", "build.kts"})
    @DisplayName("不带附加信息的输出重新解析得到相同的树")
    void testHeuristicOutputReparses(String name) throws Exception {
        Node tree = parse(name, load(name));
        String written = Writer.write(tree);

        assertThat(parse(name, written)).isEqualTo(tree);
    }

    @ParameterizedTest
    @ValueSource(strings = {"basics.kt", "classes.kt", "semicolons.kt", "build.kts"})
    @DisplayName("恒等变换不改变树和输出")
    void testIdentityTransform(String name) throws Exception {
        String source = load(name);
        Parsed<? extends Node> parsed = parseWithExtras(name, source);

        Node result = MutableVisitor.traverse(parsed.getRoot(), parsed.getExtrasMap(), NodeTransformer.IDENTITY);

        assertThat(result).isSameAs(parsed.getRoot());
        assertThat(Writer.write(result, parsed.getExtrasMap())).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"basics.kt", "classes.kt", "semicolons.kt", "build.kts"})
    @DisplayName("附加信息按节点身份对应，值相等的另一棵树取不到")
    void testExtrasAreIdentityKeyed(String name) throws Exception {
        String source = load(name);
        Parsed<? extends Node> first = parseWithExtras(name, source);
        Parsed<? extends Node> second = parseWithExtras(name, source);

        assertThat(second.getRoot()).isEqualTo(first.getRoot()).isNotSameAs(first.getRoot());
        assertThat(Writer.write(second.getRoot(), first.getExtrasMap()))
                .isEqualTo(Writer.write(second.getRoot()));
    }
}
