package com.ktast.ast;

import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Extra;
import com.ktast.ast.extra.Whitespace;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.ktast.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Dumper 单元测试
 */
class DumperTest {

    @Test
    void testVerboseDump() {
        String expected = "KotlinFile\n"
                + "  PropertyDeclaration\n"
                + "    Keyword.VAL{text=\"val\"}\n"
                + "    Variable\n"
                + "      NameExpression{text=\"x\"}\n"
                + "    Keyword.EQUAL{text=\"=\"}\n"
                + "    ConstantLiteralExpression{text=\"1\", kind=\"INTEGER\"}\n";
        assertEquals(expected, Dumper.dump(file(val("x", integer("1")))));
    }

    @Test
    void testPlainDumpWithExtras() {
        PropertyDeclaration property = val("x", integer("1"));
        KotlinFile file = file(property);
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addAfter(property.getInitializer(), Arrays.<Extra>asList(
                new Whitespace(" "), new Comment("// one", false, true)));
        extras.addWithin(file, Collections.<Extra>singletonList(new Whitespace("\n")));

        String expected = "KotlinFile\n"
                + "  PropertyDeclaration\n"
                + "    Keyword.VAL\n"
                + "    Variable\n"
                + "      NameExpression\n"
                + "    Keyword.EQUAL\n"
                + "    ConstantLiteralExpression\n"
                + "    AFTER: Whitespace\n"
                + "    AFTER: Comment\n"
                + "  WITHIN: Whitespace\n";
        assertEquals(expected, Dumper.dump(file, extras, false));
    }

    @Test
    void testEscapedAttributes() {
        NodeExtrasMap extras = new NodeExtrasMap();
        PropertyDeclaration property = val("x", integer("1"));
        extras.addBefore(property, Collections.<Extra>singletonList(new Whitespace("\n\t")));

        String dump = Dumper.dump(property, extras);
        assertTrue(dump.startsWith("BEFORE: Whitespace{text=\"\\n\\t\"}\nPropertyDeclaration\n"), dump);
    }
}
