package com.ktast.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Extra;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.ktast.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * JsonDumper 单元测试
 */
class JsonDumperTest {

    @Test
    void testTreeStructure() {
        JsonObject json = JsonDumper.toJsonTree(file(val("x", integer("1"))), null);

        assertThat(json.get("kind").getAsString()).isEqualTo("KotlinFile");
        JsonObject property = json.getAsJsonArray("children").get(0).getAsJsonObject();
        assertThat(property.get("kind").getAsString()).isEqualTo("PropertyDeclaration");
        JsonArray children = property.getAsJsonArray("children");
        assertThat(children.size()).isEqualTo(4);
        JsonObject literal = children.get(3).getAsJsonObject();
        assertThat(literal.get("kind").getAsString()).isEqualTo("ConstantLiteralExpression");
        assertThat(literal.getAsJsonObject("attributes").get("text").getAsString()).isEqualTo("1");
        assertThat(literal.getAsJsonObject("attributes").get("kind").getAsString()).isEqualTo("INTEGER");
        assertThat(literal.has("children")).isFalse();
    }

    @Test
    void testExtrasAndScalarTypes() {
        PropertyDeclaration property = val("x", integer("1"));
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addAfter(property, Collections.<Extra>singletonList(new Comment("// note", false, true)));

        JsonObject json = JsonParser.parseString(JsonDumper.toJson(property, extras)).getAsJsonObject();
        JsonObject comment = json.getAsJsonArray("after").get(0).getAsJsonObject();
        assertThat(comment.get("kind").getAsString()).isEqualTo("Comment");
        JsonObject attributes = comment.getAsJsonObject("attributes");
        assertThat(attributes.get("text").getAsString()).isEqualTo("// note");
        assertThat(attributes.get("startsLine").getAsBoolean()).isFalse();
        assertThat(attributes.get("endsLine").getAsBoolean()).isTrue();
        assertThat(json.has("before")).isFalse();
    }

    @Test
    void testPrettyPrinted() {
        assertThat(JsonDumper.toJson(name("x"))).isEqualTo(
                "{\n  \"kind\": \"NameExpression\",\n  \"attributes\": {\n    \"text\": \"x\"\n  }\n}");
    }
}
