package com.ktast.ast;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ktast.ast.extra.Extra;

import java.util.List;
import java.util.Map;

/**
 * 语法树 JSON 转储，供外部工具读取
 *
 * <pre>
 * {"kind": "NameExpression", "attributes": {"text": "x"}}
 * {"kind": "PropertyDeclaration", "children": [...], "after": [{"kind": "Comment", ...}]}
 * </pre>
 */
public final class JsonDumper {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final ExtrasMap extrasMap;

    private JsonDumper(ExtrasMap extrasMap) {
        this.extrasMap = extrasMap;
    }

    public static String toJson(Node root) {
        return toJson(root, null);
    }

    public static String toJson(Node root, ExtrasMap extrasMap) {
        return GSON.toJson(toJsonTree(root, extrasMap));
    }

    public static JsonObject toJsonTree(Node root, ExtrasMap extrasMap) {
        return new JsonDumper(extrasMap).convert(root);
    }

    private JsonObject convert(Node node) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", node.getKindName());
        Map<String, Object> attributes = node.getAttributes();
        if (!attributes.isEmpty()) {
            JsonObject object = new JsonObject();
            for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
                Object value = attribute.getValue();
                if (value instanceof Boolean) {
                    object.addProperty(attribute.getKey(), (Boolean) value);
                } else if (value instanceof Number) {
                    object.addProperty(attribute.getKey(), (Number) value);
                } else {
                    object.addProperty(attribute.getKey(), String.valueOf(value));
                }
            }
            json.add("attributes", object);
        }
        List<Node> children = node.getChildren();
        if (!children.isEmpty()) {
            JsonArray array = new JsonArray();
            for (Node child : children) {
                array.add(convert(child));
            }
            json.add("children", array);
        }
        if (extrasMap != null) {
            addExtras(json, "before", extrasMap.extrasBefore(node));
            addExtras(json, "within", extrasMap.extrasWithin(node));
            addExtras(json, "after", extrasMap.extrasAfter(node));
        }
        return json;
    }

    private void addExtras(JsonObject json, String key, List<Extra> extras) {
        if (extras.isEmpty()) return;
        JsonArray array = new JsonArray();
        for (Extra extra : extras) {
            array.add(convert(extra));
        }
        json.add(key, array);
    }
}
