package com.ktast.ast.modifier;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 关键词/运算符节点：既是语法树叶子，也是固定文本的载体
 */
public final class Keyword extends Node implements Modifier {
    private final Type type;

    public Keyword(Type type) {
        this.type = required(type, "type");
    }

    public static Keyword of(Type type) {
        return new Keyword(type);
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return type.getText();
    }

    public boolean is(Type other) {
        return type == other;
    }

    public boolean hasRole(Role role) {
        return type.hasRole(role);
    }

    /**
     * 校验关键词角色，供其它节点的构造器使用；null 视为缺省字段
     */
    public static Keyword requireRole(Keyword keyword, Role role, String field) {
        if (keyword != null && !keyword.hasRole(role)) {
            throw new IllegalArgumentException(field + " must be a " + role.name().toLowerCase()
                    + " keyword, got '" + keyword.getText() + "'");
        }
        return keyword;
    }

    /**
     * 校验关键词为给定类型之一；null 视为缺省字段
     */
    public static Keyword requireType(Keyword keyword, String field, Type... types) {
        if (keyword == null) return null;
        for (Type t : types) {
            if (keyword.type == t) return keyword;
        }
        throw new IllegalArgumentException(field + " must not be '" + keyword.getText() + "'");
    }

    @Override
    protected Object[] slots() {
        return new Object[]{type};
    }

    @Override
    public String getKindName() {
        return "Keyword." + type.name();
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("text", getText());
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitKeyword(this, context);
    }

    /**
     * 关键词在语法中的角色
     */
    public enum Role {
        PUNCTUATION,
        DECLARATION,
        CLASS_KIND,
        VAL_OR_VAR,
        MODIFIER,
        ANNOTATION_TARGET,
        BINARY_OPERATOR,
        PREFIX_OPERATOR,
        POSTFIX_OPERATOR,
        TYPE_OPERATOR,
        WHEN_OPERATOR,
        DELEGATION_TARGET,
        CONTROL
    }

    /**
     * 关键词类型，每个常量对应一个词法关键词或运算符
     */
    public enum Type {
        // ============ 标点 ============
        LPAR("(", Role.PUNCTUATION),
        RPAR(")", Role.PUNCTUATION),
        LBRACKET("[", Role.PUNCTUATION),
        RBRACKET("]", Role.PUNCTUATION),
        AT("@", Role.PUNCTUATION),
        COLON(":", Role.PUNCTUATION),
        COMMA(",", Role.PUNCTUATION),
        ARROW("->", Role.PUNCTUATION),

        // ============ 声明 ============
        PACKAGE("package", Role.DECLARATION),
        IMPORT("import", Role.DECLARATION),
        CLASS("class", Role.CLASS_KIND),
        OBJECT("object", Role.CLASS_KIND),
        INTERFACE("interface", Role.CLASS_KIND),
        FUN("fun", Role.DECLARATION, Role.MODIFIER),
        VAL("val", Role.VAL_OR_VAR),
        VAR("var", Role.VAL_OR_VAR),
        CONSTRUCTOR("constructor", Role.DECLARATION),
        BY("by", Role.DECLARATION),
        WHERE("where", Role.DECLARATION),
        CONTRACT("contract", Role.DECLARATION),
        GET("get", Role.DECLARATION, Role.ANNOTATION_TARGET),
        SET("set", Role.DECLARATION, Role.ANNOTATION_TARGET),
        THIS("this", Role.DELEGATION_TARGET),
        SUPER("super", Role.DELEGATION_TARGET),

        // ============ 控制流 ============
        IF("if", Role.CONTROL),
        ELSE("else", Role.CONTROL),
        FOR("for", Role.CONTROL),
        WHILE("while", Role.CONTROL),
        DO("do", Role.CONTROL),
        WHEN("when", Role.CONTROL),
        CATCH("catch", Role.CONTROL),

        // ============ 注解目标 ============
        FILE("file", Role.ANNOTATION_TARGET),
        FIELD("field", Role.ANNOTATION_TARGET),
        PROPERTY("property", Role.ANNOTATION_TARGET),
        RECEIVER("receiver", Role.ANNOTATION_TARGET),
        PARAM("param", Role.ANNOTATION_TARGET),
        SETPARAM("setparam", Role.ANNOTATION_TARGET),
        DELEGATE("delegate", Role.ANNOTATION_TARGET),

        // ============ 运算符 ============
        DOT(".", Role.BINARY_OPERATOR),
        SAFE_DOT("?.", Role.BINARY_OPERATOR),
        ASTERISK("*", Role.BINARY_OPERATOR),
        SLASH("/", Role.BINARY_OPERATOR),
        PERCENT("%", Role.BINARY_OPERATOR),
        PLUS("+", Role.BINARY_OPERATOR, Role.PREFIX_OPERATOR),
        MINUS("-", Role.BINARY_OPERATOR, Role.PREFIX_OPERATOR),
        RANGE("..", Role.BINARY_OPERATOR),
        RANGE_UNTIL("..<", Role.BINARY_OPERATOR),
        ELVIS("?:", Role.BINARY_OPERATOR),
        IN("in", Role.BINARY_OPERATOR, Role.WHEN_OPERATOR, Role.MODIFIER),
        NOT_IN("!in", Role.BINARY_OPERATOR, Role.WHEN_OPERATOR),
        LT("<", Role.BINARY_OPERATOR),
        GT(">", Role.BINARY_OPERATOR),
        LE("<=", Role.BINARY_OPERATOR),
        GE(">=", Role.BINARY_OPERATOR),
        EQ_EQ("==", Role.BINARY_OPERATOR),
        NOT_EQ("!=", Role.BINARY_OPERATOR),
        EQ_EQ_EQ("===", Role.BINARY_OPERATOR),
        NOT_EQ_EQ("!==", Role.BINARY_OPERATOR),
        AND_AND("&&", Role.BINARY_OPERATOR),
        OR_OR("||", Role.BINARY_OPERATOR),
        EQUAL("=", Role.BINARY_OPERATOR, Role.PUNCTUATION),
        PLUS_EQ("+=", Role.BINARY_OPERATOR),
        MINUS_EQ("-=", Role.BINARY_OPERATOR),
        ASTERISK_EQ("*=", Role.BINARY_OPERATOR),
        SLASH_EQ("/=", Role.BINARY_OPERATOR),
        PERCENT_EQ("%=", Role.BINARY_OPERATOR),
        PLUS_PLUS("++", Role.PREFIX_OPERATOR, Role.POSTFIX_OPERATOR),
        MINUS_MINUS("--", Role.PREFIX_OPERATOR, Role.POSTFIX_OPERATOR),
        NOT("!", Role.PREFIX_OPERATOR),
        NOT_NOT("!!", Role.POSTFIX_OPERATOR),
        AS("as", Role.TYPE_OPERATOR, Role.DECLARATION),
        AS_SAFE("as?", Role.TYPE_OPERATOR),
        IS("is", Role.TYPE_OPERATOR, Role.WHEN_OPERATOR),
        NOT_IS("!is", Role.TYPE_OPERATOR, Role.WHEN_OPERATOR),

        // ============ 修饰符 ============
        ABSTRACT("abstract", Role.MODIFIER),
        FINAL("final", Role.MODIFIER),
        OPEN("open", Role.MODIFIER),
        ANNOTATION("annotation", Role.MODIFIER),
        SEALED("sealed", Role.MODIFIER),
        DATA("data", Role.MODIFIER),
        OVERRIDE("override", Role.MODIFIER),
        LATEINIT("lateinit", Role.MODIFIER),
        INNER("inner", Role.MODIFIER),
        ENUM("enum", Role.MODIFIER),
        COMPANION("companion", Role.MODIFIER),
        VALUE("value", Role.MODIFIER),
        PRIVATE("private", Role.MODIFIER),
        PROTECTED("protected", Role.MODIFIER),
        PUBLIC("public", Role.MODIFIER),
        INTERNAL("internal", Role.MODIFIER),
        OUT("out", Role.MODIFIER),
        NOINLINE("noinline", Role.MODIFIER),
        CROSSINLINE("crossinline", Role.MODIFIER),
        VARARG("vararg", Role.MODIFIER),
        REIFIED("reified", Role.MODIFIER),
        TAILREC("tailrec", Role.MODIFIER),
        OPERATOR("operator", Role.MODIFIER),
        INFIX("infix", Role.MODIFIER),
        INLINE("inline", Role.MODIFIER),
        EXTERNAL("external", Role.MODIFIER),
        SUSPEND("suspend", Role.MODIFIER),
        CONST("const", Role.MODIFIER),
        ACTUAL("actual", Role.MODIFIER),
        EXPECT("expect", Role.MODIFIER);

        private static final Map<String, Type> MODIFIERS_BY_TEXT;

        static {
            Map<String, Type> map = new HashMap<String, Type>();
            for (Type t : values()) {
                if (t.hasRole(Role.MODIFIER)) {
                    map.put(t.text, t);
                }
            }
            MODIFIERS_BY_TEXT = Collections.unmodifiableMap(map);
        }

        private final String text;
        private final Set<Role> roles;

        Type(String text, Role first, Role... rest) {
            this.text = text;
            this.roles = Collections.unmodifiableSet(EnumSet.of(first, rest));
        }

        public String getText() {
            return text;
        }

        public boolean hasRole(Role role) {
            return roles.contains(role);
        }

        /**
         * 按文本查找给定角色的关键词类型，找不到返回 null
         */
        public static Type fromText(String text, Role role) {
            for (Type t : values()) {
                if (t.text.equals(text) && t.hasRole(role)) {
                    return t;
                }
            }
            return null;
        }

        /** 文本是否与某个修饰符关键词相同（Writer 的分号启发式使用） */
        public static boolean isModifierText(String text) {
            return MODIFIERS_BY_TEXT.containsKey(text);
        }
    }
}
