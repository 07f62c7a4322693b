package com.ktast.parser.tree;

/**
 * 原始语法树的复合节点种类（叶子节点由词法单元类型区分）
 */
public enum SyntaxKind {
    // === 文件 ===
    FILE,
    SCRIPT,
    ERROR_ELEMENT,
    PACKAGE_DIRECTIVE,
    IMPORT_DIRECTIVE,
    IMPORT_ALIAS,

    // === 修饰符 ===
    MODIFIER_LIST,
    ANNOTATION_SET,
    ANNOTATION,
    CONTEXT_RECEIVER_LIST,

    // === 类 ===
    CLASS,
    PRIMARY_CONSTRUCTOR,
    SUPER_TYPE_LIST,
    SUPER_TYPE_CALL_ENTRY,
    DELEGATED_SUPER_TYPE_ENTRY,
    SUPER_TYPE_ENTRY,
    CLASS_BODY,
    ENUM_ENTRY,
    CLASS_INITIALIZER,

    // === 函数与属性 ===
    FUN,
    VALUE_PARAMETER_LIST,
    VALUE_PARAMETER,
    PROPERTY,
    VARIABLE,
    PROPERTY_DELEGATE,
    GETTER,
    SETTER,
    SECONDARY_CONSTRUCTOR,
    CONSTRUCTOR_DELEGATION_CALL,
    TYPEALIAS,
    TYPE_PARAMETER_LIST,
    TYPE_PARAMETER,

    // === 后置修饰符 ===
    TYPE_CONSTRAINT_SET,
    TYPE_CONSTRAINTS,
    TYPE_CONSTRAINT,
    CONTRACT,
    CONTRACT_EFFECTS,
    CONTRACT_EFFECT,

    // === 类型 ===
    TYPE_REFERENCE,
    USER_TYPE,
    TYPE_QUALIFIER,
    NULLABLE_TYPE,
    DYNAMIC_TYPE,
    FUNCTION_TYPE,
    FUNCTION_TYPE_RECEIVER,
    FUNCTION_TYPE_PARAMS,
    FUNCTION_TYPE_PARAM,
    DEFINITELY_NON_NULLABLE_TYPE,
    TYPE_ARGUMENT_LIST,
    TYPE_ARGUMENT,

    // === 表达式 ===
    BINARY_EXPRESSION,      // 包括 '.'、'?.' 与中缀函数调用
    BINARY_WITH_TYPE,
    PREFIX_EXPRESSION,
    POSTFIX_EXPRESSION,
    ANNOTATED_EXPRESSION,
    LABELED_EXPRESSION,
    PARENTHESIZED,
    CALL_EXPRESSION,
    LAMBDA_ARGUMENT,
    VALUE_ARGUMENT_LIST,
    VALUE_ARGUMENT,
    ARRAY_ACCESS_EXPRESSION,
    CALLABLE_REFERENCE,
    CLASS_LITERAL,
    STRING_TEMPLATE,
    SHORT_TEMPLATE_ENTRY,
    LONG_TEMPLATE_ENTRY,
    IF,
    WHEN,
    WHEN_ENTRY,
    WHEN_CONDITION,
    TRY,
    CATCH,
    FOR,
    WHILE,
    DO_WHILE,
    BLOCK,
    LAMBDA_EXPRESSION,
    LAMBDA_PARAMETER_LIST,
    LAMBDA_PARAMETER,       // 也用于 for 循环变量
    LAMBDA_BODY,
    OBJECT_LITERAL,
    ANONYMOUS_FUNCTION,
    THROW,
    RETURN,
    CONTINUE,
    BREAK,
    COLLECTION_LITERAL,
    THIS_EXPRESSION,
    SUPER_EXPRESSION
}
