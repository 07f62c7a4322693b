package com.ktast.ast.modifier;

/**
 * 后置修饰符：出现在声明签名之后的类型约束或契约子句
 */
public interface PostModifier {
}
