package com.ktast.ast.modifier;

/**
 * 修饰符：关键词修饰符（{@link Keyword}）或注解集（{@link AnnotationSet}）
 */
public interface Modifier {
}
