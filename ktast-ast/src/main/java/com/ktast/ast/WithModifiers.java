package com.ktast.ast;

import com.ktast.ast.modifier.Modifiers;

/** 可携带修饰符的节点 */
public interface WithModifiers {
    /** 无修饰符时为 null */
    Modifiers getModifiers();
}
