package com.ktast.ast.type;

import com.ktast.ast.Node;

/**
 * 类型基类
 */
public abstract class Type extends Node {
}
