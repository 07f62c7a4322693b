package com.ktast.ast.expr;

import com.ktast.ast.Statement;

/**
 * 表达式基类
 */
public abstract class Expression extends Statement {
}
