package com.ktast.ast.decl;

import com.ktast.ast.Statement;

/**
 * 声明基类
 */
public abstract class Declaration extends Statement {
}
