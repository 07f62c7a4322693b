package com.ktast.ast;

/**
 * 语句基类：声明与表达式都可以出现在语句位置
 */
public abstract class Statement extends Node {
}
