package com.ktast.ast;

import java.util.List;

/** 直接持有语句列表的节点（代码块、lambda 体、脚本） */
public interface StatementsContainer {
    List<Statement> getStatements();
}
