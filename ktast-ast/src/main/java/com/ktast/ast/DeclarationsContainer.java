package com.ktast.ast;

import com.ktast.ast.decl.Declaration;

import java.util.List;

/** 直接持有声明列表的节点（文件、类体） */
public interface DeclarationsContainer {
    List<Declaration> getDeclarations();
}
