package com.ktast.parser;

import com.ktast.parser.tree.SyntaxNode;

import java.util.Collections;
import java.util.List;

/**
 * 容错解析的结果：原始语法树和收集到的错误列表
 *
 * <p>出错的语句或声明以 ERROR_ELEMENT 节点保留在树中，转换时被跳过。</p>
 */
public final class ParseResult {
    private final SyntaxNode root;
    private final List<ParseError> errors;

    public ParseResult(SyntaxNode root, List<ParseError> errors) {
        this.root = root;
        this.errors = Collections.unmodifiableList(errors);
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
