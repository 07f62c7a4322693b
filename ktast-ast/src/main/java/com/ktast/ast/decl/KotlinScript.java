package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.Statement;
import com.ktast.ast.StatementsContainer;
import com.ktast.ast.modifier.AnnotationSet;

import java.util.List;

/**
 * 脚本（.kts 文件）：顶层为可执行语句
 */
public final class KotlinScript extends Node implements StatementsContainer {
    private final List<AnnotationSet> annotationSets;
    private final PackageDirective packageDirective;
    private final List<ImportDirective> importDirectives;
    private final List<Statement> statements;

    public KotlinScript(List<AnnotationSet> annotationSets, PackageDirective packageDirective,
                        List<ImportDirective> importDirectives, List<Statement> statements) {
        this.annotationSets = listOf(annotationSets);
        this.packageDirective = packageDirective;
        this.importDirectives = listOf(importDirectives);
        this.statements = listOf(statements);
    }

    public List<AnnotationSet> getAnnotationSets() {
        return annotationSets;
    }

    public PackageDirective getPackageDirective() {
        return packageDirective;
    }

    public List<ImportDirective> getImportDirectives() {
        return importDirectives;
    }

    @Override
    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{annotationSets, packageDirective, importDirectives, statements};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitKotlinScript(this, context);
    }
}
