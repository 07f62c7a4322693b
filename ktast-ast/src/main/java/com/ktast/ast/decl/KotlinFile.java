package com.ktast.ast.decl;

import com.ktast.ast.DeclarationsContainer;
import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.AnnotationSet;

import java.util.List;

/**
 * 编译单元（.kt 文件）：文件注解、包声明、导入列表、顶层声明
 */
public final class KotlinFile extends Node implements DeclarationsContainer {
    private final List<AnnotationSet> annotationSets;
    private final PackageDirective packageDirective;
    private final List<ImportDirective> importDirectives;
    private final List<Declaration> declarations;

    public KotlinFile(List<AnnotationSet> annotationSets, PackageDirective packageDirective,
                      List<ImportDirective> importDirectives, List<Declaration> declarations) {
        this.annotationSets = listOf(annotationSets);
        this.packageDirective = packageDirective;
        this.importDirectives = listOf(importDirectives);
        this.declarations = listOf(declarations);
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
    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{annotationSets, packageDirective, importDirectives, declarations};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitKotlinFile(this, context);
    }
}
