package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 包声明：{@code package a.b.c}
 */
public final class PackageDirective extends Node {
    private final Keyword packageKeyword;
    private final List<NameExpression> names;

    public PackageDirective(Keyword packageKeyword, List<NameExpression> names) {
        this.packageKeyword = Keyword.requireType(required(packageKeyword, "packageKeyword"),
                "packageKeyword", Keyword.Type.PACKAGE);
        this.names = listOf(names);
        check(!this.names.isEmpty(), "Package name must not be empty");
    }

    public Keyword getPackageKeyword() {
        return packageKeyword;
    }

    public List<NameExpression> getNames() {
        return names;
    }

    /** 点分包名 */
    public String getQualifiedName() {
        return NameExpression.join(names);
    }

    @Override
    protected Object[] slots() {
        return new Object[]{packageKeyword, names};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitPackageDirective(this, context);
    }
}
