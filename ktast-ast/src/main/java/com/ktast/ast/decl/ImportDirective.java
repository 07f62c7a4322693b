package com.ktast.ast.decl;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.modifier.Keyword;

import java.util.List;

/**
 * 导入指令：{@code import a.b.C}、{@code import a.b.*}、{@code import a.b.C as D}
 */
public final class ImportDirective extends Node {
    private final Keyword importKeyword;
    private final List<NameExpression> names;
    private final Keyword asterisk;
    private final ImportAlias alias;

    public ImportDirective(Keyword importKeyword, List<NameExpression> names, Keyword asterisk, ImportAlias alias) {
        this.importKeyword = Keyword.requireType(required(importKeyword, "importKeyword"),
                "importKeyword", Keyword.Type.IMPORT);
        this.names = listOf(names);
        this.asterisk = Keyword.requireType(asterisk, "asterisk", Keyword.Type.ASTERISK);
        this.alias = alias;
        check(!this.names.isEmpty(), "Import name must not be empty");
        check(asterisk == null || alias == null, "Star import cannot have an alias");
    }

    public Keyword getImportKeyword() {
        return importKeyword;
    }

    public List<NameExpression> getNames() {
        return names;
    }

    public Keyword getAsterisk() {
        return asterisk;
    }

    public ImportAlias getAlias() {
        return alias;
    }

    public boolean isStarImport() {
        return asterisk != null;
    }

    public String getQualifiedName() {
        return NameExpression.join(names);
    }

    @Override
    protected Object[] slots() {
        return new Object[]{importKeyword, names, asterisk, alias};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitImportDirective(this, context);
    }

    /**
     * 导入别名：{@code as D}
     */
    public static final class ImportAlias extends Node {
        private final Keyword asKeyword;
        private final NameExpression name;

        public ImportAlias(Keyword asKeyword, NameExpression name) {
            this.asKeyword = Keyword.requireType(required(asKeyword, "asKeyword"), "asKeyword", Keyword.Type.AS);
            this.name = required(name, "name");
        }

        public Keyword getAsKeyword() {
            return asKeyword;
        }

        public NameExpression getName() {
            return name;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{asKeyword, name};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitImportAlias(this, context);
        }
    }
}
