package com.ktast.ast.decl;

import com.ktast.ast.DeclarationsContainer;
import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.WithModifiers;
import com.ktast.ast.expr.Expression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.expr.ValueArgs;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.Modifiers;
import com.ktast.ast.modifier.TypeConstraintSet;
import com.ktast.ast.type.TypeRef;

import java.util.List;

/**
 * 类、接口、对象声明
 */
public final class ClassDeclaration extends Declaration implements WithModifiers {
    private final Modifiers modifiers;
    private final Keyword declarationKeyword;
    private final NameExpression name;
    private final TypeParams typeParams;
    private final PrimaryConstructor primaryConstructor;
    private final ClassParents classParents;
    private final TypeConstraintSet typeConstraintSet;
    private final ClassBody classBody;

    public ClassDeclaration(Modifiers modifiers, Keyword declarationKeyword, NameExpression name,
                            TypeParams typeParams, PrimaryConstructor primaryConstructor,
                            ClassParents classParents, TypeConstraintSet typeConstraintSet, ClassBody classBody) {
        this.modifiers = modifiers;
        this.declarationKeyword = Keyword.requireRole(required(declarationKeyword, "declarationKeyword"),
                Keyword.Role.CLASS_KIND, "declarationKeyword");
        this.name = name;
        this.typeParams = typeParams;
        this.primaryConstructor = primaryConstructor;
        this.classParents = classParents;
        this.typeConstraintSet = typeConstraintSet;
        this.classBody = classBody;
        check(name != null || declarationKeyword.is(Keyword.Type.OBJECT), "Only objects may be anonymous");
        check(primaryConstructor == null || !declarationKeyword.is(Keyword.Type.INTERFACE),
                "Interfaces cannot have a primary constructor");
    }

    @Override
    public Modifiers getModifiers() {
        return modifiers;
    }

    public Keyword getDeclarationKeyword() {
        return declarationKeyword;
    }

    public NameExpression getName() {
        return name;
    }

    public TypeParams getTypeParams() {
        return typeParams;
    }

    public PrimaryConstructor getPrimaryConstructor() {
        return primaryConstructor;
    }

    public ClassParents getClassParents() {
        return classParents;
    }

    public TypeConstraintSet getTypeConstraintSet() {
        return typeConstraintSet;
    }

    public ClassBody getClassBody() {
        return classBody;
    }

    public boolean isClass() {
        return declarationKeyword.is(Keyword.Type.CLASS);
    }

    public boolean isObject() {
        return declarationKeyword.is(Keyword.Type.OBJECT);
    }

    public boolean isInterface() {
        return declarationKeyword.is(Keyword.Type.INTERFACE);
    }

    public boolean isCompanion() {
        return isObject() && Modifiers.has(modifiers, Keyword.Type.COMPANION);
    }

    public boolean isEnum() {
        return isClass() && Modifiers.has(modifiers, Keyword.Type.ENUM);
    }

    public boolean isData() {
        return isClass() && Modifiers.has(modifiers, Keyword.Type.DATA);
    }

    @Override
    protected Object[] slots() {
        return new Object[]{modifiers, declarationKeyword, name, typeParams, primaryConstructor,
                classParents, typeConstraintSet, classBody};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitClassDeclaration(this, context);
    }

    /**
     * 主构造器：{@code private constructor(val x: Int)}
     */
    public static final class PrimaryConstructor extends Node implements WithModifiers {
        private final Modifiers modifiers;
        private final Keyword constructorKeyword;
        private final FunctionParams params;

        public PrimaryConstructor(Modifiers modifiers, Keyword constructorKeyword, FunctionParams params) {
            this.modifiers = modifiers;
            this.constructorKeyword = Keyword.requireType(constructorKeyword, "constructorKeyword",
                    Keyword.Type.CONSTRUCTOR);
            this.params = params;
            check(modifiers == null || constructorKeyword != null,
                    "Primary constructor modifiers require the constructor keyword");
            check(constructorKeyword != null || params != null, "Primary constructor must have parameters");
        }

        @Override
        public Modifiers getModifiers() {
            return modifiers;
        }

        public Keyword getConstructorKeyword() {
            return constructorKeyword;
        }

        public FunctionParams getParams() {
            return params;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{modifiers, constructorKeyword, params};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitPrimaryConstructor(this, context);
        }
    }

    /**
     * 冒号之后的父类型列表
     */
    public static final class ClassParents extends Node {
        private final List<ClassParent> elements;

        public ClassParents(List<? extends ClassParent> elements) {
            this.elements = listOf(elements);
            check(!this.elements.isEmpty(), "Class parents must not be empty");
        }

        public List<ClassParent> getElements() {
            return elements;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{elements};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitClassParents(this, context);
        }
    }

    /**
     * 父类型条目
     */
    public abstract static class ClassParent extends Node {
        public abstract TypeRef getType();
    }

    /**
     * 调用父类构造器：{@code Base(1)}
     */
    public static final class CallConstructorParent extends ClassParent {
        private final TypeRef type;
        private final ValueArgs args;

        public CallConstructorParent(TypeRef type, ValueArgs args) {
            this.type = required(type, "type");
            this.args = required(args, "args");
        }

        @Override
        public TypeRef getType() {
            return type;
        }

        public ValueArgs getArgs() {
            return args;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{type, args};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitCallConstructorParent(this, context);
        }
    }

    /**
     * 接口委托：{@code Api by impl}
     */
    public static final class DelegationParent extends ClassParent {
        private final TypeRef type;
        private final Keyword byKeyword;
        private final Expression expression;

        public DelegationParent(TypeRef type, Keyword byKeyword, Expression expression) {
            this.type = required(type, "type");
            this.byKeyword = Keyword.requireType(required(byKeyword, "byKeyword"), "byKeyword", Keyword.Type.BY);
            this.expression = required(expression, "expression");
        }

        @Override
        public TypeRef getType() {
            return type;
        }

        public Keyword getByKeyword() {
            return byKeyword;
        }

        public Expression getExpression() {
            return expression;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{type, byKeyword, expression};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitDelegationParent(this, context);
        }
    }

    /**
     * 仅类型的父类型（通常为接口）
     */
    public static final class TypeParent extends ClassParent {
        private final TypeRef type;

        public TypeParent(TypeRef type) {
            this.type = required(type, "type");
        }

        @Override
        public TypeRef getType() {
            return type;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{type};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitTypeParent(this, context);
        }
    }

    /**
     * 类体：枚举条目（逗号分隔）在前，成员声明在后
     */
    public static final class ClassBody extends Node implements DeclarationsContainer {
        private final List<EnumEntry> enumEntries;
        private final List<Declaration> declarations;

        public ClassBody(List<EnumEntry> enumEntries, List<Declaration> declarations) {
            this.enumEntries = listOf(enumEntries);
            this.declarations = listOf(declarations);
        }

        public List<EnumEntry> getEnumEntries() {
            return enumEntries;
        }

        @Override
        public List<Declaration> getDeclarations() {
            return declarations;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{enumEntries, declarations};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitClassBody(this, context);
        }
    }

    /**
     * 枚举条目：{@code RED(0xFF0000) { override fun toString() = "red" }}
     */
    public static final class EnumEntry extends Declaration implements WithModifiers {
        private final Modifiers modifiers;
        private final NameExpression name;
        private final ValueArgs args;
        private final ClassBody classBody;

        public EnumEntry(Modifiers modifiers, NameExpression name, ValueArgs args, ClassBody classBody) {
            this.modifiers = modifiers;
            this.name = required(name, "name");
            this.args = args;
            this.classBody = classBody;
        }

        @Override
        public Modifiers getModifiers() {
            return modifiers;
        }

        public NameExpression getName() {
            return name;
        }

        public ValueArgs getArgs() {
            return args;
        }

        public ClassBody getClassBody() {
            return classBody;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{modifiers, name, args, classBody};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitEnumEntry(this, context);
        }
    }
}
