package com.ktast.ast;

import com.ktast.ast.decl.*;
import com.ktast.ast.expr.*;
import com.ktast.ast.modifier.Keyword;

import java.util.Arrays;
import java.util.Collections;

/**
 * 测试中手工构造节点的辅助方法
 */
final class Nodes {

    private Nodes() {
    }

    static Keyword kw(Keyword.Type type) {
        return Keyword.of(type);
    }

    static NameExpression name(String text) {
        return new NameExpression(text);
    }

    static ConstantLiteralExpression integer(String text) {
        return new ConstantLiteralExpression(text, ConstantLiteralExpression.Kind.INTEGER);
    }

    static Variable variable(String name) {
        return new Variable(null, name(name), null);
    }

    /** val name = initializer */
    static PropertyDeclaration val(String name, Expression initializer) {
        return new PropertyDeclaration(null, kw(Keyword.Type.VAL), null, null, null,
                Collections.singletonList(variable(name)), null, null, null, kw(Keyword.Type.EQUAL), initializer,
                null, Collections.<PropertyDeclaration.Accessor>emptyList());
    }

    /** fun name() { statements } */
    static FunctionDeclaration fun(String name, Statement... statements) {
        return new FunctionDeclaration(null, kw(Keyword.Type.FUN), null, null, name(name),
                new FunctionParams(Collections.<FunctionParam>emptyList(), null), null, null, null,
                new BlockExpression(Arrays.asList(statements)));
    }

    static KotlinFile file(Declaration... declarations) {
        return new KotlinFile(null, null, null, Arrays.asList(declarations));
    }
}
