package com.ktast.parser;

import com.ktast.ast.decl.ClassDeclaration;
import com.ktast.ast.decl.FunctionDeclaration;
import com.ktast.ast.decl.ImportDirective;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.expr.BinaryExpression;
import com.ktast.ast.expr.BinaryInfixExpression;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.CallExpression;
import com.ktast.ast.expr.ConstantLiteralExpression;
import com.ktast.ast.expr.Expression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.expr.StringLiteralExpression;
import com.ktast.ast.expr.WhenExpression;
import com.ktast.ast.modifier.AnnotationSet;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.type.SimpleType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * 原始语法树到语法树节点的转换测试
 */
class ConverterTest {

    private final Parser parser = new Parser();

    private PropertyDeclaration property(String source) {
        KotlinFile file = parser.parseFile(source);
        assertThat(file.getDeclarations()).hasSize(1);
        return (PropertyDeclaration) file.getDeclarations().get(0);
    }

    private Expression initializer(String source) {
        return property(source).getInitializer();
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("包与导入")
        void testPackageAndImports() {
            KotlinFile file = parser.parseFile("package a.b\nimport c.d as e\nimport f.*\nfun g() = 1");

            assertThat(file.getPackageDirective().getQualifiedName()).isEqualTo("a.b");
            assertThat(file.getImportDirectives()).hasSize(2);
            ImportDirective aliased = file.getImportDirectives().get(0);
            assertThat(aliased.getQualifiedName()).isEqualTo("c.d");
            assertThat(aliased.getAlias().getName().getText()).isEqualTo("e");
            assertThat(file.getImportDirectives().get(1).isStarImport()).isTrue();
            assertThat(file.getDeclarations()).hasSize(1);
        }

        @Test
        @DisplayName("类的主构造函数与父类型")
        void testClass() {
            KotlinFile file = parser.parseFile("class A(val x: Int) : B(x), C");
            ClassDeclaration cls = (ClassDeclaration) file.getDeclarations().get(0);

            assertThat(cls.isClass()).isTrue();
            assertThat(cls.getName().getText()).isEqualTo("A");
            assertThat(cls.getPrimaryConstructor().getParams().getElements()).hasSize(1);
            assertThat(cls.getClassParents().getElements()).hasSize(2);
            assertThat(cls.getClassParents().getElements().get(0))
                    .isInstanceOf(ClassDeclaration.CallConstructorParent.class);
            assertThat(cls.getClassParents().getElements().get(1))
                    .isInstanceOf(ClassDeclaration.TypeParent.class);
            assertThat(cls.getClassBody()).isNull();
        }

        @Test
        @DisplayName("枚举类")
        void testEnum() {
            KotlinFile file = parser.parseFile("enum class Color { RED, GREEN; fun f() = 1 }");
            ClassDeclaration cls = (ClassDeclaration) file.getDeclarations().get(0);

            assertThat(cls.isEnum()).isTrue();
            assertThat(cls.getClassBody().getEnumEntries()).extracting(e -> e.getName().getText())
                    .containsExactly("RED", "GREEN");
            assertThat(cls.getClassBody().getDeclarations()).hasSize(1);
        }

        @Test
        @DisplayName("带类型的属性和访问器")
        void testPropertyWithAccessor() {
            KotlinFile file = parser.parseFile("val x: Int\n    get() = 1");
            PropertyDeclaration property = (PropertyDeclaration) file.getDeclarations().get(0);

            SimpleType type = (SimpleType) property.getVariables().get(0).getTypeRef().getType();
            assertThat(type.getName().getText()).isEqualTo("Int");
            assertThat(property.getInitializer()).isNull();
            assertThat(property.getAccessors()).hasSize(1);
            assertThat(property.getAccessors().get(0)).isInstanceOf(PropertyDeclaration.Getter.class);
            assertThat(property.getAccessors().get(0).hasExpressionBody()).isTrue();
        }

        @Test
        @DisplayName("解构声明")
        void testDestructuring() {
            PropertyDeclaration property = property("val (a, b) = pair");
            assertThat(property.isDestructuring()).isTrue();
            assertThat(property.getVariables()).extracting(v -> v.getName().getText()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("函数体中的语句")
        void testFunctionBody() {
            KotlinFile file = parser.parseFile("fun f() {\n    a()\n    b = 2\n}");
            FunctionDeclaration function = (FunctionDeclaration) file.getDeclarations().get(0);
            BlockExpression body = (BlockExpression) function.getBody();

            assertThat(body.getStatements()).hasSize(2);
            assertThat(body.getStatements().get(0)).isInstanceOf(CallExpression.class);
            BinaryExpression assignment = (BinaryExpression) body.getStatements().get(1);
            assertThat(assignment.getOperator().getType()).isEqualTo(Keyword.Type.EQUAL);
        }

        @Test
        @DisplayName("注解使用处目标")
        void testAnnotationTarget() {
            KotlinFile file = parser.parseFile("class A(@field:Inject val x: Int)");
            ClassDeclaration cls = (ClassDeclaration) file.getDeclarations().get(0);
            AnnotationSet set = (AnnotationSet) cls.getPrimaryConstructor().getParams().getElements().get(0)
                    .getModifiers().getElements().get(0);

            assertThat(set.getTarget().getType()).isEqualTo(Keyword.Type.FIELD);
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpression sum = (BinaryExpression) initializer("val r = a + b * c");

            assertThat(sum.getOperator().getType()).isEqualTo(Keyword.Type.PLUS);
            assertThat(sum.getLhs()).isEqualTo(new NameExpression("a"));
            BinaryExpression product = (BinaryExpression) sum.getRhs();
            assertThat(product.getOperator().getType()).isEqualTo(Keyword.Type.ASTERISK);
        }

        @Test
        @DisplayName("中缀调用")
        void testInfix() {
            BinaryInfixExpression infix = (BinaryInfixExpression) initializer("val r = a to b");
            assertThat(infix.getOperator().getText()).isEqualTo("to");
        }

        @Test
        @DisplayName("成员调用与尾随 lambda")
        void testQualifiedCallWithLambda() {
            BinaryExpression qualified = (BinaryExpression) initializer("val r = list.map { it * 2 }");

            assertThat(qualified.getOperator().getType()).isEqualTo(Keyword.Type.DOT);
            CallExpression call = (CallExpression) qualified.getRhs();
            assertThat(call.getCallee()).isEqualTo(new NameExpression("map"));
            assertThat(call.getArgs()).isNull();
            assertThat(call.getLambdaArg().getExpression().getBody().getStatements()).hasSize(1);
        }

        @Test
        @DisplayName("字面量种类")
        void testLiteralKinds() {
            assertThat(((ConstantLiteralExpression) initializer("val r = 1.5")).getKind())
                    .isEqualTo(ConstantLiteralExpression.Kind.REAL);
            assertThat(((ConstantLiteralExpression) initializer("val r = 'c'")).getKind())
                    .isEqualTo(ConstantLiteralExpression.Kind.CHARACTER);
            assertThat(((ConstantLiteralExpression) initializer("val r = true")).getKind())
                    .isEqualTo(ConstantLiteralExpression.Kind.BOOLEAN);
            assertThat(((ConstantLiteralExpression) initializer("val r = null")).getKind())
                    .isEqualTo(ConstantLiteralExpression.Kind.NULL);
        }

        @Test
        @DisplayName("字符串模板")
        void testStringTemplate() {
            StringLiteralExpression string = (StringLiteralExpression) initializer("val s = \"a$b${c + 1}\"");

            assertThat(string.isRaw()).isFalse();
            assertThat(string.getEntries()).hasSize(3);
            assertThat(string.getEntries().get(0))
                    .isEqualTo(new StringLiteralExpression.LiteralStringEntry("a"));
            StringLiteralExpression.TemplateStringEntry shortTemplate =
                    (StringLiteralExpression.TemplateStringEntry) string.getEntries().get(1);
            assertThat(shortTemplate.isShortTemplate()).isTrue();
            StringLiteralExpression.TemplateStringEntry longTemplate =
                    (StringLiteralExpression.TemplateStringEntry) string.getEntries().get(2);
            assertThat(longTemplate.isShortTemplate()).isFalse();
            assertThat(longTemplate.getExpression()).isInstanceOf(BinaryExpression.class);
        }

        @Test
        @DisplayName("when 分支")
        void testWhen() {
            WhenExpression when = (WhenExpression) initializer(
                    "val r = when (x) {\n    1, 2 -> \"a\"\n    else -> \"b\"\n}");

            assertThat(when.getSubject()).isEqualTo(new NameExpression("x"));
            assertThat(when.getBranches()).hasSize(2);
            assertThat(when.getBranches().get(0).getConditions()).hasSize(2);
            assertThat(when.getBranches().get(1).isElse()).isTrue();
        }
    }

    @Nested
    @DisplayName("不支持的构造")
    class UnsupportedTests {

        @Test
        @DisplayName("上下文接收者")
        void testContextReceivers() {
            assertThatThrownBy(() -> parser.parseFile("context(Ctx) fun f() {}"))
                    .isInstanceOf(UnsupportedSyntaxException.class)
                    .hasMessageContaining("Context receivers");
        }

        @Test
        @DisplayName("单变量解构声明")
        void testSingleVariableDestructuring() {
            assertThatThrownBy(() -> parser.parseFile("val (a) = p"))
                    .isInstanceOf(UnsupportedSyntaxException.class)
                    .hasMessage("Single-variable destructuring declaration is not supported at offset 0");
        }

        @Test
        @DisplayName("确定非空类型")
        void testDefinitelyNonNullableType() {
            assertThatThrownBy(() -> parser.parseFile("fun <T> f(x: T & Any) {}"))
                    .isInstanceOf(UnsupportedSyntaxException.class)
                    .hasMessageContaining("Definitely non-nullable type");
        }

        @Test
        @DisplayName("when 主语中的变量声明")
        void testWhenSubjectDeclaration() {
            assertThatThrownBy(() -> parser.parseFile("fun f() = when (val x = y) { else -> x }"))
                    .isInstanceOf(UnsupportedSyntaxException.class)
                    .hasMessageContaining("when subject");
        }

        @Test
        @DisplayName("未知的注解使用处目标")
        void testUnknownAnnotationTarget() {
            UnsupportedSyntaxException e = catchThrowableOfType(
                    () -> parser.parseFile("@foo:Ann val x = 1"), UnsupportedSyntaxException.class);
            assertThat(e.getOffset()).isEqualTo(1);
        }
    }
}
