package com.ktast.ast;

import com.ktast.ast.decl.ClassDeclaration;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.decl.Variable;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.ConstantLiteralExpression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.expr.StringLiteralExpression;
import com.ktast.ast.expr.ThisExpression;
import com.ktast.ast.expr.WhenExpression;
import com.ktast.ast.extra.BlankLines;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Whitespace;
import com.ktast.ast.modifier.Keyword;
import com.ktast.ast.modifier.PostModifier;
import com.ktast.ast.type.SimpleType;
import com.ktast.ast.type.TypeArg;
import com.ktast.ast.type.TypeRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.ktast.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 节点模型：值相等、子节点顺序与构造时的约束
 */
class NodeTest {

    private static PropertyDeclaration.Getter getter() {
        return new PropertyDeclaration.Getter(null, kw(Keyword.Type.GET), null,
                Collections.<PostModifier>emptyList(), kw(Keyword.Type.EQUAL), integer("1"));
    }

    private static PropertyDeclaration.Setter setter() {
        return new PropertyDeclaration.Setter(null, kw(Keyword.Type.SET), null,
                Collections.<PostModifier>emptyList(), null, null);
    }

    private static PropertyDeclaration varWith(List<? extends PropertyDeclaration.Accessor> accessors) {
        return new PropertyDeclaration(null, kw(Keyword.Type.VAR), null, null, null,
                Collections.singletonList(variable("a")), null, null, null, null, null, null, accessors);
    }

    @Nested
    @DisplayName("值相等")
    class EqualityTests {

        @Test
        @DisplayName("结构相同的节点相等但不是同一对象")
        void testStructuralEquality() {
            PropertyDeclaration a = val("x", integer("1"));
            PropertyDeclaration b = val("x", integer("1"));
            assertThat(a).isEqualTo(b).isNotSameAs(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
        }

        @Test
        @DisplayName("标量不同则不相等")
        void testScalarDifference() {
            assertThat(val("x", integer("1"))).isNotEqualTo(val("x", integer("2")));
            assertThat(name("x")).isNotEqualTo(name("y"));
        }

        @Test
        @DisplayName("不同种类的节点不相等")
        void testKindDifference() {
            assertThat(new ConstantLiteralExpression("1", ConstantLiteralExpression.Kind.INTEGER))
                    .isNotEqualTo(new ConstantLiteralExpression("1", ConstantLiteralExpression.Kind.REAL));
            assertThat((Node) name("x")).isNotEqualTo(variable("x"));
        }
    }

    @Nested
    @DisplayName("子节点与种类名")
    class ChildrenTests {

        @Test
        @DisplayName("子节点按源码顺序排列，缺省字段跳过")
        void testChildrenOrder() {
            PropertyDeclaration property = val("x", integer("1"));
            assertThat(property.getChildren()).containsExactly(
                    kw(Keyword.Type.VAL), variable("x"), kw(Keyword.Type.EQUAL), integer("1"));
        }

        @Test
        @DisplayName("嵌套类的种类名以点连接")
        void testKindName() {
            ClassDeclaration.ClassBody body = new ClassDeclaration.ClassBody(null, null);
            assertThat(body.getKindName()).isEqualTo("ClassDeclaration.ClassBody");
            assertThat(kw(Keyword.Type.VAL).getKindName()).isEqualTo("Keyword.VAL");
            assertThat(name("x").getKindName()).isEqualTo("NameExpression");
        }

        @Test
        @DisplayName("列表字段不可修改")
        void testImmutableLists() {
            PropertyDeclaration property = val("x", integer("1"));
            assertThatThrownBy(() -> property.getVariables().add(variable("y")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("构造约束")
    class InvariantTests {

        @Test
        @DisplayName("两个变量没有括号时拒绝构造")
        void testDestructuringRequiresParens() {
            assertThatThrownBy(() -> new PropertyDeclaration(null, kw(Keyword.Type.VAL), null, null, null,
                    Arrays.asList(variable("a"), variable("b")), null, null, null, null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("parentheses");
        }

        @Test
        @DisplayName("单个变量不能带括号")
        void testSingleVariableWithoutParens() {
            assertThatThrownBy(() -> new PropertyDeclaration(null, kw(Keyword.Type.VAL), null, null,
                    kw(Keyword.Type.LPAR), Collections.singletonList(variable("a")), null, kw(Keyword.Type.RPAR),
                    null, null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("同时有条件和 else 的分支拒绝构造")
        void testWhenBranchConditionsAndElse() {
            WhenExpression.WhenCondition condition = new WhenExpression.WhenCondition(null, integer("1"), null);
            assertThatThrownBy(() -> new WhenExpression.WhenBranch(Collections.singletonList(condition), null,
                    kw(Keyword.Type.ELSE), kw(Keyword.Type.ARROW), integer("2")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("没有条件的分支必须是 else")
        void testWhenBranchWithoutConditions() {
            assertThatThrownBy(() -> new WhenExpression.WhenBranch(null, null, null, kw(Keyword.Type.ARROW),
                    integer("2")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("关键词角色不符时拒绝构造")
        void testKeywordRole() {
            assertThatThrownBy(() -> new PropertyDeclaration(null, kw(Keyword.Type.FUN), null, null, null,
                    Collections.singletonList(variable("a")), null, null, null, null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("'=' 和初始值必须同时出现")
        void testEqualsWithoutInitializer() {
            assertThatThrownBy(() -> new PropertyDeclaration(null, kw(Keyword.Type.VAL), null, null, null,
                    Collections.singletonList(variable("a")), null, null, null, kw(Keyword.Type.EQUAL), null, null,
                    null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("初始值和委托不能同时出现")
        void testInitializerAndDelegate() {
            PropertyDeclaration.PropertyDelegate delegate =
                    new PropertyDeclaration.PropertyDelegate(kw(Keyword.Type.BY), name("lazy"));
            assertThatThrownBy(() -> new PropertyDeclaration(null, kw(Keyword.Type.VAL), null, null, null,
                    Collections.singletonList(variable("a")), null, null, null, kw(Keyword.Type.EQUAL), integer("1"),
                    delegate, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("delegate");
        }

        @Test
        @DisplayName("访问器最多两个，getter 和 setter 各至多一个")
        void testAccessorCount() {
            assertThat(varWith(Arrays.asList(getter(), setter())).getAccessors()).hasSize(2);
            assertThatThrownBy(() -> varWith(Arrays.asList(getter(), setter(), setter())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at most two");
            assertThatThrownBy(() -> varWith(Arrays.asList(getter(), getter())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("one getter");
            assertThatThrownBy(() -> varWith(Arrays.asList(setter(), setter())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("one setter");
        }

        @Test
        @DisplayName("setter 的参数和函数体必须同时出现")
        void testSetterParamsAndBody() {
            assertThatThrownBy(() -> new PropertyDeclaration.Setter(null, kw(Keyword.Type.SET), null,
                    Collections.<PostModifier>emptyList(), null,
                    new BlockExpression(Collections.<Statement>emptyList())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Setter parameter");
        }

        @Test
        @DisplayName("短模板只能包裹名字或不带标签的 this")
        void testShortTemplate() {
            assertThat(new StringLiteralExpression.TemplateStringEntry(new ThisExpression(null), true)
                    .isShortTemplate()).isTrue();
            assertThatThrownBy(() -> new StringLiteralExpression.TemplateStringEntry(integer("1"), true))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new StringLiteralExpression.TemplateStringEntry(new ThisExpression("outer"), true))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(new StringLiteralExpression.TemplateStringEntry(integer("1"), false).isShortTemplate())
                    .isFalse();
        }

        @Test
        @DisplayName("转义片段以反斜杠开头")
        void testEscapeEntry() {
            assertThat(new StringLiteralExpression.EscapeStringEntry("\\n").getText()).isEqualTo("\\n");
            assertThatThrownBy(() -> new StringLiteralExpression.EscapeStringEntry("n"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("类型实参恰好是星投影或具体类型之一")
        void testTypeArg() {
            TypeRef type = new TypeRef(new SimpleType(null, name("Int"), null));
            assertThatThrownBy(() -> new TypeArg(null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("exactly one");
            assertThatThrownBy(() -> new TypeArg(null, kw(Keyword.Type.ASTERISK), type))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("exactly one");
            assertThat(new TypeArg(null, kw(Keyword.Type.ASTERISK), null).isStarProjection()).isTrue();
        }

        @Test
        @DisplayName("else 分支不能带尾随逗号")
        void testElseBranchTrailingComma() {
            assertThatThrownBy(() -> new WhenExpression.WhenBranch(null, kw(Keyword.Type.COMMA),
                    kw(Keyword.Type.ELSE), kw(Keyword.Type.ARROW), integer("2")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("trailing comma");
        }

        @Test
        @DisplayName("必需字段为 null 时拒绝构造")
        void testRequiredField() {
            assertThatThrownBy(() -> new Variable(null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("name");
            assertThatThrownBy(() -> new NameExpression(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("附加信息的文本约束")
        void testExtraValidation() {
            assertThatThrownBy(() -> new Whitespace("x")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new Whitespace("")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new BlankLines(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new Comment("# no", true, true)).isInstanceOf(IllegalArgumentException.class);
            assertThat(new BlankLines(2).getText()).isEqualTo("\n\n\n");
        }
    }
}
