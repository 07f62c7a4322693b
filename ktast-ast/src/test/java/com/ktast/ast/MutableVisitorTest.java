package com.ktast.ast;

import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.decl.Variable;
import com.ktast.ast.expr.ConstantLiteralExpression;
import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Whitespace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ktast.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * MutableVisitor 单元测试
 */
class MutableVisitorTest {

    private static NodeTransformer rename(String from, String to) {
        return path -> {
            Node node = path.getNode();
            if (node instanceof NameExpression && from.equals(((NameExpression) node).getText())) {
                return new NameExpression(to);
            }
            return node;
        };
    }

    @Nested
    @DisplayName("重建")
    class RebuildTests {

        @Test
        @DisplayName("恒等变换返回原根节点")
        void testIdentity() {
            KotlinFile file = file(val("x", integer("1")), val("y", integer("2")));
            assertThat(MutableVisitor.traverse(file, NodeTransformer.IDENTITY)).isSameAs(file);
        }

        @Test
        @DisplayName("替换名字后重建父节点，未变的兄弟保持原身份")
        void testCopyOnChange() {
            KotlinFile file = file(val("x", integer("1")), val("y", integer("2")));
            KotlinFile renamed = MutableVisitor.traverse(file, rename("x", "a"));

            assertThat(renamed).isNotSameAs(file);
            assertThat(renamed).isEqualTo(file(val("a", integer("1")), val("y", integer("2"))));
            assertThat(renamed.getDeclarations().get(1)).isSameAs(file.getDeclarations().get(1));
            assertThat(file).isEqualTo(file(val("x", integer("1")), val("y", integer("2"))));
        }

        @Test
        @DisplayName("重命名后输出新名字")
        void testRenameWrites() {
            KotlinFile file = file(val("x", integer("1")), val("y", integer("2")));
            KotlinFile renamed = MutableVisitor.traverse(file, path -> {
                Node node = path.getNode();
                if (node instanceof NameExpression) {
                    String text = ((NameExpression) node).getText();
                    return new NameExpression(text.equals("x") ? "a" : "b");
                }
                return node;
            });
            assertThat(Writer.write(renamed)).isEqualTo("val a=1\nval b=2");
        }

        @Test
        @DisplayName("preVisit 看到原节点，postVisit 看到重建后的节点")
        void testPreAndPostVisit() {
            KotlinFile file = file(val("x", integer("1")));
            List<String> seen = new ArrayList<String>();
            MutableVisitor.traverse(file, null, rename("x", "a"), path -> {
                if (path.getNode() instanceof Variable) {
                    seen.add(((Variable) path.getNode()).getName().getText());
                }
                return path.getNode();
            });
            assertThat(seen).containsExactly("a");
        }

        @Test
        @DisplayName("preVisit 替换的节点继续遍历其子节点")
        void testPreVisitReplacementIsTraversed() {
            KotlinFile file = file(val("x", integer("1")));
            KotlinFile result = MutableVisitor.traverse(file, null, path -> {
                Node node = path.getNode();
                if (node instanceof PropertyDeclaration) {
                    return val("y", integer("2"));
                }
                return node;
            }, path -> {
                Node node = path.getNode();
                if (node instanceof ConstantLiteralExpression) {
                    return integer("3");
                }
                return node;
            });
            assertThat(result).isEqualTo(file(val("y", integer("3"))));
        }
    }

    @Nested
    @DisplayName("附加信息迁移")
    class ExtrasTests {

        @Test
        @DisplayName("被替换节点的附加信息迁移到新节点")
        void testExtrasFollowReplacement() {
            KotlinFile file = file(val("x", integer("1")));
            PropertyDeclaration property = (PropertyDeclaration) file.getDeclarations().get(0);
            NameExpression x = property.getVariables().get(0).getName();
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addAfter(x, Collections.singletonList(new Comment("/* renamed */", false, false)));

            KotlinFile renamed = MutableVisitor.traverse(file, extras, rename("x", "a"));
            NameExpression a = ((PropertyDeclaration) renamed.getDeclarations().get(0)).getVariables().get(0).getName();

            assertThat(extras.hasExtras(x)).isFalse();
            assertThat(extras.extrasAfter(a)).containsExactly(new Comment("/* renamed */", false, false));
            assertThat(Writer.write(renamed, extras)).isEqualTo("val a/* renamed */=1");
        }

        @Test
        @DisplayName("重建的父节点继承原父节点的附加信息")
        void testExtrasFollowRebuiltParent() {
            KotlinFile file = file(val("x", integer("1")));
            Node property = file.getDeclarations().get(0);
            NodeExtrasMap extras = new NodeExtrasMap();
            extras.addBefore(property, Collections.singletonList(new Whitespace("\n")));

            KotlinFile renamed = MutableVisitor.traverse(file, extras, rename("x", "a"));

            assertThat(extras.extrasBefore(renamed.getDeclarations().get(0))).containsExactly(new Whitespace("\n"));
            assertThat(extras.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("变换返回 null")
        void testNullResult() {
            assertThatThrownBy(() -> MutableVisitor.traverse(file(val("x", integer("1"))), path -> null))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("替换节点类型不适合所在位置")
        void testWrongSlotType() {
            KotlinFile file = file(val("x", integer("1")));
            assertThatThrownBy(() -> MutableVisitor.traverse(file, path -> {
                Node node = path.getNode();
                return node instanceof Variable ? name("x") : node;
            }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Variable");
        }

        @Test
        @DisplayName("替换结果违反节点约束")
        void testInvariantOnRebuild() {
            KotlinFile file = file(val("x", integer("1")));
            assertThatThrownBy(() -> MutableVisitor.traverse(file, path -> {
                Node node = path.getNode();
                if (node instanceof PropertyDeclaration) {
                    PropertyDeclaration p = (PropertyDeclaration) node;
                    List<Variable> variables = new ArrayList<Variable>(p.getVariables());
                    variables.add(variable("y"));
                    return new PropertyDeclaration(p.getModifiers(), p.getValOrVarKeyword(), null, null, null,
                            variables, null, null, null, p.getEquals(), p.getInitializer(), null, null);
                }
                return node;
            })).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
