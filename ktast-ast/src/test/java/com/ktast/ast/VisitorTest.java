package com.ktast.ast;

import com.ktast.ast.decl.FunctionDeclaration;
import com.ktast.ast.decl.KotlinFile;
import com.ktast.ast.decl.PropertyDeclaration;
import com.ktast.ast.decl.Variable;
import com.ktast.ast.expr.BlockExpression;
import com.ktast.ast.expr.NameExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ktast.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Visitor 与 NodePath 单元测试
 */
class VisitorTest {

    @Test
    @DisplayName("先序遍历并跳过缺省字段")
    void testPreOrder() {
        KotlinFile file = file(val("x", integer("1")));
        List<String> visited = new ArrayList<String>();
        Visitor.traverse(file, path -> visited.add(path.getDepth() + ":" + path.getNode().getKindName()));

        assertThat(visited).containsExactly(
                "0:KotlinFile",
                "1:PropertyDeclaration",
                "2:Keyword.VAL",
                "2:Variable",
                "3:NameExpression",
                "2:Keyword.EQUAL",
                "2:ConstantLiteralExpression");
    }

    @Test
    @DisplayName("路径记录父节点链")
    void testPathAncestors() {
        KotlinFile file = file(val("x", integer("1")));
        List<NodePath> names = new ArrayList<NodePath>();
        Visitor.traverse(file, path -> {
            if (path.getNode() instanceof NameExpression) {
                names.add(path);
            }
        });

        assertThat(names).hasSize(1);
        NodePath path = names.get(0);
        assertThat(path.getParentNode()).isInstanceOf(Variable.class);
        assertThat(path.ancestors()).hasSize(3);
        assertThat(path.ancestors().get(2)).isSameAs(file);
        assertThat(path.findAncestor(PropertyDeclaration.class)).isSameAs(file.getDeclarations().get(0));
        assertThat(path.findAncestor(FunctionDeclaration.class)).isNull();
        assertThat(path.toString()).isEqualTo("KotlinFile > PropertyDeclaration > Variable > NameExpression");
    }

    @Test
    @DisplayName("根路径没有父节点")
    void testRootPath() {
        NodePath root = NodePath.rootPath(new BlockExpression(null));
        assertThat(root.isRoot()).isTrue();
        assertThat(root.getDepth()).isZero();
        assertThat(root.getParentNode()).isNull();
        assertThat(root.ancestors()).isEmpty();
    }

    @Test
    @DisplayName("遍历顺序与节点位置一致")
    void testStatementsInOrder() {
        FunctionDeclaration function = fun("run", name("a"), name("b"), name("c"));
        StringBuilder names = new StringBuilder();
        Visitor.traverse(function, path -> {
            if (path.getNode() instanceof NameExpression) {
                names.append(((NameExpression) path.getNode()).getText());
            }
        });
        assertThat(names.toString()).isEqualTo("runabc");
    }

    @Test
    @DisplayName("回调不能为空")
    void testNullCallback() {
        assertThatThrownBy(() -> Visitor.traverse(name("x"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
