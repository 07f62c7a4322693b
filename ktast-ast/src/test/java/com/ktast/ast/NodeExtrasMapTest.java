package com.ktast.ast;

import com.ktast.ast.expr.NameExpression;
import com.ktast.ast.extra.Comment;
import com.ktast.ast.extra.Extra;
import com.ktast.ast.extra.Whitespace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.ktast.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * NodeExtrasMap 单元测试
 */
class NodeExtrasMapTest {

    @Test
    @DisplayName("未登记的节点返回空列表")
    void testUnknownNode() {
        NodeExtrasMap extras = new NodeExtrasMap();
        assertThat(extras.extrasBefore(name("x"))).isEmpty();
        assertThat(extras.extrasWithin(name("x"))).isEmpty();
        assertThat(extras.extrasAfter(name("x"))).isEmpty();
        assertThat(extras.size()).isZero();
    }

    @Test
    @DisplayName("按节点身份而不是值区分")
    void testIdentityKeys() {
        NameExpression first = name("x");
        NameExpression second = name("x");
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addAfter(first, Collections.<Extra>singletonList(new Whitespace(" ")));

        assertThat(first).isEqualTo(second);
        assertThat(extras.hasExtras(first)).isTrue();
        assertThat(extras.hasExtras(second)).isFalse();
    }

    @Test
    @DisplayName("重复添加按顺序追加，返回的列表不可修改")
    void testAppend() {
        NameExpression x = name("x");
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addBefore(x, Collections.<Extra>singletonList(new Whitespace(" ")));
        extras.addBefore(x, Collections.<Extra>singletonList(new Comment("/* a */", false, false)));

        assertThat(extras.extrasBefore(x)).containsExactly(new Whitespace(" "), new Comment("/* a */", false, false));
        assertThatThrownBy(() -> extras.extrasBefore(x).clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("迁移时追加到目标节点已有的附加信息之后")
    void testMoveExtras() {
        NameExpression from = name("x");
        NameExpression to = name("a");
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addAfter(from, Arrays.<Extra>asList(new Whitespace(" "), new Comment("// x", false, true)));
        extras.addWithin(from, Collections.<Extra>singletonList(new Whitespace("\n")));
        extras.addAfter(to, Collections.<Extra>singletonList(new Whitespace("\t")));

        extras.moveExtras(from, to);

        assertThat(extras.hasExtras(from)).isFalse();
        assertThat(extras.extrasAfter(to)).containsExactly(
                new Whitespace("\t"), new Whitespace(" "), new Comment("// x", false, true));
        assertThat(extras.extrasWithin(to)).containsExactly(new Whitespace("\n"));
        assertThat(extras.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("移除节点的全部附加信息")
    void testRemove() {
        NameExpression x = name("x");
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addBefore(x, Collections.<Extra>singletonList(new Whitespace(" ")));
        extras.addAfter(x, Collections.<Extra>singletonList(new Whitespace(" ")));
        extras.remove(x);
        assertThat(extras.hasExtras(x)).isFalse();
        assertThat(extras.size()).isZero();
    }

    @Test
    @DisplayName("空列表不登记节点")
    void testEmptyListIgnored() {
        NameExpression x = name("x");
        NodeExtrasMap extras = new NodeExtrasMap();
        extras.addAfter(x, Collections.<Extra>emptyList());
        assertThat(extras.hasExtras(x)).isFalse();
        assertThatThrownBy(() -> extras.addAfter(null, Collections.<Extra>emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
