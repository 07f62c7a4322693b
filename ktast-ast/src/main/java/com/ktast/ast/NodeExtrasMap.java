package com.ktast.ast;

import com.ktast.ast.extra.Extra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 以节点身份为键的附加信息映射
 */
public class NodeExtrasMap implements MutableExtrasMap {

    private final Map<Node, List<Extra>> before = new IdentityHashMap<Node, List<Extra>>();
    private final Map<Node, List<Extra>> within = new IdentityHashMap<Node, List<Extra>>();
    private final Map<Node, List<Extra>> after = new IdentityHashMap<Node, List<Extra>>();

    @Override
    public List<Extra> extrasBefore(Node node) {
        return get(before, node);
    }

    @Override
    public List<Extra> extrasWithin(Node node) {
        return get(within, node);
    }

    @Override
    public List<Extra> extrasAfter(Node node) {
        return get(after, node);
    }

    public void addBefore(Node node, List<? extends Extra> extras) {
        add(before, node, extras);
    }

    public void addWithin(Node node, List<? extends Extra> extras) {
        add(within, node, extras);
    }

    public void addAfter(Node node, List<? extends Extra> extras) {
        add(after, node, extras);
    }

    /**
     * 移除节点的全部附加信息
     */
    public void remove(Node node) {
        before.remove(node);
        within.remove(node);
        after.remove(node);
    }

    public boolean hasExtras(Node node) {
        return before.containsKey(node) || within.containsKey(node) || after.containsKey(node);
    }

    /** 拥有附加信息的节点数 */
    public int size() {
        Map<Node, Boolean> nodes = new IdentityHashMap<Node, Boolean>();
        for (Node n : before.keySet()) nodes.put(n, Boolean.TRUE);
        for (Node n : within.keySet()) nodes.put(n, Boolean.TRUE);
        for (Node n : after.keySet()) nodes.put(n, Boolean.TRUE);
        return nodes.size();
    }

    @Override
    public void moveExtras(Node from, Node to) {
        if (from == to) return;
        move(before, from, to);
        move(within, from, to);
        move(after, from, to);
    }

    private static List<Extra> get(Map<Node, List<Extra>> map, Node node) {
        List<Extra> extras = map.get(node);
        return extras == null ? Collections.<Extra>emptyList() : Collections.unmodifiableList(extras);
    }

    private static void add(Map<Node, List<Extra>> map, Node node, List<? extends Extra> extras) {
        if (node == null) {
            throw new IllegalArgumentException("node is required");
        }
        if (extras == null || extras.isEmpty()) return;
        List<Extra> list = map.get(node);
        if (list == null) {
            list = new ArrayList<Extra>();
            map.put(node, list);
        }
        list.addAll(extras);
    }

    private static void move(Map<Node, List<Extra>> map, Node from, Node to) {
        List<Extra> extras = map.remove(from);
        if (extras != null) {
            add(map, to, extras);
        }
    }
}
