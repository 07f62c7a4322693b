package com.ktast.ast;

/**
 * 可迁移附加信息的映射，供 {@link MutableVisitor} 在节点被替换时使用
 */
public interface MutableExtrasMap extends ExtrasMap {

    /**
     * 把 from 的全部附加信息迁移到 to，from 之后不再有附加信息
     *
     * <p>to 原有的附加信息保留，迁移来的追加在其后。变换返回树中另一个已有附加信息的节点时，
     * 该节点会同时带上两份附加信息。</p>
     */
    void moveExtras(Node from, Node to);
}
