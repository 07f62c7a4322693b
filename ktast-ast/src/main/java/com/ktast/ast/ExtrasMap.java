package com.ktast.ast;

import com.ktast.ast.extra.Extra;

import java.util.List;

/**
 * 节点身份到附加信息的映射
 *
 * <p>键是节点身份（引用），不是节点的值：两个相等但位于不同位置的节点拥有各自的附加信息。
 * 映射只对产生它的那棵树（或由 {@link MutableVisitor} 在传入该映射时派生的树）有意义，
 * 用于无关的树时结果没有定义，也不会被检测。</p>
 */
public interface ExtrasMap {

    /** 节点之前的附加信息，未知节点返回空列表 */
    List<Extra> extrasBefore(Node node);

    /** 节点内部的附加信息（如只含注释的代码块），未知节点返回空列表 */
    List<Extra> extrasWithin(Node node);

    /** 节点之后的附加信息，未知节点返回空列表 */
    List<Extra> extrasAfter(Node node);
}
