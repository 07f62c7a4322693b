package com.ktast.ast.extra;

import com.ktast.ast.Node;

import java.util.Map;

/**
 * 附加信息（空白、注释、分号、尾随逗号）
 *
 * <p>Extra 不出现在语法树的槽位中，只通过 {@link com.ktast.ast.ExtrasMap} 附着在节点前、内、后，
 * Writer 原样输出其文本。</p>
 */
public abstract class Extra extends Node {

    public abstract String getText();

    @Override
    public Map<String, Object> getAttributes() {
        return attributes("text", getText());
    }
}
