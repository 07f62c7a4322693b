package com.ktast.ast.modifier;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.expr.Expression;

import java.util.List;

/**
 * 契约子句：{@code contract [returns() implies (x != null)]}
 */
public final class Contract extends Node implements PostModifier {
    private final Keyword contractKeyword;
    private final ContractEffects effects;

    public Contract(Keyword contractKeyword, ContractEffects effects) {
        this.contractKeyword = Keyword.requireType(required(contractKeyword, "contractKeyword"),
                "contractKeyword", Keyword.Type.CONTRACT);
        this.effects = required(effects, "effects");
    }

    public Keyword getContractKeyword() {
        return contractKeyword;
    }

    public ContractEffects getEffects() {
        return effects;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{contractKeyword, effects};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitContract(this, context);
    }

    /**
     * 方括号内的效果列表
     */
    public static final class ContractEffects extends Node {
        private final List<ContractEffect> elements;
        private final Keyword trailingComma;

        public ContractEffects(List<ContractEffect> elements, Keyword trailingComma) {
            this.elements = listOf(elements);
            this.trailingComma = Keyword.requireType(trailingComma, "trailingComma", Keyword.Type.COMMA);
            check(trailingComma == null || !this.elements.isEmpty(), "Trailing comma requires an element");
        }

        public List<ContractEffect> getElements() {
            return elements;
        }

        public Keyword getTrailingComma() {
            return trailingComma;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{elements, trailingComma};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitContractEffects(this, context);
        }
    }

    public static final class ContractEffect extends Node {
        private final Expression expression;

        public ContractEffect(Expression expression) {
            this.expression = required(expression, "expression");
        }

        public Expression getExpression() {
            return expression;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{expression};
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitContractEffect(this, context);
        }
    }
}
