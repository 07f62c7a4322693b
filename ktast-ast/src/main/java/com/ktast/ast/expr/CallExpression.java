package com.ktast.ast.expr;

import com.ktast.ast.Node;
import com.ktast.ast.NodeVisitor;
import com.ktast.ast.modifier.AnnotationSet;
import com.ktast.ast.type.TypeArgs;

import java.util.List;
import java.util.Map;

/**
 * 函数调用：{@code f<T>(a, b) { ... }}
 */
public final class CallExpression extends Expression {
    private final Expression callee;
    private final TypeArgs typeArgs;
    private final ValueArgs args;
    private final LambdaArg lambdaArg;

    public CallExpression(Expression callee, TypeArgs typeArgs, ValueArgs args, LambdaArg lambdaArg) {
        this.callee = required(callee, "callee");
        this.typeArgs = typeArgs;
        this.args = args;
        this.lambdaArg = lambdaArg;
        check(args != null || lambdaArg != null, "Call requires value arguments or a trailing lambda");
    }

    public Expression getCallee() {
        return callee;
    }

    public TypeArgs getTypeArgs() {
        return typeArgs;
    }

    public ValueArgs getArgs() {
        return args;
    }

    public LambdaArg getLambdaArg() {
        return lambdaArg;
    }

    @Override
    protected Object[] slots() {
        return new Object[]{callee, typeArgs, args, lambdaArg};
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpression(this, context);
    }

    /**
     * 尾随 lambda，可带注解与标签：{@code run @Ann label@ { ... }}
     */
    public static final class LambdaArg extends Node {
        private final List<AnnotationSet> annotationSets;
        private final String label;
        private final LambdaExpression expression;

        public LambdaArg(List<AnnotationSet> annotationSets, String label, LambdaExpression expression) {
            this.annotationSets = listOf(annotationSets);
            this.label = label;
            this.expression = required(expression, "expression");
        }

        public List<AnnotationSet> getAnnotationSets() {
            return annotationSets;
        }

        public String getLabel() {
            return label;
        }

        public LambdaExpression getExpression() {
            return expression;
        }

        @Override
        protected Object[] slots() {
            return new Object[]{annotationSets, label, expression};
        }

        @Override
        public Map<String, Object> getAttributes() {
            return attributes("label", label);
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitLambdaArg(this, context);
        }
    }
}
