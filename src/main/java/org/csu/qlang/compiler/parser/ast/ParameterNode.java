package org.csu.qlang.compiler.parser.ast;

import org.csu.qlang.engine.ParameterEvaluator;

/**
 * AST 节点: 参数化门的参数表达式 (不含括号), 例如 π/4。
 * 只在需要时求值。
 */
public record ParameterNode(String expression, int line, int column) {

    /**
     * @throws org.csu.qlang.common.exception.ParameterEvaluationException 表达式无法求值时
     */
    public double evaluate() {
        return ParameterEvaluator.evaluate(expression);
    }
}
