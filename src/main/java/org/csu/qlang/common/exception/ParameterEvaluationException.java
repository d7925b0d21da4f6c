package org.csu.qlang.common.exception;

import lombok.Getter;

/**
 * 参数表达式无法求值。调用方可以恢复: 编译器会退回到原始表达式字符串。
 */
@Getter
public class ParameterEvaluationException extends RuntimeException {

    private final String expression;

    public ParameterEvaluationException(String expression, String reason) {
        super("Invalid parameter expression '" + expression + "': " + reason);
        this.expression = expression;
    }
}
