package org.csu.qlang.common.exception;

import lombok.Getter;

import java.util.Set;

/**
 * @author hidyouth
 * @description: 语义分析阶段的自定义异常
 */
@Getter
public class SemanticException extends RuntimeException {

    public enum ErrorType {
        QUBIT_OUT_OF_RANGE,
        QUBIT_REUSED,
        CONTROL_TARGET_CONFLICT,
        DUPLICATE_QUBIT,
        REGISTER_OVERLAP,
        MISSING_PARAMETER,
        UNEXPECTED_PARAMETER,
        INVALID_PARAMETER
    }

    private final ErrorType errorType;
    private final int line;
    // 出错的量子比特, 与参数相关的错误为空集
    private final Set<Integer> qubits;

    public SemanticException(ErrorType errorType, int line, Set<Integer> qubits, String message) {
        super("Line " + line + ": " + message);
        this.errorType = errorType;
        this.line = line;
        this.qubits = Set.copyOf(qubits);
    }

    public SemanticException(ErrorType errorType, int line, String message) {
        this(errorType, line, Set.of(), message);
    }
}
