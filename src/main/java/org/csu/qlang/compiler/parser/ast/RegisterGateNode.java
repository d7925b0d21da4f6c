package org.csu.qlang.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 作用于整个有序寄存器的门 (e.g., QFT 0, 1, 2)。
 * 与单比特门写法相同, 但编译为一条记录。
 */
public record RegisterGateNode(
        String gateName,
        List<Integer> qubits,
        int line,
        int column
) implements OperationNode {

    public RegisterGateNode {
        qubits = List.copyOf(qubits);
    }
}
