package org.csu.qlang.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 单比特门, 独立作用于列表中的每个量子比特 (e.g., H 0, 1, 2)
 *
 * @param parameter 参数化门 (Rx/Ry/Rz) 的参数, 没有时为 null
 */
public record SingleQubitGateNode(
        String gateName,
        List<Integer> qubits,
        ParameterNode parameter,
        int line,
        int column
) implements OperationNode {

    public SingleQubitGateNode {
        qubits = List.copyOf(qubits);
    }

    public boolean hasParameter() {
        return parameter != null;
    }
}
