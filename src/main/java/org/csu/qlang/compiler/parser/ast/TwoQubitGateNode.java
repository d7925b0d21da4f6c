package org.csu.qlang.compiler.parser.ast;

/**
 * AST 节点: 双比特门 (e.g., CNOT 0-1)
 */
public record TwoQubitGateNode(
        String gateName,
        int control,
        int target,
        int line,
        int column
) implements OperationNode {
}
