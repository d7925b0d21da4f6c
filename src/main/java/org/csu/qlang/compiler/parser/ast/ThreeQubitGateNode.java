package org.csu.qlang.compiler.parser.ast;

/**
 * AST 节点: 三比特门 (e.g., Toffoli 0-1-2)
 */
public record ThreeQubitGateNode(
        String gateName,
        int control1,
        int control2,
        int target,
        int line,
        int column
) implements OperationNode {
}
