package org.csu.qlang.compiler.parser.ast;

/**
 * AST 节点: 测量 (e.g., measure 0 -> c0)
 */
public record MeasurementNode(
        int qubit,
        String classicalBit,
        int line,
        int column
) implements OperationNode {
}
