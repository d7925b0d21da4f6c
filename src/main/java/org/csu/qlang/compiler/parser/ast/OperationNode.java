package org.csu.qlang.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 时间步中一个操作的 AST 节点
 *
 * 封闭层次: 新增操作种类时, 语义分析器、编译器和反编译器都必须同步处理。
 */
public sealed interface OperationNode
        permits SingleQubitGateNode, TwoQubitGateNode, ThreeQubitGateNode,
        ModularGateNode, RegisterGateNode, MeasurementNode, ConditionalNode {

    int line();

    int column();
}
