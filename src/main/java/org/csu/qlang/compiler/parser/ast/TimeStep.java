package org.csu.qlang.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 一个时间步, 其中的操作并行执行。
 * 操作之间不得共用量子比特, 这一点由语义分析器检查。
 */
public record TimeStep(List<OperationNode> operations, int line) {

    public TimeStep {
        operations = List.copyOf(operations);
    }
}
