package org.csu.qlang.compiler.parser.ast;

import org.csu.qlang.compiler.parser.ast.condition.ConditionNode;

/**
 * AST 节点: 经典条件控制的操作 (e.g., if c0 and c1 then X 2)
 *
 * @param operation 被保护的操作, 不能再是 ConditionalNode
 */
public record ConditionalNode(
        ConditionNode condition,
        OperationNode operation,
        int line,
        int column
) implements OperationNode {

    public ConditionalNode {
        if (operation instanceof ConditionalNode) {
            throw new IllegalArgumentException("Nested conditionals are not supported");
        }
    }
}
