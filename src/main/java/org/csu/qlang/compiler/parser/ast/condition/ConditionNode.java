package org.csu.qlang.compiler.parser.ast.condition;

/**
 * 条件表达式节点。and/or 从左到右折叠, 两者没有优先级区别。
 */
public sealed interface ConditionNode permits BitConditionNode, AndConditionNode, OrConditionNode {

    int line();

    int column();

    /**
     * 还原为源码文本, 例如 "c0 == 1 and c1"。
     */
    String toSource();
}
