package org.csu.qlang.compiler.parser.ast.condition;

/**
 * 单个经典比特条件: "c0", "c0 == 1" 或 "c0 == 0"
 *
 * @param expectedValue 期望值 0/1; null 表示简写形式, 等价于 == 1
 */
public record BitConditionNode(String bitName, Integer expectedValue, int line, int column) implements ConditionNode {

    @Override
    public String toSource() {
        if (expectedValue == null) {
            return bitName;
        }
        return bitName + " == " + expectedValue;
    }
}
