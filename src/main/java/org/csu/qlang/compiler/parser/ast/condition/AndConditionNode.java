package org.csu.qlang.compiler.parser.ast.condition;

public record AndConditionNode(ConditionNode left, ConditionNode right, int line, int column) implements ConditionNode {

    @Override
    public String toSource() {
        return left.toSource() + " and " + right.toSource();
    }
}
