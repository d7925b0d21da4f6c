package org.csu.qlang.compiler.parser.ast.condition;

public record OrConditionNode(ConditionNode left, ConditionNode right, int line, int column) implements ConditionNode {

    @Override
    public String toSource() {
        return left.toSource() + " or " + right.toSource();
    }
}
