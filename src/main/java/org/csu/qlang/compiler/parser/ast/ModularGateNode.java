package org.csu.qlang.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 模运算门, 作用于控制寄存器和目标寄存器 (e.g., MOD_EXP(7, 15) 0,1,2,3-4,5,6,7)
 *
 * @param base    底数 a
 * @param modulus 模数 N
 */
public record ModularGateNode(
        String gateName,
        List<Integer> controlQubits,
        List<Integer> targetQubits,
        int base,
        int modulus,
        int line,
        int column
) implements OperationNode {

    public ModularGateNode {
        controlQubits = List.copyOf(controlQubits);
        targetQubits = List.copyOf(targetQubits);
    }
}
