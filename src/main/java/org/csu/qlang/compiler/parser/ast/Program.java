package org.csu.qlang.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 按时间顺序排列的时间步。
 *
 * @param qubitCount 源码开头 "qubits N" 指令声明的比特数, 没有指令时为 null
 */
public record Program(List<TimeStep> timeSteps, Integer qubitCount) {

    public Program {
        timeSteps = List.copyOf(timeSteps);
    }

    public boolean declaresQubitCount() {
        return qubitCount != null;
    }
}
