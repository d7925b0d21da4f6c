package org.csu.qlang.engine;

import lombok.Getter;
import org.csu.qlang.compiler.codegen.ir.GateRecord;
import org.csu.qlang.compiler.parser.ast.Program;

import java.util.List;

/**
 * 一次完整编译的结果: 源码、AST、实际使用的比特数以及生成的门记录。
 */
@Getter
public class CompilationResult {

    private final String source;
    private final Program program;
    private final int qubitCount;
    private final List<GateRecord> gates;

    public CompilationResult(String source, Program program, int qubitCount, List<GateRecord> gates) {
        this.source = source;
        this.program = program;
        this.qubitCount = qubitCount;
        this.gates = List.copyOf(gates);
    }

    public int getTimeStepCount() {
        return program.timeSteps().size();
    }
}
