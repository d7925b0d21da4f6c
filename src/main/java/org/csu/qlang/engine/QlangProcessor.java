package org.csu.qlang.engine;

import lombok.Getter;
import org.csu.qlang.cli.tool.GateTableFormatter;
import org.csu.qlang.compiler.codegen.CircuitCompiler;
import org.csu.qlang.compiler.codegen.CircuitDecompiler;
import org.csu.qlang.compiler.codegen.ir.GateRecord;
import org.csu.qlang.compiler.lexer.Lexer;
import org.csu.qlang.compiler.lexer.Token;
import org.csu.qlang.compiler.parser.Parser;
import org.csu.qlang.compiler.parser.ast.Program;
import org.csu.qlang.compiler.semantic.SemanticAnalyzer;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

/**
 * @author hidyouth
 * @description: Q-Lang 处理器
 * 把词法分析 -> 语法分析 -> 语义分析 -> 编译 串成一条流水线, 是外部调用的统一入口。
 */
public class QlangProcessor {

    public static final int DEFAULT_QUBIT_COUNT = 3;

    @Getter
    private final CircuitCompiler compiler;
    @Getter
    private final CircuitDecompiler decompiler;

    public QlangProcessor() {
        this(new CircuitCompiler(), new CircuitDecompiler());
    }

    public QlangProcessor(CircuitCompiler compiler, CircuitDecompiler decompiler) {
        this.compiler = compiler;
        this.decompiler = decompiler;
    }

    /**
     * 按源码中的 "qubits N" 指令确定比特数, 没有指令时使用默认值。
     */
    public CompilationResult compile(String source) {
        Program program = parse(source);
        int qubitCount = program.declaresQubitCount() ? program.qubitCount() : DEFAULT_QUBIT_COUNT;
        return analyzeAndCompile(source, program, qubitCount);
    }

    /**
     * 使用调用方指定的比特数, 忽略源码中的指令。
     */
    public CompilationResult compile(String source, int numQubits) {
        return analyzeAndCompile(source, parse(source), numQubits);
    }

    public String decompile(List<GateRecord> gates, Integer numQubits) {
        return decompiler.decompile(gates, numQubits);
    }

    /**
     * 编译源码并返回格式化后的门记录表; 任何阶段出错时返回 "ERROR: " 开头的信息。
     */
    public String executeAndGetResult(String source) {
        try {
            CompilationResult result = compile(source);
            return GateTableFormatter.format(result.getGates());
        } catch (Exception e) {
            StringWriter sw = new StringWriter();
            e.printStackTrace(new PrintWriter(sw));
            System.err.println("Error details: " + sw);
            return "ERROR: " + e.getMessage();
        }
    }

    public void execute(String source) {
        System.out.println(executeAndGetResult(source));
    }

    private Program parse(String source) {
        List<Token> tokens = Lexer.stripComments(new Lexer(source).tokenize());
        return new Parser(tokens).parse();
    }

    private CompilationResult analyzeAndCompile(String source, Program program, int qubitCount) {
        System.out.println("Compiling " + program.timeSteps().size() + " time step(s) on " + qubitCount + " qubit(s)...");
        new SemanticAnalyzer(qubitCount).analyze(program);
        List<GateRecord> gates = compiler.compile(program);
        System.out.println("Compilation finished, " + gates.size() + " gate record(s) generated.");
        return new CompilationResult(source, program, qubitCount, gates);
    }
}
