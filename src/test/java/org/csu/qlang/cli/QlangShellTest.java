package org.csu.qlang.cli;

import org.csu.qlang.compiler.codegen.ir.GateRecord;
import org.csu.qlang.compiler.parser.ast.Program;
import org.csu.qlang.engine.CompilationResult;
import org.csu.qlang.engine.QlangProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 交互式命令行的单元测试, 用 Mock 的处理器隔离编译流水线。
 */
public class QlangShellTest {

    private QlangProcessor mockProcessor;
    private ByteArrayOutputStream consoleOutput;

    @BeforeEach
    void setUp() {
        mockProcessor = Mockito.mock(QlangProcessor.class);
        consoleOutput = new ByteArrayOutputStream();
    }

    private QlangShell shellWithInput(String input) {
        return new QlangShell(mockProcessor,
                new BufferedReader(new StringReader(input)),
                new PrintStream(consoleOutput, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return consoleOutput.toString(StandardCharsets.UTF_8);
    }

    private CompilationResult result(String source, GateRecord... gates) {
        return new CompilationResult(source, new Program(List.of(), null), 3, List.of(gates));
    }

    @Test
    void testBufferedLinesCompileOnEmptyLine() throws IOException {
        System.out.println("--- Test: buffered lines compile on empty line ---");
        when(mockProcessor.compile("H 0\nCNOT 0-1\n"))
                .thenReturn(result("H 0\nCNOT 0-1\n", GateRecord.single("H", 0, 0)));

        QlangShell shell = shellWithInput("H 0\nCNOT 0-1\n\nexit\n");
        shell.run();

        verify(mockProcessor, times(1)).compile("H 0\nCNOT 0-1\n");
        assertNotNull(shell.getLastResult());
        assertTrue(output().contains("Compilation finished, 1 gates generated."));
        assertTrue(output().trim().endsWith("Bye!"));
    }

    @Test
    void testRunCommandAndEndOfInputFlushBuffer() throws IOException {
        System.out.println("--- Test: run command and end of input ---");
        when(mockProcessor.compile(anyString())).thenReturn(result("X 0\n"));

        shellWithInput("X 0\nrun\nY 1\n").run();

        verify(mockProcessor).compile("X 0\n");
        verify(mockProcessor).compile("Y 1\n");
    }

    @Test
    void testCompileErrorIsPrinted() throws IOException {
        System.out.println("--- Test: compile error is printed ---");
        when(mockProcessor.compile(anyString())).thenThrow(new IllegalStateException("boom"));

        QlangShell shell = shellWithInput("H 0; X 0\n\nexit\n");
        shell.run();

        assertTrue(output().contains("ERROR: boom"));
        assertNull(shell.getLastResult());
    }

    @Test
    void testDecompileUsesLastResult() throws IOException {
        System.out.println("--- Test: decompile uses last result ---");
        CompilationResult compiled = result("H 0\n", GateRecord.single("H", 0, 0));
        when(mockProcessor.compile("H 0\n")).thenReturn(compiled);
        when(mockProcessor.decompile(compiled.getGates(), 3)).thenReturn("qubits 3\nH 0");

        shellWithInput("decompile\nH 0\n\ndecompile\nexit\n").run();

        assertTrue(output().contains("ERROR: Nothing has been compiled yet."));
        assertTrue(output().contains("qubits 3\nH 0"));
        verify(mockProcessor).decompile(compiled.getGates(), 3);
    }

    @Test
    void testSourceCommandCompilesFile(@TempDir Path tempDir) throws IOException {
        System.out.println("--- Test: source command compiles file ---");
        Path script = tempDir.resolve("bell.ql");
        Files.writeString(script, "H 0\nCNOT 0-1\n", StandardCharsets.UTF_8);
        when(mockProcessor.compile("H 0\nCNOT 0-1\n")).thenReturn(result("H 0\nCNOT 0-1\n"));

        shellWithInput("source " + script + "\nsource " + tempDir.resolve("missing.ql") + "\nexit\n").run();

        verify(mockProcessor).compile("H 0\nCNOT 0-1\n");
        assertTrue(output().contains("Compiling Q-Lang script from: " + script));
        assertTrue(output().contains("ERROR: File not found"));
    }
}
