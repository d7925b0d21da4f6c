package org.csu.qlang.cli;

import org.csu.qlang.cli.tool.GateTableFormatter;
import org.csu.qlang.engine.CompilationResult;
import org.csu.qlang.engine.QlangProcessor;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * @author hidyouth
 * @description: Q-Lang 交互式命令行
 * 逐行读取源码, 空行或 run 时编译缓冲区中的程序。
 * 其他命令: source &lt;file&gt; 编译脚本文件, decompile 反编译上一次的结果, exit 退出。
 */
public class QlangShell {

    private static final String PROMPT = "qlang> ";
    private static final String CONTINUATION_PROMPT = "    -> ";

    private final QlangProcessor processor;
    private final BufferedReader in;
    private final PrintStream out;

    private final StringBuilder sourceBuffer = new StringBuilder();
    private CompilationResult lastResult;

    public QlangShell(QlangProcessor processor, BufferedReader in, PrintStream out) {
        this.processor = processor;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        QlangShell shell = new QlangShell(new QlangProcessor(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
        if (args.length > 0) {
            shell.executeFile(args[0]);
        }
        shell.run();
    }

    public void run() throws IOException {
        out.println("Q-Lang shell. Enter a circuit; an empty line or 'run' compiles it.");
        out.println("Commands: source <file>, decompile, exit");

        while (true) {
            out.print(sourceBuffer.length() == 0 ? PROMPT : CONTINUATION_PROMPT);
            String line = in.readLine();
            if (line == null) {
                // 输入结束时把缓冲区里剩下的程序也编译掉
                flushBuffer();
                break;
            }
            String command = line.trim();

            if (command.equalsIgnoreCase("exit")) {
                break;
            }
            if (command.toLowerCase().startsWith("source ")) {
                executeFile(command.substring("source".length()).trim());
                continue;
            }
            if (command.equalsIgnoreCase("decompile")) {
                printDecompiled();
                continue;
            }
            if (command.isEmpty() || command.equalsIgnoreCase("run")) {
                flushBuffer();
                continue;
            }
            sourceBuffer.append(line).append("\n");
        }
        out.println("Bye!");
    }

    public void executeFile(String filePath) {
        File scriptFile = new File(filePath);
        if (!scriptFile.exists()) {
            out.println("ERROR: File not found: " + scriptFile.getAbsolutePath());
            return;
        }
        out.println("Compiling Q-Lang script from: " + filePath);
        try {
            compileAndPrint(Files.readString(scriptFile.toPath(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            out.println("ERROR: Could not read file: " + e.getMessage());
        }
    }

    CompilationResult getLastResult() {
        return lastResult;
    }

    private void flushBuffer() {
        if (sourceBuffer.length() == 0) {
            return;
        }
        String source = sourceBuffer.toString();
        sourceBuffer.setLength(0);
        compileAndPrint(source);
    }

    private void compileAndPrint(String source) {
        try {
            lastResult = processor.compile(source);
            out.println(GateTableFormatter.format(lastResult.getGates()));
        } catch (RuntimeException e) {
            out.println("ERROR: " + e.getMessage());
        }
    }

    private void printDecompiled() {
        if (lastResult == null) {
            out.println("ERROR: Nothing has been compiled yet.");
            return;
        }
        out.println(processor.decompile(lastResult.getGates(), lastResult.getQubitCount()));
    }
}
