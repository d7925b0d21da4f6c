package org.csu.qlang.cli.tool;

import org.csu.qlang.compiler.codegen.ir.GateRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 一个可重用的工具类，用于将门记录列表格式化为带边框的控制台表格。
 */
public class GateTableFormatter {

    private static final List<String> COLUMN_NAMES = List.of("step", "type", "qubit", "control", "control2", "params");

    /**
     * @param gates 编译得到的门记录
     * @return 格式化后的表格字符串
     */
    public static String format(List<GateRecord> gates) {
        if (gates.isEmpty()) {
            return "Compilation finished, 0 gates generated.";
        }

        List<List<String>> rows = gates.stream()
                .map(GateTableFormatter::toRow)
                .collect(Collectors.toList());

        // 1. 计算每列的最大宽度
        List<Integer> columnWidths = new ArrayList<>();
        for (int i = 0; i < COLUMN_NAMES.size(); i++) {
            int maxWidth = COLUMN_NAMES.get(i).length();
            for (List<String> row : rows) {
                maxWidth = Math.max(maxWidth, row.get(i).length());
            }
            columnWidths.add(maxWidth);
        }

        // 2. 边框和表头
        StringBuilder sb = new StringBuilder();
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(COLUMN_NAMES, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");

        // 3. 数据行
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }

        // 4. 底部边框和最终消息
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append("Compilation finished, ").append(gates.size()).append(" gates generated.");
        return sb.toString();
    }

    private static List<String> toRow(GateRecord gate) {
        return List.of(
                String.valueOf(gate.timeStep()),
                gate.type(),
                String.valueOf(gate.qubit()),
                gate.hasControl() ? String.valueOf(gate.control()) : "-",
                gate.hasSecondControl() ? String.valueOf(gate.control2()) : "-",
                gate.params().isEmpty() ? "" : formatParams(gate)
        );
    }

    // 条件记录的内部操作只显示门名
    private static String formatParams(GateRecord gate) {
        return gate.params().entrySet().stream()
                .map(e -> e.getKey() + "=" + (e.getValue() instanceof GateRecord inner ? inner.type() : e.getValue()))
                .collect(Collectors.joining(", "));
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
