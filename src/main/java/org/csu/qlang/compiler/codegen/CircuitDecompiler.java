package org.csu.qlang.compiler.codegen;

import org.csu.qlang.common.model.GateArity;
import org.csu.qlang.common.model.GateCatalog;
import org.csu.qlang.compiler.codegen.ir.GateRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 反编译器
 * 将门记录列表还原为 Q-Lang 源码。这是有损的映射: 注释不会恢复,
 * 角度只保证数值相同, 不保证写法相同。
 */
public class CircuitDecompiler {

    private static final String EMPTY_CIRCUIT = "# Empty circuit";
    private static final double ANGLE_TOLERANCE = 1e-3;

    // 常见的 π 分数, 按匹配顺序
    private static final Map<String, Double> PI_FRACTIONS = Map.of(
            "π/2", Math.PI / 2,
            "π/4", Math.PI / 4,
            "π", Math.PI
    );
    private static final List<String> PI_FRACTION_ORDER = List.of("π/2", "π/4", "π");

    public String decompile(List<GateRecord> gates) {
        return decompile(gates, null);
    }

    /**
     * @param numQubits 比特数, 不为 null 时在开头输出 "qubits N" 指令
     */
    public String decompile(List<GateRecord> gates, Integer numQubits) {
        List<String> lines = new ArrayList<>();
        if (numQubits != null) {
            lines.add("qubits " + numQubits);
        }
        if (gates.isEmpty()) {
            lines.add(EMPTY_CIRCUIT);
            return String.join("\n", lines);
        }

        // 按时间步分组, 组内保持原有顺序
        Map<Integer, List<GateRecord>> timeSteps = new TreeMap<>();
        for (GateRecord gate : gates) {
            timeSteps.computeIfAbsent(gate.timeStep(), k -> new ArrayList<>()).add(gate);
        }
        for (List<GateRecord> step : timeSteps.values()) {
            lines.add(step.stream().map(this::decompileGate).collect(Collectors.joining("; ")));
        }
        return String.join("\n", lines);
    }

    String decompileGate(GateRecord gate) {
        String type = gate.type();

        if (GateRecord.MEASURE.equals(type)) {
            return "measure " + gate.qubit() + " -> " + gate.param(GateRecord.PARAM_CLASSICAL_BIT);
        }
        if (GateRecord.CONDITIONAL.equals(type)) {
            GateRecord inner = gate.guarded();
            if (inner == null) {
                throw new IllegalArgumentException("Conditional record without guarded operation at time step "
                        + gate.timeStep());
            }
            return "if " + gate.param(GateRecord.PARAM_CONDITION) + " then " + decompileGate(inner);
        }

        GateArity arity = GateCatalog.arityOf(type);
        if (arity == GateArity.TWO_QUBIT && gate.hasControl()) {
            return type + " " + gate.control() + "-" + gate.qubit();
        }
        if (gate.hasSecondControl()) {
            return type + " " + gate.control() + "-" + gate.control2() + "-" + gate.qubit();
        }
        if (arity == GateArity.MODULAR) {
            return type + "(" + gate.param(GateRecord.PARAM_BASE) + ", " + gate.param(GateRecord.PARAM_MODULUS) + ") "
                    + joinQubits(gate.param(GateRecord.PARAM_CONTROLS), ",")
                    + "-"
                    + joinQubits(gate.param(GateRecord.PARAM_TARGETS), ",");
        }
        if (arity == GateArity.REGISTER && gate.param(GateRecord.PARAM_QUBITS) != null) {
            return type + " " + joinQubits(gate.param(GateRecord.PARAM_QUBITS), ", ");
        }
        if (GateCatalog.isParametric(type) && gate.params().containsKey(GateRecord.PARAM_ANGLE)) {
            return type + "(" + formatAngle(gate.param(GateRecord.PARAM_ANGLE)) + ") " + gate.qubit();
        }
        return type + " " + gate.qubit();
    }

    /**
     * 数值角度先尝试匹配常见的 π 分数, 否则输出去掉末尾零的六位小数;
     * 未求值的表达式字符串原样输出。
     */
    static String formatAngle(Object angle) {
        if (!(angle instanceof Number)) {
            return String.valueOf(angle);
        }
        double value = ((Number) angle).doubleValue();
        for (String symbol : PI_FRACTION_ORDER) {
            if (Math.abs(value - PI_FRACTIONS.get(symbol)) < ANGLE_TOLERANCE) {
                return symbol;
            }
        }
        String fixed = new BigDecimal(value).setScale(6, RoundingMode.HALF_EVEN).toPlainString();
        if (fixed.contains(".")) {
            fixed = fixed.replaceAll("0+$", "");
            if (fixed.endsWith(".")) {
                fixed = fixed.substring(0, fixed.length() - 1);
            }
        }
        return fixed.equals("-0") ? "0" : fixed;
    }

    private static String joinQubits(Object qubits, String separator) {
        if (!(qubits instanceof List<?> list)) {
            throw new IllegalArgumentException("Expected a qubit list but got " + qubits);
        }
        return list.stream().map(String::valueOf).collect(Collectors.joining(separator));
    }
}
