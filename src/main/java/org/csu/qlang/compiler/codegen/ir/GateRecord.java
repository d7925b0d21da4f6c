package org.csu.qlang.compiler.codegen.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 中间表示 (IR) 中的一条门记录
 *
 * 编译结果是一个扁平的记录列表, 每条记录带有绝对时间步下标。
 * 这是交给执行引擎和展示层的契约。
 *
 * @param type     门名称, 或 {@link #MEASURE} / {@link #CONDITIONAL}
 * @param qubit    主比特 (目标比特)
 * @param control  第一个控制比特, 没有时为 null
 * @param control2 第二个控制比特, 只有三比特门才有
 * @param timeStep 所在的时间步下标
 * @param params   附加参数, 按插入顺序, 不可修改
 */
public record GateRecord(
        String type,
        int qubit,
        Integer control,
        Integer control2,
        int timeStep,
        Map<String, Object> params
) {

    public static final String MEASURE = "MEASURE";
    public static final String CONDITIONAL = "IF";

    public static final String PARAM_ANGLE = "angle";
    public static final String PARAM_BASE = "a";
    public static final String PARAM_MODULUS = "N";
    public static final String PARAM_CONTROLS = "controls";
    public static final String PARAM_TARGETS = "targets";
    public static final String PARAM_QUBITS = "qubits";
    public static final String PARAM_CLASSICAL_BIT = "cbit";
    public static final String PARAM_CONDITION = "condition";
    public static final String PARAM_OPERATION = "operation";

    public GateRecord {
        params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static GateRecord single(String type, int qubit, int timeStep) {
        return new GateRecord(type, qubit, null, null, timeStep, Map.of());
    }

    public static GateRecord controlled(String type, int control, int target, int timeStep) {
        return new GateRecord(type, target, control, null, timeStep, Map.of());
    }

    public static GateRecord doublyControlled(String type, int control1, int control2, int target, int timeStep) {
        return new GateRecord(type, target, control1, control2, timeStep, Map.of());
    }

    public boolean hasControl() {
        return control != null;
    }

    public boolean hasSecondControl() {
        return control2 != null;
    }

    public Object param(String key) {
        return params.get(key);
    }

    /**
     * 条件记录中被保护的记录, 其他记录返回 null。
     */
    public GateRecord guarded() {
        Object operation = params.get(PARAM_OPERATION);
        return operation instanceof GateRecord record ? record : null;
    }
}
