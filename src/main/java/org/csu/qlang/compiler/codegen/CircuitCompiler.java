package org.csu.qlang.compiler.codegen;

import org.csu.qlang.compiler.codegen.ir.GateRecord;
import org.csu.qlang.compiler.parser.ast.*;
import org.csu.qlang.engine.ParameterEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * @author hidyouth
 * @description: 线路编译器
 * 负责将经过语义分析的AST转换为按时间步标记的扁平门记录列表 (IR)。
 */
public class CircuitCompiler {

    public List<GateRecord> compile(Program program) {
        List<GateRecord> gates = new ArrayList<>();
        List<TimeStep> timeSteps = program.timeSteps();
        for (int timeStep = 0; timeStep < timeSteps.size(); timeStep++) {
            for (OperationNode operation : timeSteps.get(timeStep).operations()) {
                gates.addAll(compileOperation(operation, timeStep));
            }
        }
        return gates;
    }

    private List<GateRecord> compileOperation(OperationNode operation, int timeStep) {
        if (operation instanceof SingleQubitGateNode gate) {
            return compileSingleQubitGate(gate, timeStep);
        }
        if (operation instanceof TwoQubitGateNode gate) {
            return List.of(GateRecord.controlled(gate.gateName(), gate.control(), gate.target(), timeStep));
        }
        if (operation instanceof ThreeQubitGateNode gate) {
            return List.of(GateRecord.doublyControlled(gate.gateName(),
                    gate.control1(), gate.control2(), gate.target(), timeStep));
        }
        if (operation instanceof ModularGateNode gate) {
            return List.of(compileModularGate(gate, timeStep));
        }
        if (operation instanceof RegisterGateNode gate) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(GateRecord.PARAM_QUBITS, gate.qubits());
            return List.of(new GateRecord(gate.gateName(), gate.qubits().get(0), null, null, timeStep, params));
        }
        if (operation instanceof MeasurementNode measurement) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(GateRecord.PARAM_CLASSICAL_BIT, measurement.classicalBit());
            return List.of(new GateRecord(GateRecord.MEASURE, measurement.qubit(), null, null, timeStep, params));
        }
        if (operation instanceof ConditionalNode conditional) {
            return compileConditional(conditional, timeStep);
        }
        throw new IllegalStateException("Unsupported operation type: " + operation.getClass().getSimpleName());
    }

    private List<GateRecord> compileSingleQubitGate(SingleQubitGateNode gate, int timeStep) {
        List<GateRecord> gates = new ArrayList<>();
        Object angle = gate.hasParameter() ? angleOf(gate.parameter()) : null;
        for (int qubit : gate.qubits()) {
            if (angle == null) {
                gates.add(GateRecord.single(gate.gateName(), qubit, timeStep));
            } else {
                Map<String, Object> params = new LinkedHashMap<>();
                params.put(GateRecord.PARAM_ANGLE, angle);
                gates.add(new GateRecord(gate.gateName(), qubit, null, null, timeStep, params));
            }
        }
        return gates;
    }

    /**
     * 能求值时返回角度值, 否则保留原始表达式字符串。
     * 这里不再重复语义检查, 交给执行端处理。
     */
    private Object angleOf(ParameterNode parameter) {
        OptionalDouble angle = ParameterEvaluator.tryEvaluate(parameter.expression());
        return angle.isPresent() ? (Object) angle.getAsDouble() : parameter.expression();
    }

    private GateRecord compileModularGate(ModularGateNode gate, int timeStep) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(GateRecord.PARAM_BASE, gate.base());
        params.put(GateRecord.PARAM_MODULUS, gate.modulus());
        params.put(GateRecord.PARAM_CONTROLS, gate.controlQubits());
        params.put(GateRecord.PARAM_TARGETS, gate.targetQubits());
        return new GateRecord(gate.gateName(), gate.targetQubits().get(0), gate.controlQubits().get(0), null,
                timeStep, params);
    }

    // 内部操作展开成几条记录, 就生成几条条件记录
    private List<GateRecord> compileConditional(ConditionalNode conditional, int timeStep) {
        String condition = conditional.condition().toSource();
        List<GateRecord> wrapped = new ArrayList<>();
        for (GateRecord inner : compileOperation(conditional.operation(), timeStep)) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(GateRecord.PARAM_CONDITION, condition);
            params.put(GateRecord.PARAM_OPERATION, inner);
            wrapped.add(new GateRecord(GateRecord.CONDITIONAL, inner.qubit(), null, null, timeStep, params));
        }
        return wrapped;
    }
}
