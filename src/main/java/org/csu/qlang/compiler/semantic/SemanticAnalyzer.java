package org.csu.qlang.compiler.semantic;

import org.csu.qlang.common.exception.ParameterEvaluationException;
import org.csu.qlang.common.exception.SemanticException;
import org.csu.qlang.common.exception.SemanticException.ErrorType;
import org.csu.qlang.common.model.GateCatalog;
import org.csu.qlang.compiler.parser.ast.*;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * @author hidyouth
 * @description: 语义分析器
 * 负责检查AST的逻辑正确性: 比特下标范围、同一时间步内的比特冲突、
 * 控制位与目标位、参数是否合法。遇到第一个错误立即抛出。
 */
public class SemanticAnalyzer {

    private final int numQubits;

    public SemanticAnalyzer(int numQubits) {
        if (numQubits <= 0) {
            throw new IllegalArgumentException("Qubit count must be positive, got " + numQubits);
        }
        this.numQubits = numQubits;
    }

    public void analyze(Program program) {
        for (TimeStep timeStep : program.timeSteps()) {
            analyzeTimeStep(timeStep);
        }
    }

    private void analyzeTimeStep(TimeStep timeStep) {
        Set<Integer> usedQubits = new HashSet<>();
        for (OperationNode operation : timeStep.operations()) {
            // 1. 先检查操作自身
            analyzeOperation(operation);

            // 2. 再检查与本时间步内前面的操作是否冲突
            Set<Integer> involved = involvedQubits(operation);
            Set<Integer> conflicts = new TreeSet<>(involved);
            conflicts.retainAll(usedQubits);
            if (!conflicts.isEmpty()) {
                throw new SemanticException(ErrorType.QUBIT_REUSED, operation.line(), conflicts,
                        "Qubit(s) " + conflicts + " used multiple times in same time step");
            }
            usedQubits.addAll(involved);
        }
    }

    private void analyzeOperation(OperationNode operation) {
        if (operation instanceof SingleQubitGateNode gate) {
            analyzeSingleQubitGate(gate);
        } else if (operation instanceof TwoQubitGateNode gate) {
            analyzeTwoQubitGate(gate);
        } else if (operation instanceof ThreeQubitGateNode gate) {
            analyzeThreeQubitGate(gate);
        } else if (operation instanceof ModularGateNode gate) {
            analyzeModularGate(gate);
        } else if (operation instanceof RegisterGateNode gate) {
            checkRange(gate.qubits(), gate.line(), "Qubit");
            checkNoDuplicates(gate.qubits(), gate.line());
        } else if (operation instanceof MeasurementNode measurement) {
            checkRange(List.of(measurement.qubit()), measurement.line(), "Qubit");
        } else if (operation instanceof ConditionalNode conditional) {
            // 条件只作用于内部操作, 递归检查
            analyzeOperation(conditional.operation());
        } else {
            throw new IllegalStateException("Unsupported operation type: " + operation.getClass().getSimpleName());
        }
    }

    private void analyzeSingleQubitGate(SingleQubitGateNode gate) {
        checkRange(gate.qubits(), gate.line(), "Qubit");
        checkNoDuplicates(gate.qubits(), gate.line());

        String gateName = gate.gateName();
        if (GateCatalog.isParametric(gateName)) {
            if (!gate.hasParameter()) {
                throw new SemanticException(ErrorType.MISSING_PARAMETER, gate.line(),
                        "Gate '" + gateName + "' requires a parameter");
            }
            try {
                gate.parameter().evaluate();
            } catch (ParameterEvaluationException e) {
                throw new SemanticException(ErrorType.INVALID_PARAMETER, gate.line(), e.getMessage());
            }
        } else if (gate.hasParameter()) {
            throw new SemanticException(ErrorType.UNEXPECTED_PARAMETER, gate.line(),
                    "Gate '" + gateName + "' does not accept parameters");
        }
    }

    private void analyzeTwoQubitGate(TwoQubitGateNode gate) {
        checkRange(List.of(gate.control(), gate.target()), gate.line(), "Qubit");
        if (gate.control() == gate.target()) {
            throw new SemanticException(ErrorType.CONTROL_TARGET_CONFLICT, gate.line(), Set.of(gate.control()),
                    "Control and target qubits cannot be the same (" + gate.control() + ")");
        }
    }

    private void analyzeThreeQubitGate(ThreeQubitGateNode gate) {
        List<Integer> qubits = List.of(gate.control1(), gate.control2(), gate.target());
        checkRange(qubits, gate.line(), "Qubit");
        if (new HashSet<>(qubits).size() != 3) {
            throw new SemanticException(ErrorType.CONTROL_TARGET_CONFLICT, gate.line(), repeated(qubits),
                    "Control and target qubits must be distinct (got "
                            + gate.control1() + ", " + gate.control2() + ", " + gate.target() + ")");
        }
    }

    private void analyzeModularGate(ModularGateNode gate) {
        checkRange(gate.controlQubits(), gate.line(), "Control qubit");
        checkRange(gate.targetQubits(), gate.line(), "Target qubit");

        Set<Integer> overlap = new TreeSet<>(gate.controlQubits());
        overlap.retainAll(gate.targetQubits());
        if (!overlap.isEmpty()) {
            throw new SemanticException(ErrorType.REGISTER_OVERLAP, gate.line(), overlap,
                    "Qubit(s) " + overlap + " appear in both control and target registers");
        }
    }

    private void checkRange(Collection<Integer> qubits, int line, String role) {
        for (int qubit : qubits) {
            if (qubit < 0 || qubit >= numQubits) {
                throw new SemanticException(ErrorType.QUBIT_OUT_OF_RANGE, line, Set.of(qubit),
                        role + " " + qubit + " out of range [0, " + (numQubits - 1) + "]");
            }
        }
    }

    private void checkNoDuplicates(List<Integer> qubits, int line) {
        Set<Integer> duplicates = repeated(qubits);
        if (!duplicates.isEmpty()) {
            throw new SemanticException(ErrorType.DUPLICATE_QUBIT, line, duplicates,
                    "Duplicate qubit(s) " + duplicates + " in gate operation");
        }
    }

    private static Set<Integer> repeated(List<Integer> qubits) {
        Set<Integer> seen = new HashSet<>();
        Set<Integer> duplicates = new TreeSet<>();
        for (Integer qubit : qubits) {
            if (!seen.add(qubit)) {
                duplicates.add(qubit);
            }
        }
        return duplicates;
    }

    /**
     * 一个操作涉及的全部量子比特, 条件操作取其内部操作的比特。
     */
    static Set<Integer> involvedQubits(OperationNode operation) {
        if (operation instanceof SingleQubitGateNode gate) {
            return new LinkedHashSet<>(gate.qubits());
        }
        if (operation instanceof TwoQubitGateNode gate) {
            return new LinkedHashSet<>(List.of(gate.control(), gate.target()));
        }
        if (operation instanceof ThreeQubitGateNode gate) {
            return new LinkedHashSet<>(List.of(gate.control1(), gate.control2(), gate.target()));
        }
        if (operation instanceof ModularGateNode gate) {
            Set<Integer> qubits = new LinkedHashSet<>(gate.controlQubits());
            qubits.addAll(gate.targetQubits());
            return qubits;
        }
        if (operation instanceof RegisterGateNode gate) {
            return new LinkedHashSet<>(gate.qubits());
        }
        if (operation instanceof MeasurementNode measurement) {
            return new LinkedHashSet<>(List.of(measurement.qubit()));
        }
        if (operation instanceof ConditionalNode conditional) {
            return involvedQubits(conditional.operation());
        }
        throw new IllegalStateException("Unsupported operation type: " + operation.getClass().getSimpleName());
    }
}
