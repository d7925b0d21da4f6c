package org.csu.qlang.common.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 门名称目录
 *
 * 词法分析器用它做白名单校验, 语法分析器用它决定门的书写形式,
 * 语义分析器和反编译器用它判断参数化门。
 */
public final class GateCatalog {

    public static final Set<String> SINGLE_QUBIT_GATES = Set.of("H", "X", "Y", "Z", "S", "T", "S†", "T†");
    public static final Set<String> PARAMETRIC_GATES = Set.of("Rx", "Ry", "Rz");
    public static final Set<String> TWO_QUBIT_GATES = Set.of("CNOT", "CX", "CZ", "SWAP");
    public static final Set<String> THREE_QUBIT_GATES = Set.of("Toffoli", "CCNOT", "CCZ");
    public static final Set<String> MODULAR_GATES = Set.of("MOD_EXP", "MOD_ADD", "MOD_MUL");
    public static final Set<String> REGISTER_GATES = Set.of("QFT", "QFT_INV");

    public static final Set<String> ALLOWED_GATES;

    static {
        Set<String> all = new LinkedHashSet<>();
        all.addAll(SINGLE_QUBIT_GATES);
        all.addAll(PARAMETRIC_GATES);
        all.addAll(TWO_QUBIT_GATES);
        all.addAll(THREE_QUBIT_GATES);
        all.addAll(MODULAR_GATES);
        all.addAll(REGISTER_GATES);
        ALLOWED_GATES = Set.copyOf(all);
    }

    private GateCatalog() {
    }

    public static boolean isAllowed(String gateName) {
        return ALLOWED_GATES.contains(gateName);
    }

    public static boolean isParametric(String gateName) {
        return PARAMETRIC_GATES.contains(gateName);
    }

    /**
     * 按书写形式给门分类。不在任何多比特集合中的门都按单比特门处理。
     */
    public static GateArity arityOf(String gateName) {
        if (TWO_QUBIT_GATES.contains(gateName)) {
            return GateArity.TWO_QUBIT;
        }
        if (THREE_QUBIT_GATES.contains(gateName)) {
            return GateArity.THREE_QUBIT;
        }
        if (MODULAR_GATES.contains(gateName)) {
            return GateArity.MODULAR;
        }
        if (REGISTER_GATES.contains(gateName)) {
            return GateArity.REGISTER;
        }
        return GateArity.SINGLE_QUBIT;
    }
}
