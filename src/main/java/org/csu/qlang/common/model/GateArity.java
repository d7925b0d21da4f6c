package org.csu.qlang.common.model;

/**
 * 门在源码中的书写形式。
 */
public enum GateArity {
    SINGLE_QUBIT,   // H 0, 1, 2
    TWO_QUBIT,      // CNOT 0-1
    THREE_QUBIT,    // Toffoli 0-1-2
    MODULAR,        // MOD_EXP(7, 15) 0,1-2,3
    REGISTER        // QFT 0, 1, 2
}
