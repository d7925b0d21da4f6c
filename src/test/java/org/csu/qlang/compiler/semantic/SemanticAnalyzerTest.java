package org.csu.qlang.compiler.semantic;

import org.csu.qlang.common.exception.SemanticException;
import org.csu.qlang.common.exception.SemanticException.ErrorType;
import org.csu.qlang.compiler.lexer.Lexer;
import org.csu.qlang.compiler.parser.Parser;
import org.csu.qlang.compiler.parser.ast.Program;
import org.csu.qlang.compiler.parser.ast.SingleQubitGateNode;
import org.csu.qlang.compiler.parser.ast.TimeStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: SemanticAnalyzer 类的单元测试
 */
public class SemanticAnalyzerTest {

    private Program parse(String source) {
        return new Parser(Lexer.stripComments(new Lexer(source).tokenize())).parse();
    }

    private void analyze(String source, int numQubits) {
        System.out.println("Input: " + source.replace("\n", "\\n") + " (qubits=" + numQubits + ")");
        new SemanticAnalyzer(numQubits).analyze(parse(source));
    }

    private SemanticException assertSemanticError(String source, int numQubits, ErrorType expectedType) {
        SemanticException e = assertThrows(SemanticException.class, () -> analyze(source, numQubits));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals(expectedType, e.getErrorType());
        return e;
    }

    @Test
    public void testValidProgramPasses() {
        System.out.println("--- Running test: testValidProgramPasses ---");
        String source = String.join("\n",
                "H 0; X 1; Rz(π/4) 2",
                "CNOT 0-1",
                "Toffoli 0-1-2; H 3",
                "MOD_EXP(7, 15) 0,1-2,3",
                "QFT 0, 1, 2, 3",
                "measure 0 -> c0; measure 1 -> c1",
                "if c0 and c1 == 0 then X 2; H 3");
        assertDoesNotThrow(() -> analyze(source, 4));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testQubitOutOfRange() {
        System.out.println("--- Running test: testQubitOutOfRange ---");
        SemanticException e = assertSemanticError("H 5", 3, ErrorType.QUBIT_OUT_OF_RANGE);

        assertEquals(1, e.getLine());
        assertEquals(Set.of(5), e.getQubits());
        assertEquals("Line 1: Qubit 5 out of range [0, 2]", e.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testErrorReportsLineOfOffendingStep() {
        System.out.println("--- Running test: testErrorReportsLineOfOffendingStep ---");
        SemanticException e = assertSemanticError("H 0\n\nX 1\nY 7", 3, ErrorType.QUBIT_OUT_OF_RANGE);

        assertEquals(4, e.getLine());
        assertTrue(e.getMessage().startsWith("Line 4:"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testQubitReusedInSameTimeStep() {
        System.out.println("--- Running test: testQubitReusedInSameTimeStep ---");
        SemanticException e = assertSemanticError("H 0; X 0", 3, ErrorType.QUBIT_REUSED);

        assertEquals(Set.of(0), e.getQubits());
        assertTrue(e.getMessage().contains("[0]"));

        assertSemanticError("CNOT 0-1; Toffoli 1-2-3", 4, ErrorType.QUBIT_REUSED);
        assertSemanticError("H 2; measure 2 -> c", 3, ErrorType.QUBIT_REUSED);
        assertSemanticError("X 0; if c then X 0", 3, ErrorType.QUBIT_REUSED);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testSameQubitInDifferentTimeStepsIsAllowed() {
        System.out.println("--- Running test: testSameQubitInDifferentTimeStepsIsAllowed ---");
        assertDoesNotThrow(() -> analyze("H 0\nX 0\nCNOT 0-1\nmeasure 0 -> c0", 3));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testControlEqualsTarget() {
        System.out.println("--- Running test: testControlEqualsTarget ---");
        SemanticException e = assertSemanticError("CNOT 0-0", 3, ErrorType.CONTROL_TARGET_CONFLICT);

        assertEquals(Set.of(0), e.getQubits());
        assertTrue(e.getMessage().contains("(0)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testControlEqualsTargetForEveryQubit() {
        System.out.println("--- Running test: testControlEqualsTargetForEveryQubit ---");
        int numQubits = 5;
        for (String gate : List.of("CNOT", "CX", "CZ", "SWAP")) {
            for (int i = 0; i < numQubits; i++) {
                assertSemanticError(gate + " " + i + "-" + i, numQubits, ErrorType.CONTROL_TARGET_CONFLICT);
            }
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testRangeIsCheckedBeforeControlTarget() {
        System.out.println("--- Running test: testRangeIsCheckedBeforeControlTarget ---");
        assertSemanticError("CNOT 5-5", 3, ErrorType.QUBIT_OUT_OF_RANGE);
        assertSemanticError("CNOT 0-3", 3, ErrorType.QUBIT_OUT_OF_RANGE);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testThreeQubitGateNeedsDistinctQubits() {
        System.out.println("--- Running test: testThreeQubitGateNeedsDistinctQubits ---");
        for (String source : List.of("Toffoli 0-0-1", "Toffoli 0-1-0", "Toffoli 1-0-0", "CCZ 2-2-2")) {
            assertSemanticError(source, 3, ErrorType.CONTROL_TARGET_CONFLICT);
        }
        SemanticException e = assertSemanticError("CCNOT 1-2-1", 3, ErrorType.CONTROL_TARGET_CONFLICT);
        assertEquals(Set.of(1), e.getQubits());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testDuplicateQubitsInList() {
        System.out.println("--- Running test: testDuplicateQubitsInList ---");
        SemanticException e = assertSemanticError("H 0, 1, 0", 3, ErrorType.DUPLICATE_QUBIT);
        assertEquals(Set.of(0), e.getQubits());

        assertSemanticError("QFT 0, 1, 1", 3, ErrorType.DUPLICATE_QUBIT);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testRepeatedQubitInsideModularRegisterIsAccepted() {
        System.out.println("--- Running test: testRepeatedQubitInsideModularRegisterIsAccepted ---");
        assertDoesNotThrow(() -> analyze("MOD_EXP(7, 15) 0,0-1", 3));
        assertDoesNotThrow(() -> analyze("MOD_ADD(3, 4) 0-1,2,1", 3));
        assertSemanticError("MOD_EXP(7, 15) 0,0-0", 3, ErrorType.REGISTER_OVERLAP);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testModularRegistersMustNotOverlap() {
        System.out.println("--- Running test: testModularRegistersMustNotOverlap ---");
        SemanticException e = assertSemanticError("MOD_MUL(2, 5) 0,1-1,2", 4, ErrorType.REGISTER_OVERLAP);

        assertEquals(Set.of(1), e.getQubits());
        assertSemanticError("MOD_EXP(7, 15) 0,1-2,4", 4, ErrorType.QUBIT_OUT_OF_RANGE);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testParameterChecks() {
        System.out.println("--- Running test: testParameterChecks ---");
        assertSemanticError("H(π) 0", 3, ErrorType.UNEXPECTED_PARAMETER);
        assertSemanticError("Rx(π/0) 0", 3, ErrorType.INVALID_PARAMETER);
        SemanticException e = assertSemanticError("Ry(theta) 0", 3, ErrorType.INVALID_PARAMETER);
        assertTrue(e.getQubits().isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMissingParameterOnHandBuiltAst() {
        System.out.println("--- Running test: testMissingParameterOnHandBuiltAst ---");
        SingleQubitGateNode rx = new SingleQubitGateNode("Rx", List.of(0), null, 1, 1);
        Program program = new Program(List.of(new TimeStep(List.of(rx), 1)), null);

        SemanticException e = assertThrows(SemanticException.class, () -> new SemanticAnalyzer(3).analyze(program));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals(ErrorType.MISSING_PARAMETER, e.getErrorType());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testConditionalAndMeasurementRange() {
        System.out.println("--- Running test: testConditionalAndMeasurementRange ---");
        assertSemanticError("if c0 then X 5", 3, ErrorType.QUBIT_OUT_OF_RANGE);
        assertSemanticError("if c0 then CNOT 1-1", 3, ErrorType.CONTROL_TARGET_CONFLICT);
        assertSemanticError("measure 3 -> c0", 3, ErrorType.QUBIT_OUT_OF_RANGE);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testQubitCountMustBePositive() {
        System.out.println("--- Running test: testQubitCountMustBePositive ---");
        assertThrows(IllegalArgumentException.class, () -> new SemanticAnalyzer(0));
        assertThrows(IllegalArgumentException.class, () -> new SemanticAnalyzer(-1));
        System.out.println("Result: Test PASSED.\n");
    }
}
