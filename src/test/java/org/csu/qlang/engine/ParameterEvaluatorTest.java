package org.csu.qlang.engine;

import org.csu.qlang.common.exception.ParameterEvaluationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterEvaluatorTest {

    private static final double DELTA = 1e-9;

    @Test
    void testPiFractions() {
        System.out.println("--- Running test: testPiFractions ---");
        assertEquals(1.5707963, ParameterEvaluator.evaluate("π/2"), 1e-7);
        assertEquals(Math.PI, ParameterEvaluator.evaluate("pi"), DELTA);
        assertEquals(Math.PI / 4, ParameterEvaluator.evaluate(" π / 4 "), DELTA);
        assertEquals(Math.PI / 2, ParameterEvaluator.evaluate("2*π/4"), DELTA);
        assertEquals(-Math.PI, ParameterEvaluator.evaluate("-π"), DELTA);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testArithmetic() {
        System.out.println("--- Running test: testArithmetic ---");
        assertEquals(9.0, ParameterEvaluator.evaluate("(1+2)*3"), DELTA);
        assertEquals(7.0, ParameterEvaluator.evaluate("1+2*3"), DELTA);
        assertEquals(0.5, ParameterEvaluator.evaluate("1/2"), DELTA);
        assertEquals(-1.0, ParameterEvaluator.evaluate("1-2"), DELTA);
        assertEquals(2.0, ParameterEvaluator.evaluate("--2"), DELTA);
        assertEquals(15.0, ParameterEvaluator.evaluate("1.5e1"), DELTA);
        assertEquals(0.25, ParameterEvaluator.evaluate(".25"), DELTA);
        assertEquals(Math.PI / 3, ParameterEvaluator.evaluate("π/(1+2)"), DELTA);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInvalidExpressions() {
        System.out.println("--- Running test: testInvalidExpressions ---");
        for (String expression : List.of("", "   ", "1/0", "π/(1-1)", "theta", "1+", "2 3", "(1+2", "1)", ".")) {
            ParameterEvaluationException e = assertThrows(ParameterEvaluationException.class,
                    () -> ParameterEvaluator.evaluate(expression),
                    "expected failure for '" + expression + "'");
            System.out.println("Caught expected exception: " + e.getMessage());
        }
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDeeplyNestedParenthesesAreRejected() {
        System.out.println("--- Running test: testDeeplyNestedParenthesesAreRejected ---");
        String deep = "(".repeat(50000) + "1" + ")".repeat(50000);

        ParameterEvaluationException e = assertThrows(ParameterEvaluationException.class,
                () -> ParameterEvaluator.evaluate(deep));
        assertTrue(e.getMessage().contains("nested too deeply"));
        assertFalse(ParameterEvaluator.tryEvaluate(deep).isPresent());

        String shallow = "(".repeat(200) + "π" + ")".repeat(200);
        assertEquals(Math.PI, ParameterEvaluator.evaluate(shallow), DELTA);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLongSignPrefixIsFolded() {
        System.out.println("--- Running test: testLongSignPrefixIsFolded ---");
        assertEquals(1.0, ParameterEvaluator.evaluate("-".repeat(50000) + "1"), DELTA);
        assertEquals(-1.0, ParameterEvaluator.evaluate("-".repeat(50001) + "1"), DELTA);
        assertEquals(-2.0, ParameterEvaluator.evaluate("+-+ 2"), DELTA);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTryEvaluate() {
        System.out.println("--- Running test: testTryEvaluate ---");
        assertTrue(ParameterEvaluator.tryEvaluate("π").isPresent());
        assertFalse(ParameterEvaluator.tryEvaluate("x+1").isPresent());
        System.out.println("Result: Test PASSED.\n");
    }
}
