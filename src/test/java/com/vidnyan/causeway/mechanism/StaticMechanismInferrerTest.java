package com.vidnyan.causeway.mechanism;

import com.vidnyan.causeway.domain.error.FittingException;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.mechanism.MechanismKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StaticMechanismInferrerTest {

    private final StaticMechanismInferrer inferrer = new StaticMechanismInferrer();

    @Test
    void infer_Literal_IsConstant() {
        Mechanism mechanism = inferrer.infer("int answer() { return 42; }");

        assertEquals(MechanismKind.CONSTANT, mechanism.kind());
        assertEquals(42.0, mechanism.value());
        assertEquals(1.0, mechanism.confidence());
    }

    @Test
    void infer_ScaledParameter_IsLinear() {
        Mechanism mechanism = inferrer.infer("double f(double x) { return x * 2; }");

        assertEquals(MechanismKind.LINEAR, mechanism.kind());
        assertEquals(2.0, mechanism.coefficient());
        assertEquals(0.0, mechanism.offset());
        assertEquals("x", mechanism.variable());
        assertEquals(0.9, mechanism.confidence());
    }

    @Test
    void infer_ScaledWithOffset_IsLinear() {
        Mechanism mechanism = inferrer.infer("double f(double x) { return (x * 3) + 1; }");

        assertEquals(MechanismKind.LINEAR, mechanism.kind());
        assertEquals(3.0, mechanism.coefficient());
        assertEquals(1.0, mechanism.offset());
    }

    @Test
    void infer_SumOfTerms_IsMultiVariableLinear() {
        Mechanism mechanism = inferrer.infer("double f(double x, double y) { return 2 * x + y - 4; }");

        assertEquals(MechanismKind.LINEAR, mechanism.kind());
        assertTrue(mechanism.isMultiVariable());
        assertEquals(Map.of("x", 2.0, "y", 1.0), mechanism.coefficients());
        assertEquals(-4.0, mechanism.offset());
        assertEquals(List.of("x", "y"), mechanism.variables());
    }

    @Test
    void infer_MathCall_IsNonlinear() {
        Mechanism mechanism = inferrer.infer("double f(double x) { return Math.sqrt(x); }");

        assertEquals(MechanismKind.NONLINEAR, mechanism.kind());
        assertEquals("sqrt", mechanism.parameters().get("function"));
    }

    @Test
    void infer_Ternary_IsConditional() {
        Mechanism mechanism = inferrer.infer("double f(double x) { return x > 0 ? x : 0; }");

        assertEquals(MechanismKind.CONDITIONAL, mechanism.kind());
        assertEquals("x > 0", mechanism.parameters().get("condition"));
    }

    @Test
    void infer_AnythingElse_IsUnknown() {
        Mechanism mechanism = inferrer.infer("double f(double x, double y) { return x * y; }");

        assertEquals(MechanismKind.UNKNOWN, mechanism.kind());
        assertEquals(0.3, mechanism.confidence());
    }

    @Test
    void infer_InsideClass_UsesFirstMethod() {
        Mechanism mechanism = inferrer.infer("class A { double f(double x) { return x; } }");

        assertEquals(MechanismKind.LINEAR, mechanism.kind());
        assertEquals(1.0, mechanism.coefficient());
    }

    @Test
    void infer_Unparseable_Fails() {
        assertThrows(FittingException.class, () -> inferrer.infer("this is not java"));
    }

    @Test
    void infer_UnqualifiedCallIsNotMathFunction() {
        // a user helper that happens to be named like a Math function
        Mechanism mechanism = inferrer.infer("double f(double x) { return log(x); }");

        assertEquals(MechanismKind.UNKNOWN, mechanism.kind());
        assertEquals(MechanismKind.NONLINEAR, inferrer.infer("double f(double x) { return Math.log(x); }").kind());
    }
}
