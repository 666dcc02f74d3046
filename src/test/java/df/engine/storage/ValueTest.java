package df.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import df.engine.catalog.DataType;

public class ValueTest {
    @Test
    void convertsPlainJavaObjects() {
        assertEquals(DataType.NUMBER, Value.from(3).type());
        assertEquals(DataType.NUMBER, Value.from(2.5f).type());
        assertEquals(DataType.TEXT, Value.from("x").type());
        assertEquals(DataType.TEXT, Value.from('c').type());
        assertEquals(DataType.BOOLEAN, Value.from(true).type());
        assertEquals(DataType.NULL, Value.from(null).type());
        assertSame(Value.UNDEFINED, Value.from(Value.UNDEFINED));
        assertThrows(IllegalArgumentException.class, () -> Value.from(new Object()));
    }

    @Test
    void integerAndDoubleOfSameMagnitudeAreEqual() {
        assertEquals(Value.from(1), Value.from(1.0));
        assertEquals(Value.from(1).hashCode(), Value.from(1L).hashCode());
    }

    @Test
    void nanEqualsNanAndZeroEqualsNegativeZero() {
        assertEquals(Value.NaN, Value.of(Double.NaN));
        assertEquals(Value.of(0.0), Value.of(-0.0));
        assertEquals(Value.of(0.0).hashCode(), Value.of(-0.0).hashCode());
    }

    @Test
    void nullAndUndefinedAreDistinct() {
        assertNotEquals(Value.NULL, Value.UNDEFINED);
        assertTrue(Value.NULL.type().isMissing());
        assertTrue(Value.UNDEFINED.type().isMissing());
    }

    @Test
    void truthiness() {
        assertFalse(Value.of(0).isTruthy());
        assertFalse(Value.NaN.isTruthy());
        assertFalse(Value.of("").isTruthy());
        assertFalse(Value.FALSE.isTruthy());
        assertFalse(Value.NULL.isTruthy());
        assertFalse(Value.UNDEFINED.isTruthy());
        assertTrue(Value.of(-1).isTruthy());
        assertTrue(Value.of("0").isTruthy());
        assertTrue(Value.TRUE.isTruthy());
    }

    @Test
    void validNumberExcludesNanAndInfinity() {
        assertTrue(Value.of(4).isValidNumber());
        assertFalse(Value.NaN.isValidNumber());
        assertFalse(Value.of(Double.POSITIVE_INFINITY).isValidNumber());
        assertFalse(Value.of("4").isValidNumber());
    }

    @Test
    void integralNumbersPrintWithoutFraction() {
        assertEquals("25", Value.of(25).toString());
        assertEquals("1.5", Value.of(1.5).toString());
        assertEquals("null", Value.NULL.toString());
        assertEquals("undefined", Value.UNDEFINED.toString());
    }

    @Test
    void typedAccessorsRejectOtherKinds() {
        assertThrows(IllegalStateException.class, () -> Value.of("a").asDouble());
        assertThrows(IllegalStateException.class, () -> Value.of(1).asText());
        assertEquals("a", Value.of("a").asText());
        assertTrue(Value.TRUE.asBoolean());
    }
}
