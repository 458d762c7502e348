package com.vidnyan.grader.domain.variable;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VariableValueTest {

    @Test
    void value_ShouldExposeResolvedValue() {
        VariableValue value = VariableValue.of(5L);

        assertTrue(value.isResolved());
        assertEquals(Optional.of(5L), value.value());
        assertEquals(5L, ((VariableValue.Resolved) value).raw());
    }

    @Test
    void value_ShouldMapNullToPythonNone() {
        assertEquals(Optional.of(PyNone.NONE), VariableValue.of(null).value());
    }

    @Test
    void value_ShouldBeEmptyWhenUnresolvable() {
        VariableValue value = VariableValue.unresolvable();

        assertFalse(value.isResolved());
        assertTrue(value.value().isEmpty());
        assertEquals("Unresolvable dynamic value", value.toString());
    }
}
