package com.bat.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorityTest {

    @Test
    @DisplayName("weights are high=3, medium=2, low=1")
    void weights() {
        assertEquals(3, Priority.HIGH.weight());
        assertEquals(2, Priority.MEDIUM.weight());
        assertEquals(1, Priority.LOW.weight());
    }

    @Test
    @DisplayName("parse is case-insensitive and rejects unknown names")
    void parse() {
        assertEquals(Priority.HIGH, Priority.parse("high"));
        assertEquals(Priority.LOW, Priority.parse(" Low "));
        var ex = assertThrows(IllegalArgumentException.class, () -> Priority.parse("urgent"));
        assertTrue(ex.getMessage().startsWith("Invalid priority: urgent"));
    }
}
