package com.bat.core.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("a fresh token does not throw")
    void fresh() {
        var token = new CancellationToken();
        assertFalse(token.isCancelled());
        assertDoesNotThrow(token::throwIfCancelled);
    }

    @Test
    @DisplayName("a cancelled token throws with its reason")
    void cancelled() {
        var token = new CancellationToken();
        token.cancel("Task timed out after 10ms");

        assertTrue(token.isCancelled());
        var ex = assertThrows(TaskCancelledException.class, token::throwIfCancelled);
        assertEquals("Task timed out after 10ms", ex.getMessage());
    }

    @Test
    @DisplayName("an interrupted thread counts as cancelled")
    void interrupted() {
        var token = new CancellationToken();
        Thread.currentThread().interrupt();
        try {
            assertThrows(TaskCancelledException.class, token::throwIfCancelled);
        } finally {
            Thread.interrupted();
        }
    }
}
