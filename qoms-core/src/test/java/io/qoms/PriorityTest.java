package io.qoms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PriorityTest {

    @Test
    void codesFollowDeclarationOrder() {
        assertEquals(0, Priority.CRITICAL.code());
        assertEquals(1, Priority.HIGH.code());
        assertEquals(2, Priority.MEDIUM.code());
        assertEquals(3, Priority.LOW.code());
        assertEquals(4, Priority.IDLE.code());
    }

    @Test
    void promotedMovesUpOneTier() {
        assertEquals(Priority.LOW, Priority.IDLE.promoted());
        assertEquals(Priority.MEDIUM, Priority.LOW.promoted());
        assertEquals(Priority.HIGH, Priority.MEDIUM.promoted());
        assertEquals(Priority.CRITICAL, Priority.HIGH.promoted());
    }

    @Test
    void criticalIsTerminal() {
        assertEquals(Priority.CRITICAL, Priority.CRITICAL.promoted());
    }

    @Test
    void fromCodeRoundTripsEveryTier() {
        for (Priority priority : Priority.values()) {
            assertEquals(priority, Priority.fromCode(priority.code()));
        }
    }

    @Test
    void fromCodeRejectsUnknownCodes() {
        assertThrows(IllegalArgumentException.class, () -> Priority.fromCode(-1));
        assertThrows(IllegalArgumentException.class, () -> Priority.fromCode(5));
    }
}
