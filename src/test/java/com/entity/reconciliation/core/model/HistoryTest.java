package com.entity.reconciliation.core.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HistoryTest {

    private History history;

    @BeforeEach
    void setUp() {
        history = new History();
    }

    @Test
    @DisplayName("A status change should append a transition")
    void testTransition() {
        assertTrue(history.update("A", "F", "alice", "out of scope", null));

        assertEquals(1, history.size());
        HistoryRecord record = history.getRecords().get(0);
        assertEquals("A", record.getFrom());
        assertEquals("F", record.getTo());
        assertEquals("alice", record.getBy());
        assertEquals("out of scope", record.getComment());
        assertNotNull(record.getUpdated());
        assertTrue(record.isTransition());
    }

    @Test
    @DisplayName("The same status should not be recorded")
    void testSameStatus() {
        assertFalse(history.update("A", "A", "alice", null, null));
        assertFalse(history.update("A", "", "alice", null, null));
        assertEquals(0, history.size());
    }

    @Test
    @DisplayName("A comment without a status change should be kept as a bare record")
    void testCommentOnly() {
        assertFalse(history.update("A", null, "alice", "looked at it", null));

        assertEquals(1, history.size());
        assertFalse(history.getRecords().get(0).isTransition());
    }

    @Test
    @DisplayName("Removing a comment-only record should drop it")
    void testRemoveComment() {
        history.update("A", null, "alice", "note", null);
        History edit = new History();
        edit.setRemove(0);

        assertFalse(history.update("A", "F", "alice", null, edit));

        assertEquals(0, history.size());
    }

    @Test
    @DisplayName("Removing a transition should only clear its comment")
    void testRemoveTransitionComment() {
        history.update("A", "F", "alice", "note", null);
        History edit = new History();
        edit.setRemove(0);

        history.update("F", null, "alice", null, edit);

        assertEquals(1, history.size());
        assertNull(history.getRecords().get(0).getComment());
        assertEquals("F", history.getRecords().get(0).getTo());
    }

    @Test
    @DisplayName("An out of range removal should be ignored")
    void testRemoveOutOfRange() {
        History edit = new History();
        edit.setRemove(5);

        assertTrue(history.update("A", "F", "alice", null, edit));
        assertEquals(1, history.size());
    }

    @Test
    @DisplayName("Records should not be modifiable from outside")
    void testUnmodifiable() {
        history.update("A", "F", "alice", null, null);

        assertThrows(UnsupportedOperationException.class, () -> history.getRecords().clear());
    }
}
