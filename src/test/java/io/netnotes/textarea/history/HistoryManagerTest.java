package io.netnotes.textarea.history;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HistoryManagerTest {

    @Test
    void undoRestoresPreviousTextAndCaret() {
        HistoryManager history = new HistoryManager(10, "");
        history.record("a", 0);
        history.record("ab", 1);

        HistoryEntry entry = history.navigate(-1, 2);
        assertEquals("a", entry.getText());
        assertEquals(1, entry.getCaret());

        entry = history.navigate(-1, 1);
        assertEquals("", entry.getText());
        assertEquals(0, entry.getCaret());

        assertNull(history.navigate(-1, 0));
    }

    @Test
    void redoReturnsToLiveCaret() {
        HistoryManager history = new HistoryManager(10, "");
        history.record("abc", 0);

        history.navigate(-1, 2);
        HistoryEntry entry = history.navigate(1, 0);

        assertEquals("abc", entry.getText());
        assertEquals(2, entry.getCaret());
        assertFalse(history.canRedo());
    }

    @Test
    void newEditDropsRedoBranch() {
        HistoryManager history = new HistoryManager(10, "");
        history.record("a", 0);
        history.record("ab", 1);
        history.navigate(-1, 2);

        history.record("ax", 1);

        assertEquals(3, history.size());
        assertEquals("ax", history.getEntry(2).getText());
        assertFalse(history.canRedo());
        assertNull(history.navigate(1, 2));
    }

    @Test
    void capacityEvictsOldestSnapshot() {
        HistoryManager history = new HistoryManager(2, "");
        history.record("a", 0);
        history.record("ab", 1);
        history.record("abc", 2);

        assertEquals(2, history.size());
        assertEquals("abc", history.getEntry(history.getLevel()).getText());

        assertEquals("ab", history.navigate(-1, 3).getText());
        assertNull(history.navigate(-1, 2));
        assertFalse(history.canUndo());
    }

    @Test
    void zeroCapacityDisablesHistory() {
        HistoryManager history = new HistoryManager(0, "x");
        history.record("xy", 1);

        assertFalse(history.isEnabled());
        assertEquals(0, history.size());
        assertNull(history.navigate(-1, 2));
    }

    @Test
    void shrinkingCapacityKeepsNewest() {
        HistoryManager history = new HistoryManager(5, "");
        history.record("a", 0);
        history.record("ab", 1);
        history.record("abc", 2);

        history.setCapacity(2, "abc");

        assertEquals(2, history.size());
        assertEquals(1, history.getLevel());
        assertEquals("ab", history.getEntry(0).getText());
    }

    @Test
    void enablingStartsFromCurrentText() {
        HistoryManager history = new HistoryManager(0, "");
        history.setCapacity(3, "hello");

        assertTrue(history.isEnabled());
        assertEquals(1, history.size());
        assertEquals("hello", history.getEntry(0).getText());
        assertFalse(history.getEntry(0).hasCaret());
    }

    @Test
    void navigationClampsLargeSteps() {
        HistoryManager history = new HistoryManager(10, "");
        history.record("a", 0);
        history.record("ab", 1);

        assertEquals("", history.navigate(Integer.MIN_VALUE, 2).getText());
        assertEquals("ab", history.navigate(Integer.MAX_VALUE, 0).getText());
    }

    @Test
    void negativeCapacityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryManager(-1, ""));
    }
}
