package io.netnotes.textarea.history;

import java.util.ArrayList;
import java.util.List;

/**
 * HistoryManager - bounded undo/redo of (text, caret) snapshots
 *
 * LEVELS:
 * - the active level indexes the snapshot that matches the live text
 * - a new edit drops every level after the active one (the redo branch),
 *   evicts the oldest snapshot when full, stores the pre-edit caret into the
 *   active slot and appends the new text with an unresolved caret
 * - stepping back from the newest level first stores the live caret there so
 *   redo comes back to where the user left off
 *
 * A capacity of zero disables recording; navigation is then a no-op.
 */
public class HistoryManager {

    private final List<HistoryEntry> entries = new ArrayList<>();
    private int capacity;
    private int level = 0;

    public HistoryManager(int capacity, String initialText) {
        if (capacity < 0) {
            throw new IllegalArgumentException("[HistoryManager] capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
        reset(initialText);
    }

    /**
     * Forgets every snapshot and starts over from {@code text}.
     */
    public void reset(String text) {
        entries.clear();
        level = 0;
        if (capacity > 0) {
            entries.add(new HistoryEntry(text, HistoryEntry.UNRESOLVED));
        }
    }

    public boolean isEnabled() {
        return capacity > 0;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Changes the capacity, evicting the oldest snapshots that no longer fit.
     */
    public void setCapacity(int capacity, String currentText) {
        if (capacity < 0) {
            throw new IllegalArgumentException("[HistoryManager.setCapacity] capacity must be >= 0, got: " + capacity);
        }
        boolean wasEnabled = isEnabled();
        this.capacity = capacity;
        if (capacity == 0) {
            entries.clear();
            level = 0;
            return;
        }
        if (!wasEnabled) {
            reset(currentText);
            return;
        }
        while (entries.size() > capacity) {
            entries.remove(0);
            level = Math.max(0, level - 1);
        }
    }

    public int getLevel() {
        return level;
    }

    public int size() {
        return entries.size();
    }

    public HistoryEntry getEntry(int index) {
        return entries.get(index);
    }

    public boolean canUndo() {
        return isEnabled() && level > 0;
    }

    public boolean canRedo() {
        return isEnabled() && level < entries.size() - 1;
    }

    /**
     * Records a text-changing edit.
     *
     * @param newText text after the edit
     * @param caretBefore caret position before the edit
     */
    public void record(String newText, int caretBefore) {
        if (!isEnabled()) {
            return;
        }

        while (entries.size() > level + 1) {
            entries.remove(entries.size() - 1);
        }

        if (entries.size() == capacity) {
            entries.remove(0);
            level--;
        }

        if (level >= 0) {
            entries.set(level, entries.get(level).withCaret(caretBefore));
        }

        entries.add(new HistoryEntry(newText, HistoryEntry.UNRESOLVED));
        level = entries.size() - 1;
    }

    /**
     * Moves the active level by {@code delta}, clamped to the recorded range.
     *
     * @param liveCaret caret at the moment of navigation
     * @return the snapshot to restore, or null when the level did not change
     */
    public HistoryEntry navigate(int delta, int liveCaret) {
        if (!isEnabled()) {
            return null;
        }

        long target = (long) level + delta;
        int newLevel = (int) Math.max(0, Math.min(target, entries.size() - 1));
        if (newLevel == level) {
            return null;
        }

        if (newLevel < level && level == entries.size() - 1) {
            entries.set(level, entries.get(level).withCaret(liveCaret));
        }

        level = newLevel;
        return entries.get(level);
    }
}
