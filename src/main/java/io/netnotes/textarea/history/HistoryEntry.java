package io.netnotes.textarea.history;

/**
 * Snapshot of the text and the caret that belongs to it.
 */
public final class HistoryEntry {
    /** Caret of the newest snapshot before it has been captured. */
    public static final int UNRESOLVED = -1;

    private final String text;
    private final int caret;

    public HistoryEntry(String text, int caret) {
        this.text = text;
        this.caret = caret;
    }

    public String getText() {
        return text;
    }

    public int getCaret() {
        return caret;
    }

    public boolean hasCaret() {
        return caret != UNRESOLVED;
    }

    HistoryEntry withCaret(int caret) {
        return new HistoryEntry(text, caret);
    }

    @Override
    public String toString() {
        return "HistoryEntry[caret=" + caret + ", length=" + text.length() + "]";
    }
}
