package io.netnotes.textarea.cursor;

/**
 * Pair of cell indices, stored in the order they were given. Consumers use
 * {@link #getStart()} and {@link #getEnd()} for the normalized range.
 */
public final class Selection {
    private final int anchor;
    private final int moving;

    public Selection(int anchor, int moving) {
        this.anchor = anchor;
        this.moving = moving;
    }

    public static Selection collapsed(int position) {
        return new Selection(position, position);
    }

    public int getAnchor() {
        return anchor;
    }

    public int getMoving() {
        return moving;
    }

    public int getStart() {
        return Math.min(anchor, moving);
    }

    public int getEnd() {
        return Math.max(anchor, moving);
    }

    public int length() {
        return getEnd() - getStart();
    }

    public boolean isEmpty() {
        return anchor == moving;
    }

    public Selection withMoving(int moving) {
        return new Selection(anchor, moving);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Selection)) return false;
        Selection other = (Selection) obj;
        return anchor == other.anchor && moving == other.moving;
    }

    @Override
    public int hashCode() {
        return 31 * anchor + moving;
    }

    @Override
    public String toString() {
        return "Selection[" + anchor + " -> " + moving + "]";
    }
}
