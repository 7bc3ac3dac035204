package io.netnotes.textarea.layout;

/**
 * Inclusive range of cell indices owned by one wrapped row.
 */
public final class Section {
    private final int first;
    private final int last;

    public Section(int first, int last) {
        this.first = first;
        this.last = last;
    }

    public int getFirst() {
        return first;
    }

    public int getLast() {
        return last;
    }

    public boolean contains(int index) {
        return index >= first && index <= last;
    }

    public int size() {
        return last - first + 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Section)) return false;
        Section other = (Section) obj;
        return first == other.first && last == other.last;
    }

    @Override
    public int hashCode() {
        return 31 * first + last;
    }

    @Override
    public String toString() {
        return "[" + first + ", " + last + "]";
    }
}
