package io.netnotes.textarea.cursor;

public enum Direction {
    LEFT,
    RIGHT,
    UP,
    DOWN,
    HOME,
    END,
    PAGE_UP,
    PAGE_DOWN;

    public boolean isVertical() {
        return this == UP || this == DOWN || this == PAGE_UP || this == PAGE_DOWN;
    }
}
