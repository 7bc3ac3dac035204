package io.netnotes.textarea.session;

/**
 * What the pointer currently does inside the focused text area.
 */
public enum PointerMode {
    NONE,
    /** Primary mouse button held over an editable area: extends the selection. */
    SELECT,
    /** Touch, or any press over a read-only area: scrolls the content. */
    DRAG
}
