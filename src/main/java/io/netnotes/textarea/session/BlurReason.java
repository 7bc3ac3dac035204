package io.netnotes.textarea.session;

/**
 * Why a focus session ended.
 */
public enum BlurReason {
    /** Esc key. */
    ESC,
    /** Go / Enter in one-line mode / Shift+Enter. */
    GO,
    /** Another text area took the focus. */
    SWITCH,
    /** The host called {@link EditingSession#blur()}. */
    PROGRAMMATIC;

    public boolean isEscape() {
        return this == ESC || this == SWITCH;
    }
}
