package io.netnotes.textarea;

@FunctionalInterface
public interface EditingFinishedListener {

    /**
     * Called once when a focus session ends with changed text.
     *
     * @param wasEscaped true when the session ended by Esc or by focus moving
     *                   to another text area
     */
    void onEditingFinished(TextArea area, boolean wasEscaped);
}
