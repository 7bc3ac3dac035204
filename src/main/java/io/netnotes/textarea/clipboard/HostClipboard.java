package io.netnotes.textarea.clipboard;

import java.io.IOException;

/**
 * System clipboard of the host platform. Implementations may fail at any
 * time (no display, permission denied, unsupported flavor).
 */
public interface HostClipboard {

    /**
     * @return current clipboard text, or null when it holds no text
     */
    String getText() throws IOException;

    void setText(String text) throws IOException;
}
