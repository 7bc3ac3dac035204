package io.netnotes.textarea.clipboard;

import io.netnotes.textarea.utils.LoggingHelpers.Log;

/**
 * Clipboard - host clipboard with an in-process fallback
 *
 * COPY: the text always lands in the in-process buffer; the host clipboard
 * gets it too when one is attached and it accepts the write.
 *
 * PASTE: host text when it is available and non-empty, otherwise the buffer.
 *
 * Host failures are logged and swallowed.
 */
public class Clipboard {

    private final HostClipboard host;
    private String buffer = "";

    public Clipboard() {
        this(null);
    }

    public Clipboard(HostClipboard host) {
        this.host = host;
    }

    public HostClipboard getHost() {
        return host;
    }

    public String getBuffer() {
        return buffer;
    }

    public void copy(String text) {
        if (text == null) {
            throw new IllegalArgumentException("[Clipboard.copy] text is null");
        }
        if (host != null) {
            try {
                host.setText(text);
            } catch (Exception e) {
                Log.logError("Clipboard.copy", "host clipboard rejected text", e);
            }
        }
        buffer = text;
    }

    /**
     * @return text to paste, empty when both sources are empty
     */
    public String paste() {
        if (host != null) {
            try {
                String text = host.getText();
                if (text != null && !text.isEmpty()) {
                    return text;
                }
            } catch (Exception e) {
                Log.logError("Clipboard.paste", "host clipboard unavailable", e);
            }
        }
        return buffer;
    }
}
