package io.netnotes.textarea.clipboard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;

import org.junit.jupiter.api.Test;

class ClipboardTest {

    static class MemoryHost implements HostClipboard {
        String text = "";

        @Override
        public String getText() {
            return text;
        }

        @Override
        public void setText(String text) {
            this.text = text;
        }
    }

    static class BrokenHost implements HostClipboard {
        @Override
        public String getText() throws IOException {
            throw new IOException("no display");
        }

        @Override
        public void setText(String text) throws IOException {
            throw new IOException("no display");
        }
    }

    @Test
    void bufferOnlyRoundTrip() {
        Clipboard clipboard = new Clipboard();
        assertEquals("", clipboard.paste());

        clipboard.copy("hello");
        assertEquals("hello", clipboard.paste());
    }

    @Test
    void copyReachesHostAndBuffer() {
        MemoryHost host = new MemoryHost();
        Clipboard clipboard = new Clipboard(host);

        clipboard.copy("abc");

        assertEquals("abc", host.text);
        assertEquals("abc", clipboard.getBuffer());
    }

    @Test
    void pastePrefersHostText() {
        MemoryHost host = new MemoryHost();
        Clipboard clipboard = new Clipboard(host);
        clipboard.copy("mine");
        host.text = "theirs";

        assertEquals("theirs", clipboard.paste());
    }

    @Test
    void emptyHostFallsBackToBuffer() {
        MemoryHost host = new MemoryHost();
        Clipboard clipboard = new Clipboard(host);
        clipboard.copy("mine");
        host.text = "";

        assertEquals("mine", clipboard.paste());
    }

    @Test
    void failingHostDoesNotLoseText() {
        Clipboard clipboard = new Clipboard(new BrokenHost());

        clipboard.copy("kept");

        assertEquals("kept", clipboard.paste());
    }

    @Test
    void nullTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Clipboard().copy(null));
    }
}
