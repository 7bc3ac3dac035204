package io.netnotes.textarea;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TextColorTest {

    @Test
    void wholeNumberIsOpaque() {
        TextColor color = TextColor.fromEncoded(0xFF0000);

        assertEquals(0xFF0000, color.getRgb());
        assertEquals(1, color.getAlpha());
        assertEquals(0xFF0000, color.toEncoded());
    }

    @Test
    void fractionIsAlpha() {
        TextColor color = TextColor.fromEncoded(0x00FF00 + 0.5);

        assertEquals(0x00FF00, color.getRgb());
        assertEquals(0.5, color.getAlpha());
        assertEquals(0x00FF00 + 0.5, color.toEncoded());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> TextColor.fromEncoded(-1));
        assertThrows(IllegalArgumentException.class, () -> TextColor.fromEncoded(0x1000000));
        assertThrows(IllegalArgumentException.class, () -> new TextColor(0, 1.5));
    }
}
