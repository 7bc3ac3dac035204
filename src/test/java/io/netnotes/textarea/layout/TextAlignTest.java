package io.netnotes.textarea.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TextAlignTest {

    @Test
    void fractionsMapToNamedAlignments() {
        assertEquals(TextAlign.LEFT, TextAlign.of(0));
        assertEquals(TextAlign.CENTER, TextAlign.of(0.5));
        assertEquals(TextAlign.RIGHT, TextAlign.of(1));
        assertTrue(TextAlign.of(-1).isJustified());
        assertEquals(0.25, TextAlign.of(0.25).getFraction());
    }

    @Test
    void parsesLettersAndNumbers() {
        assertEquals(TextAlign.JUSTIFIED, TextAlign.parse("J"));
        assertEquals(TextAlign.CENTER, TextAlign.parse("0.5"));
    }

    @Test
    void rejectsOutOfRangeFraction() {
        assertThrows(IllegalArgumentException.class, () -> TextAlign.of(2));
    }
}
