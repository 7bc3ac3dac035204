package io.netnotes.textarea.utils.strings;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CodePointHelpersTest {
    private static final String TEXT = "a😀b";

    @Test
    void indicesCountCodePoints() {
        assertEquals(3, CodePointHelpers.length(TEXT));
        assertEquals(3, CodePointHelpers.offsetOf(TEXT, 2));
        assertEquals("😀", CodePointHelpers.substring(TEXT, 1, 2));
    }

    @Test
    void editsKeepSurrogatePairsWhole() {
        assertEquals("a😀xb", CodePointHelpers.insert(TEXT, 2, "x"));
        assertEquals("ab", CodePointHelpers.remove(TEXT, 1, 2));
    }

    @Test
    void indicesAreClamped() {
        assertEquals(TEXT + "!", CodePointHelpers.insert(TEXT, 99, "!"));
        assertEquals(TEXT, CodePointHelpers.remove(TEXT, 2, 1));
        assertEquals("", CodePointHelpers.substring(TEXT, -5, 0));
    }

    @Test
    void lowerCasesSingleCodePoint() {
        assertEquals("q", CodePointHelpers.lowerCase('Q'));
    }
}
