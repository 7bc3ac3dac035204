package io.netnotes.textarea.utils.strings;

import java.util.Locale;

/**
 * String edits addressed by code point index instead of UTF-16 index.
 * Indices are clamped into [0, length].
 */
public class CodePointHelpers {

    public static int length(String str) {
        return str.codePointCount(0, str.length());
    }

    /**
     * UTF-16 offset of the code point at {@code index}.
     */
    public static int offsetOf(String str, int index) {
        int count = length(str);
        int clamped = Math.max(0, Math.min(index, count));
        return str.offsetByCodePoints(0, clamped);
    }

    public static String substring(String str, int from, int to) {
        int start = offsetOf(str, from);
        int end = offsetOf(str, to);
        if (end <= start) {
            return "";
        }
        return str.substring(start, end);
    }

    public static String insert(String str, int index, String insert) {
        int offset = offsetOf(str, index);
        return str.substring(0, offset) + insert + str.substring(offset);
    }

    /**
     * Removes code points {@code [from, to)}.
     */
    public static String remove(String str, int from, int to) {
        int start = offsetOf(str, from);
        int end = offsetOf(str, to);
        if (end <= start) {
            return str;
        }
        return str.substring(0, start) + str.substring(end);
    }

    /**
     * Lower-cases a single code point the way {@link String#toLowerCase()}
     * would for a one-character string in the root locale.
     */
    public static String lowerCase(int codePoint) {
        return new String(Character.toChars(codePoint)).toLowerCase(Locale.ROOT);
    }
}
