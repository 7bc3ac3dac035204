package io.netnotes.textarea.input;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public final class Keyboard {

    private Keyboard() {}

    public final class KeyCode {

        private KeyCode() {}

        // ============================================================
        // USB HID KEYBOARD USAGE TABLE (keys the editor reacts to)
        // ============================================================

        public static final int NONE = 0x00;

        // Letters
        public static final int A = 0x04;
        public static final int B = 0x05;
        public static final int C = 0x06;
        public static final int D = 0x07;
        public static final int E = 0x08;
        public static final int F = 0x09;
        public static final int G = 0x0A;
        public static final int H = 0x0B;
        public static final int I = 0x0C;
        public static final int J = 0x0D;
        public static final int K = 0x0E;
        public static final int L = 0x0F;
        public static final int M = 0x10;
        public static final int N = 0x11;
        public static final int O = 0x12;
        public static final int P = 0x13;
        public static final int Q = 0x14;
        public static final int R = 0x15;
        public static final int S = 0x16;
        public static final int T = 0x17;
        public static final int U = 0x18;
        public static final int V = 0x19;
        public static final int W = 0x1A;
        public static final int X = 0x1B;
        public static final int Y = 0x1C;
        public static final int Z = 0x1D;

        // Number row
        public static final int DIGIT_1 = 0x1E;
        public static final int DIGIT_2 = 0x1F;
        public static final int DIGIT_3 = 0x20;
        public static final int DIGIT_4 = 0x21;
        public static final int DIGIT_5 = 0x22;
        public static final int DIGIT_6 = 0x23;
        public static final int DIGIT_7 = 0x24;
        public static final int DIGIT_8 = 0x25;
        public static final int DIGIT_9 = 0x26;
        public static final int DIGIT_0 = 0x27;

        // Basics
        public static final int ENTER = 0x28;
        public static final int ESCAPE = 0x29;
        public static final int BACKSPACE = 0x2A;
        public static final int TAB = 0x2B;
        public static final int SPACE = 0x2C;

        // Locks & function keys
        public static final int CAPS_LOCK = 0x39;
        public static final int F1 = 0x3A;
        public static final int F2 = 0x3B;
        public static final int F3 = 0x3C;
        public static final int F4 = 0x3D;
        public static final int F5 = 0x3E;
        public static final int F6 = 0x3F;
        public static final int F7 = 0x40;
        public static final int F8 = 0x41;
        public static final int F9 = 0x42;
        public static final int F10 = 0x43;
        public static final int F11 = 0x44;
        public static final int F12 = 0x45;

        public static final int SCROLL_LOCK  = 0x47;
        public static final int PAUSE = 0x48;

        // Navigation block
        public static final int INSERT = 0x49;
        public static final int HOME = 0x4A;
        public static final int PAGE_UP = 0x4B;
        public static final int DELETE = 0x4C;
        public static final int END = 0x4D;
        public static final int PAGE_DOWN = 0x4E;

        // Arrows
        public static final int RIGHT = 0x4F;
        public static final int LEFT  = 0x50;
        public static final int DOWN  = 0x51;
        public static final int UP    = 0x52;

        public static final int NUM_LOCK = 0x53;
        public static final int KP_ENTER = 0x58;

        public static final int APPLICATION = 0x65;

        // Modifiers (left/right)
        public static final int LEFT_CONTROL  = 0xE0;
        public static final int LEFT_SHIFT    = 0xE1;
        public static final int LEFT_ALT      = 0xE2;
        public static final int LEFT_META     = 0xE3;
        public static final int RIGHT_CONTROL = 0xE4;
        public static final int RIGHT_SHIFT   = 0xE5;
        public static final int RIGHT_ALT     = 0xE6;
        public static final int RIGHT_META    = 0xE7;

        // ============================================================
        // GROUPING SETS
        // ============================================================

        public static final Set<Integer> MODIFIER_KEYS = Set.of(
                LEFT_CONTROL, LEFT_SHIFT, LEFT_ALT, LEFT_META,
                RIGHT_CONTROL, RIGHT_SHIFT, RIGHT_ALT, RIGHT_META
        );

        public static final Set<Integer> NAVIGATION_KEYS = Set.of(
                UP, DOWN, LEFT, RIGHT,
                HOME, END, PAGE_UP, PAGE_DOWN,
                INSERT, DELETE
        );

        public static boolean isModifierKey(int keyCode) {
            return MODIFIER_KEYS.contains(keyCode);
        }

        public static boolean isNavigationKey(int keyCode) {
            return NAVIGATION_KEYS.contains(keyCode);
        }

        public static boolean isLetterKey(int keyCode) {
            return keyCode >= A && keyCode <= Z;
        }

        // ============================================================
        // CONTROL CHARACTER MAPPINGS (ASCII 1-26 to HID)
        // ============================================================

        /**
         * Check if an ASCII code is a control character (1-26)
         * These are generated by Ctrl+A through Ctrl+Z
         */
        public static boolean isControlChar(int ascii) {
            return ascii >= 1 && ascii <= 26;
        }

        /**
         * Get the letter representation of a control character
         * E.g., Ctrl+C (ASCII 3) returns 'C'
         */
        public static char controlCharToLetter(int ascii) {
            if (isControlChar(ascii)) {
                return (char) ('A' + ascii - 1);
            }
            return '\0';
        }
    }

    // ============================================================
    // HID CODE -> SPECIAL KEY
    // ============================================================

    private static final Map<Integer, SpecialKey> SPECIAL_BY_CODE;

    static {
        Map<Integer, SpecialKey> map = new HashMap<>();
        map.put(KeyCode.ESCAPE, SpecialKey.ESC);
        map.put(KeyCode.ENTER, SpecialKey.ENTER);
        map.put(KeyCode.KP_ENTER, SpecialKey.NUM_ENTER);
        map.put(KeyCode.TAB, SpecialKey.TAB);
        map.put(KeyCode.BACKSPACE, SpecialKey.BS);
        map.put(KeyCode.DELETE, SpecialKey.DELETE);
        map.put(KeyCode.INSERT, SpecialKey.INSERT);

        map.put(KeyCode.LEFT, SpecialKey.LEFT);
        map.put(KeyCode.RIGHT, SpecialKey.RIGHT);
        map.put(KeyCode.UP, SpecialKey.UP);
        map.put(KeyCode.DOWN, SpecialKey.DOWN);
        map.put(KeyCode.HOME, SpecialKey.HOME);
        map.put(KeyCode.END, SpecialKey.END);
        map.put(KeyCode.PAGE_UP, SpecialKey.PAGE_UP);
        map.put(KeyCode.PAGE_DOWN, SpecialKey.PAGE_DOWN);

        map.put(KeyCode.LEFT_SHIFT, SpecialKey.SHIFT);
        map.put(KeyCode.RIGHT_SHIFT, SpecialKey.SHIFT);
        map.put(KeyCode.LEFT_CONTROL, SpecialKey.CTRL);
        map.put(KeyCode.RIGHT_CONTROL, SpecialKey.CTRL);
        map.put(KeyCode.LEFT_META, SpecialKey.WIN);
        map.put(KeyCode.RIGHT_META, SpecialKey.WIN);
        map.put(KeyCode.LEFT_ALT, SpecialKey.ALT);
        map.put(KeyCode.RIGHT_ALT, SpecialKey.ALT);

        map.put(KeyCode.CAPS_LOCK, SpecialKey.CAPS_LOCK);
        map.put(KeyCode.NUM_LOCK, SpecialKey.NUM_LOCK);
        map.put(KeyCode.SCROLL_LOCK, SpecialKey.SCROLL_LOCK);
        map.put(KeyCode.PAUSE, SpecialKey.PAUSE_BREAK);
        map.put(KeyCode.APPLICATION, SpecialKey.MENU);

        SpecialKey[] functionKeys = {
            SpecialKey.F1, SpecialKey.F2, SpecialKey.F3, SpecialKey.F4,
            SpecialKey.F5, SpecialKey.F6, SpecialKey.F7, SpecialKey.F8,
            SpecialKey.F9, SpecialKey.F10, SpecialKey.F11, SpecialKey.F12
        };
        for (int i = 0; i < functionKeys.length; i++) {
            map.put(KeyCode.F1 + i, functionKeys[i]);
        }

        SPECIAL_BY_CODE = Collections.unmodifiableMap(map);
    }

    /**
     * @return the special key for a HID code, or null for text keys and unknown codes
     */
    public static SpecialKey specialKeyOf(int keyCode) {
        return SPECIAL_BY_CODE.get(keyCode);
    }

    /**
     * Uppercase letter of a letter key code, or '\0'.
     */
    public static char letterOf(int keyCode) {
        if (KeyCode.isLetterKey(keyCode)) {
            return (char) ('A' + keyCode - KeyCode.A);
        }
        return '\0';
    }

    /**
     * Letter a Ctrl chord refers to, read from the key code first and then
     * from the delivered code point (plain letters or ASCII control characters).
     *
     * @return uppercase letter or '\0'
     */
    public static char chordLetterOf(int keyCode, int codePoint) {
        char letter = letterOf(keyCode);
        if (letter != '\0') {
            return letter;
        }
        if (KeyCode.isControlChar(codePoint)) {
            return KeyCode.controlCharToLetter(codePoint);
        }
        if ((codePoint >= 'a' && codePoint <= 'z') || (codePoint >= 'A' && codePoint <= 'Z')) {
            return Character.toUpperCase((char) codePoint);
        }
        return '\0';
    }
}
