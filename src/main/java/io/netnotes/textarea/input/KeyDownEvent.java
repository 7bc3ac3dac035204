package io.netnotes.textarea.input;

/**
 * A key press. Three sources produce it:
 * <ul>
 *   <li>hardware keys: a HID key code plus the code point the host delivered</li>
 *   <li>virtual keyboard text: a code point inserted as-is</li>
 *   <li>virtual keyboard special keys, optionally with the keyboard's own shift state</li>
 * </ul>
 */
public final class KeyDownEvent {
    public static final int NO_CODE_POINT = -1;

    private final int keyCode;
    private final int codePoint;
    private final SpecialKey specialKey;
    private final boolean shift;
    private final boolean rawText;

    private KeyDownEvent(int keyCode, int codePoint, SpecialKey specialKey, boolean shift, boolean rawText) {
        this.keyCode = keyCode;
        this.codePoint = codePoint;
        this.specialKey = specialKey;
        this.shift = shift;
        this.rawText = rawText;
    }

    /**
     * Hardware key. Text from raw keys is lower-cased unless Shift is held.
     */
    public static KeyDownEvent hardware(int keyCode, int codePoint) {
        return new KeyDownEvent(keyCode, codePoint, Keyboard.specialKeyOf(keyCode), false, true);
    }

    public static KeyDownEvent text(int codePoint) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("[KeyDownEvent.text] invalid code point: " + codePoint);
        }
        return new KeyDownEvent(Keyboard.KeyCode.NONE, codePoint, null, false, false);
    }

    public static KeyDownEvent special(SpecialKey key) {
        return special(key, false);
    }

    public static KeyDownEvent special(SpecialKey key, boolean shift) {
        if (key == null) {
            throw new IllegalArgumentException("[KeyDownEvent.special] key is null");
        }
        return new KeyDownEvent(Keyboard.KeyCode.NONE, NO_CODE_POINT, key, shift, false);
    }

    public int getKeyCode() { return keyCode; }
    public int getCodePoint() { return codePoint; }
    public SpecialKey getSpecialKey() { return specialKey; }
    public boolean isShift() { return shift; }
    public boolean isRawText() { return rawText; }

    public boolean hasCodePoint() {
        return codePoint != NO_CODE_POINT;
    }

    @Override
    public String toString() {
        return "KeyDownEvent[keyCode=" + keyCode + ", codePoint=" + codePoint
            + ", specialKey=" + specialKey + ", shift=" + shift + "]";
    }
}
