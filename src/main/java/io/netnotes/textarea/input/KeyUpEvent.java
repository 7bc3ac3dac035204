package io.netnotes.textarea.input;

public final class KeyUpEvent {
    private final int keyCode;
    private final SpecialKey specialKey;

    private KeyUpEvent(int keyCode, SpecialKey specialKey) {
        this.keyCode = keyCode;
        this.specialKey = specialKey;
    }

    public static KeyUpEvent hardware(int keyCode) {
        return new KeyUpEvent(keyCode, Keyboard.specialKeyOf(keyCode));
    }

    public static KeyUpEvent special(SpecialKey key) {
        return new KeyUpEvent(Keyboard.KeyCode.NONE, key);
    }

    public int getKeyCode() { return keyCode; }
    public SpecialKey getSpecialKey() { return specialKey; }
}
