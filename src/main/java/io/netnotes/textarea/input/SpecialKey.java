package io.netnotes.textarea.input;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import io.netnotes.textarea.cursor.Direction;

/**
 * SpecialKey - non-text keys understood by the editor
 *
 * Names follow the virtual keyboard key labels ("PageDn", "BS", "Dup").
 * Hardware keys arrive through {@link Keyboard#specialKeyOf(int)}; the
 * command keys (ALL .. REDO, GO) only come from a virtual keyboard or from
 * a Ctrl chord.
 */
public enum SpecialKey {
    ESC("Esc"),
    GO("Go"),
    MENU("Menu"),

    ENTER("Enter"),
    NUM_ENTER("NumEnter"),
    TAB("Tab"),
    BS("BS"),
    DELETE("Delete"),
    INSERT("Insert"),

    LEFT("Left"),
    RIGHT("Right"),
    UP("Up"),
    DOWN("Down"),
    HOME("Home"),
    END("End"),
    PAGE_UP("PageUp"),
    PAGE_DOWN("PageDn"),

    SHIFT("Shift"),
    CTRL("Ctrl"),
    WIN("Win"),
    ALT("Alt"),

    CAPS_LOCK("CapsLock"),
    NUM_LOCK("NumLock"),
    SCROLL_LOCK("ScrollLock"),
    PAUSE_BREAK("PauseBreak"),
    F1("F1"), F2("F2"), F3("F3"), F4("F4"), F5("F5"), F6("F6"),
    F7("F7"), F8("F8"), F9("F9"), F10("F10"), F11("F11"), F12("F12"),

    ALL("All"),
    COPY("Copy"),
    CUT("Cut"),
    PASTE("Paste"),
    DUP("Dup"),
    UNDO("Undo"),
    REDO("Redo");

    private static final Map<String, SpecialKey> BY_NAME;

    static {
        Map<String, SpecialKey> map = new HashMap<>();
        for (SpecialKey key : values()) {
            map.put(key.name, key);
        }
        BY_NAME = Collections.unmodifiableMap(map);
    }

    private final String name;

    SpecialKey(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the key with this label, or null
     */
    public static SpecialKey fromName(String name) {
        return name == null ? null : BY_NAME.get(name);
    }

    public boolean isModifier() {
        return this == SHIFT || this == CTRL || this == WIN || this == ALT;
    }

    /**
     * @return the caret direction for navigation keys, otherwise null
     */
    public Direction toDirection() {
        switch (this) {
            case LEFT: return Direction.LEFT;
            case RIGHT: return Direction.RIGHT;
            case UP: return Direction.UP;
            case DOWN: return Direction.DOWN;
            case HOME: return Direction.HOME;
            case END: return Direction.END;
            case PAGE_UP: return Direction.PAGE_UP;
            case PAGE_DOWN: return Direction.PAGE_DOWN;
            default: return null;
        }
    }

    /**
     * @return the edit command bound to this key, otherwise null
     */
    public EditCommand toCommand() {
        switch (this) {
            case ALL: return EditCommand.ALL;
            case COPY: return EditCommand.COPY;
            case CUT: return EditCommand.CUT;
            case PASTE: return EditCommand.PASTE;
            case DUP: return EditCommand.DUP;
            case UNDO: return EditCommand.UNDO;
            case REDO: return EditCommand.REDO;
            default: return null;
        }
    }
}
