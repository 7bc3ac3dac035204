package io.netnotes.textarea.input;

/**
 * Clipboard, history and selection commands, reachable as Ctrl chords.
 */
public enum EditCommand {
    ALL('A'),
    COPY('C'),
    CUT('X'),
    PASTE('V'),
    DUP('D'),
    UNDO('Z'),
    REDO('Y');

    private final char hotkey;

    EditCommand(char hotkey) {
        this.hotkey = hotkey;
    }

    public char getHotkey() {
        return hotkey;
    }

    /**
     * @param letter letter pressed together with Ctrl, any case
     * @return the bound command, or null
     */
    public static EditCommand forHotkey(int letter) {
        int upper = Character.toUpperCase(letter);
        for (EditCommand command : values()) {
            if (command.hotkey == upper) {
                return command;
            }
        }
        return null;
    }

    public SpecialKey toSpecialKey() {
        switch (this) {
            case ALL: return SpecialKey.ALL;
            case COPY: return SpecialKey.COPY;
            case CUT: return SpecialKey.CUT;
            case PASTE: return SpecialKey.PASTE;
            case DUP: return SpecialKey.DUP;
            case UNDO: return SpecialKey.UNDO;
            case REDO: return SpecialKey.REDO;
            default:
                throw new IllegalStateException("[EditCommand.toSpecialKey] unhandled command: " + this);
        }
    }
}
