package io.netnotes.textarea.input;

/**
 * Mouse or touch event. Coordinates are relative to the top-left corner of
 * the text area's visible window.
 */
public final class PointerEvent {
    public static final int PRIMARY_BUTTON = 1;

    public enum Type {
        DOWN,
        MOVE,
        UP
    }

    private final Type type;
    private final double x;
    private final double y;
    private final boolean touch;
    private final int button;

    public PointerEvent(Type type, double x, double y, boolean touch, int button) {
        if (type == null) {
            throw new IllegalArgumentException("[PointerEvent] type is null");
        }
        this.type = type;
        this.x = x;
        this.y = y;
        this.touch = touch;
        this.button = button;
    }

    public static PointerEvent mouse(Type type, double x, double y) {
        return new PointerEvent(type, x, y, false, PRIMARY_BUTTON);
    }

    public static PointerEvent touch(Type type, double x, double y) {
        return new PointerEvent(type, x, y, true, PRIMARY_BUTTON);
    }

    public Type getType() { return type; }
    public double x() { return x; }
    public double y() { return y; }
    public boolean isTouch() { return touch; }
    public int getButton() { return button; }

    public boolean isPrimary() {
        return button == PRIMARY_BUTTON;
    }

    @Override
    public String toString() {
        return "PointerEvent[" + type + " " + x + "," + y + (touch ? " touch" : "") + "]";
    }
}
