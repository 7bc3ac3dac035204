package io.netnotes.textarea.layout;

/**
 * Ink bounding box of a measured string, relative to the pen origin.
 */
public final class Bounds {
    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Bounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "Bounds[x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "]";
    }
}
