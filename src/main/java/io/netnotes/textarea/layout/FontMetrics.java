package io.netnotes.textarea.layout;

/**
 * Font measurement supplied by the host renderer.
 *
 * Both queries must be pure functions of the font and the string.
 */
public interface FontMetrics {

    /**
     * Ink bounds of {@code text} when drawn from the pen origin.
     */
    Bounds measureBounds(String text);

    /**
     * Horizontal pen advance after drawing {@code text}.
     */
    double advanceX(String text);
}
