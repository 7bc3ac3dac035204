package io.netnotes.textarea.layout;

/**
 * Fixed-pitch metrics for tests: every codepoint advances 10 pixels and ink
 * stops at the last non-space glyph, so trailing spaces measure as nothing.
 */
public class MonospaceMetrics implements FontMetrics {
    public static final double ADVANCE = 10;
    public static final double ASCENT = 9;
    public static final double HEIGHT = 12;

    @Override
    public Bounds measureBounds(String text) {
        String ink = text.stripTrailing();
        return new Bounds(0, -ASCENT, ADVANCE * ink.codePointCount(0, ink.length()), HEIGHT);
    }

    @Override
    public double advanceX(String text) {
        return ADVANCE * text.codePointCount(0, text.length());
    }
}
