package io.netnotes.textarea.layout;

/**
 * One entry of the per-codepoint position table.
 *
 * {@code xStart}/{@code xEnd} are pixel offsets within the cell's row in
 * layout coordinates. The trailing sentinel cell has an empty glyph and zero
 * width; it is where the caret sits after the last character.
 */
public final class CharCell {
    public static final String NEWLINE = "\n";
    public static final String SPACE = " ";
    public static final String SENTINEL = "";

    private final int row;
    private final int col;
    private final double xStart;
    private final double xEnd;
    private final String glyph;

    public CharCell(int row, int col, double xStart, double xEnd, String glyph) {
        this.row = row;
        this.col = col;
        this.xStart = xStart;
        this.xEnd = xEnd;
        this.glyph = glyph;
    }

    public int getRow() {
        return row;
    }

    /** 1-based column within the row. */
    public int getCol() {
        return col;
    }

    public double getXStart() {
        return xStart;
    }

    public double getXEnd() {
        return xEnd;
    }

    public double getMidX() {
        return 0.5 * (xStart + xEnd);
    }

    public String getGlyph() {
        return glyph;
    }

    public boolean isSpace() {
        return SPACE.equals(glyph);
    }

    public boolean isNewline() {
        return NEWLINE.equals(glyph);
    }

    public boolean isSentinel() {
        return glyph.isEmpty();
    }

    public CharCell withX(double xStart, double xEnd) {
        return new CharCell(row, col, xStart, xEnd, glyph);
    }

    /** Same glyph placed on another row and column, {@code offset} pixels further left. */
    public CharCell moved(int row, int col, double offset) {
        return new CharCell(row, col, xStart - offset, xEnd - offset, glyph);
    }

    public CharCell shifted(double dx) {
        return dx == 0 ? this : new CharCell(row, col, xStart + dx, xEnd + dx, glyph);
    }

    @Override
    public String toString() {
        return "CharCell[row=" + row + ", col=" + col + ", x=" + xStart + ".." + xEnd + ", '" + glyph + "']";
    }
}
