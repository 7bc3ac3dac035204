package io.netnotes.textarea.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * LineBreaker - wraps text into rows under width and length limits
 *
 * MEASUREMENT:
 * - cell positions follow the pen: a cell's xEnd is the advance of the row
 *   prefix up to and including it (plus letter spacing per codepoint) and its
 *   xStart is the previous cell's xEnd, so a space cell is as wide as a space
 * - overflow is decided on the ink width of the prefix, which leaves out
 *   trailing spaces; a space never pushes a row over the limit and may hang
 *   past it
 *
 * BREAKING:
 * - "\n" closes the row and is kept as a zero-width cell at the row end
 * - on overflow with whole words enabled the row breaks after its last space
 *   and the trailing fragment is carried to the next row, shifted left by the
 *   x where it started
 * - otherwise the row breaks before the overflowing character
 * - a row that is still empty never breaks, so an indivisible glyph wider
 *   than the limit sits alone on its row
 */
public final class LineBreaker {

    public static final double UNBOUNDED_WIDTH = Double.POSITIVE_INFINITY;
    public static final int UNBOUNDED_CHARS = Integer.MAX_VALUE;

    private LineBreaker() {}

    public static TextLayout wrap(FontMetrics metrics, String text, double letterSpacing) {
        return wrap(metrics, text, letterSpacing, UNBOUNDED_WIDTH, UNBOUNDED_CHARS, false);
    }

    /**
     * @param metrics font measurement
     * @param text text to lay out; newlines force row breaks
     * @param letterSpacing extra pixels added per codepoint
     * @param maxWidth row width limit, {@link #UNBOUNDED_WIDTH} for none
     * @param maxLineChars codepoints allowed per row, {@link #UNBOUNDED_CHARS} for none
     * @param wholeWords break at spaces instead of inside words
     */
    public static TextLayout wrap(FontMetrics metrics, String text, double letterSpacing,
                                  double maxWidth, int maxLineChars, boolean wholeWords) {
        int[] codePoints = text.codePoints().toArray();
        int count = codePoints.length;

        List<CharCell> cells = new ArrayList<>(count + 1);
        List<Section> sections = new ArrayList<>();
        List<String> lines = new ArrayList<>();

        StringBuilder line = new StringBuilder();
        int row = 0;
        int col = 0;
        int rowStart = 0;

        for (int n = 0; n < count; n++) {
            int codePoint = codePoints[n];
            col++;

            if (codePoint == '\n') {
                lines.add(line.append(CharCell.NEWLINE).toString());
                line.setLength(0);
                double x = col == 1 ? 0 : cells.get(n - 1).getXEnd();
                cells.add(new CharCell(row, col, x, x, CharCell.NEWLINE));
                sections.add(new Section(rowStart, n));
                rowStart = n + 1;
                row++;
                col = 0;
                continue;
            }

            String glyph = new String(Character.toChars(codePoint));
            String candidate = line + glyph;
            boolean overflow = col > 1
                && (measure(metrics, candidate, letterSpacing) > maxWidth || col > maxLineChars);

            if (!overflow) {
                line.append(glyph);
                double x = col == 1 ? 0 : cells.get(n - 1).getXEnd();
                cells.add(new CharCell(row, col, x, advance(metrics, candidate, letterSpacing), glyph));
                continue;
            }

            if (wholeWords && candidate.indexOf(' ') >= 0) {
                int pos2 = n - 1;
                int breakAt = pos2;
                for (int p = pos2; p > rowStart; p--) {
                    if (cells.get(p).isSpace()) {
                        breakAt = p;
                        break;
                    }
                }

                lines.add(joinGlyphs(cells, rowStart, breakAt));
                sections.add(new Section(rowStart, breakAt));
                row++;
                col = 0;
                rowStart = breakAt + 1;

                line.setLength(0);
                double x = 0;
                if (breakAt < pos2) {
                    double offset = cells.get(breakAt + 1).getXStart();
                    for (int p = breakAt + 1; p <= pos2; p++) {
                        col++;
                        CharCell carried = cells.get(p);
                        line.append(carried.getGlyph());
                        cells.set(p, carried.moved(row, col, offset));
                    }
                    x = cells.get(pos2).getXEnd();
                }

                col++;
                line.append(glyph);
                cells.add(new CharCell(row, col, x, advance(metrics, line.toString(), letterSpacing), glyph));
            } else {
                lines.add(line.toString());
                sections.add(new Section(rowStart, n - 1));
                rowStart = n;
                row++;
                col = 1;

                line.setLength(0);
                line.append(glyph);
                cells.add(new CharCell(row, col, 0, advance(metrics, glyph, letterSpacing), glyph));
            }
        }

        lines.add(line.toString());

        CharCell sentinel;
        if (count == 0) {
            sentinel = new CharCell(0, 1, 0, 0, CharCell.SENTINEL);
        } else {
            CharCell last = cells.get(count - 1);
            if (last.isNewline()) {
                sentinel = new CharCell(last.getRow() + 1, 1, 0, 0, CharCell.SENTINEL);
            } else {
                sentinel = new CharCell(last.getRow(), last.getCol() + 1, last.getXEnd(), last.getXEnd(), CharCell.SENTINEL);
            }
        }
        cells.add(sentinel);
        sections.add(new Section(rowStart, count));

        return new TextLayout(
            cells.toArray(new CharCell[0]),
            sections.toArray(new Section[0]),
            lines.toArray(new String[0])
        );
    }

    /**
     * Ink width of {@code text} plus letter spacing, the width tested against
     * the row limit.
     */
    public static double measure(FontMetrics metrics, String text, double letterSpacing) {
        return withSpacing(metrics.measureBounds(text).getWidth(), text, letterSpacing);
    }

    /**
     * Pen advance of {@code text} plus letter spacing, where the next glyph starts.
     */
    public static double advance(FontMetrics metrics, String text, double letterSpacing) {
        return withSpacing(metrics.advanceX(text), text, letterSpacing);
    }

    private static double withSpacing(double width, String text, double letterSpacing) {
        if (letterSpacing != 0) {
            width += letterSpacing * text.codePointCount(0, text.length());
        }
        return width;
    }

    private static String joinGlyphs(List<CharCell> cells, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int p = from; p <= to; p++) {
            sb.append(cells.get(p).getGlyph());
        }
        return sb.toString();
    }
}
