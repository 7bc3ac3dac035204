package io.netnotes.textarea.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Justifier - stretches inter-word space so rows fill the available width
 *
 * RULES:
 * - the last row and rows closed by a hard newline are left alone
 * - extra space is counted in whole space units, where one unit is the
 *   advance a second space adds after a first one (plus letter spacing)
 * - a gap is a run of spaces with a visible glyph on both sides; leading and
 *   trailing whitespace never receives space and a multi-space run is one gap
 * - the first {@code extra % gaps} gaps get one unit more than the others
 * - a row without gaps is returned unchanged
 */
public final class Justifier {

    private Justifier() {}

    public static TextLayout justify(TextLayout layout, FontMetrics metrics, double maxWidth, double letterSpacing) {
        double unit = spaceUnit(metrics, letterSpacing);
        if (unit <= 0 || Double.isInfinite(maxWidth)) {
            return layout;
        }

        CharCell[] cells = layout.copyCells();
        String[] lines = layout.copyLines();
        int rows = layout.getRowCount();

        for (int row = 0; row < rows - 1; row++) {
            Section section = layout.getSection(row);
            if (cells[section.getLast()].isNewline()) {
                continue;
            }

            int extra = extraUnits(layout, row, maxWidth, unit);
            if (extra <= 0) {
                continue;
            }

            List<int[]> gaps = findGaps(cells, section);
            if (gaps.isEmpty()) {
                continue;
            }

            lines[row] = stretchRow(cells, section, gaps, extra, unit);
        }

        return new TextLayout(cells, layout.copySections(), lines);
    }

    /**
     * Pixel width of one added space.
     */
    public static double spaceUnit(FontMetrics metrics, double letterSpacing) {
        return metrics.advanceX("  ") - metrics.advanceX(" ") + letterSpacing;
    }

    /**
     * Whole space units that fit between the row's visible content and {@code maxWidth}.
     */
    public static int extraUnits(TextLayout layout, int row, double maxWidth, double unit) {
        return (int) Math.floor((maxWidth - layout.getVisibleWidth(row)) / unit);
    }

    /**
     * Interior space runs of the row as inclusive {@code [first, last]} cell ranges,
     * left to right.
     */
    public static List<int[]> findGaps(CharCell[] cells, Section section) {
        List<int[]> gaps = new ArrayList<>();
        int runStart = -1;
        boolean seenVisible = false;

        for (int p = section.getFirst(); p <= section.getLast(); p++) {
            CharCell cell = cells[p];
            if (cell.isSpace()) {
                if (runStart < 0) {
                    runStart = p;
                }
                continue;
            }
            boolean visible = !cell.isNewline() && !cell.isSentinel();
            if (runStart >= 0 && seenVisible && visible) {
                gaps.add(new int[] { runStart, p - 1 });
            }
            runStart = -1;
            seenVisible |= visible;
        }
        return gaps;
    }

    private static String stretchRow(CharCell[] cells, Section section, List<int[]> gaps, int extra, double unit) {
        int base = extra / gaps.size();
        int remainder = extra % gaps.size();

        StringBuilder line = new StringBuilder();
        double added = 0;
        int gapIndex = 0;
        int[] gap = gaps.get(0);

        for (int p = section.getFirst(); p <= section.getLast(); p++) {
            CharCell cell = cells[p];
            line.append(cell.getGlyph());

            if (gap != null && p >= gap[0] && p <= gap[1]) {
                int units = base + (gapIndex < remainder ? 1 : 0);
                double gapWidth = units * unit;
                int runLength = gap[1] - gap[0] + 1;
                double perSpace = gapWidth / runLength;
                int i = p - gap[0];

                cells[p] = cell.withX(cell.getXStart() + added + perSpace * i,
                    cell.getXEnd() + added + perSpace * (i + 1));

                if (p == gap[1]) {
                    line.append(CharCell.SPACE.repeat(units));
                    added += gapWidth;
                    gapIndex++;
                    gap = gapIndex < gaps.size() ? gaps.get(gapIndex) : null;
                }
            } else {
                cells[p] = cell.shifted(added);
            }
        }
        return line.toString();
    }
}
