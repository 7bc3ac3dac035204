package io.netnotes.textarea.layout;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * TextLayout - immutable result of wrapping a text
 *
 * TABLES:
 * - cells: one per codepoint plus the trailing sentinel (index == codepoint count)
 * - sections: per row, the inclusive cell range owned by the row
 * - lines: per row, the wrapped substring; rows closed by a hard newline end
 *   with "\n", rows closed by a whole-word break end with the break space
 *
 * Post-processing (justification, alignment) produces a new instance.
 */
public final class TextLayout {

    private final CharCell[] cells;
    private final Section[] sections;
    private final String[] lines;

    TextLayout(CharCell[] cells, Section[] sections, String[] lines) {
        if (sections.length != lines.length) {
            throw new IllegalArgumentException("[TextLayout] sections and lines differ in length: "
                + sections.length + " vs " + lines.length);
        }
        this.cells = cells;
        this.sections = sections;
        this.lines = lines;
    }

    // ===== CELLS =====

    public int getCellCount() {
        return cells.length;
    }

    public CharCell getCell(int index) {
        return cells[index];
    }

    /** Index of the trailing sentinel, which is also the codepoint count. */
    public int getSentinelIndex() {
        return cells.length - 1;
    }

    public List<CharCell> getCells() {
        return Collections.unmodifiableList(Arrays.asList(cells));
    }

    CharCell[] copyCells() {
        return Arrays.copyOf(cells, cells.length);
    }

    // ===== ROWS =====

    public int getRowCount() {
        return sections.length;
    }

    public Section getSection(int row) {
        return sections[row];
    }

    public boolean hasRow(int row) {
        return row >= 0 && row < sections.length;
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(Arrays.asList(sections));
    }

    Section[] copySections() {
        return Arrays.copyOf(sections, sections.length);
    }

    public String getLine(int row) {
        return lines[row];
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(Arrays.asList(lines));
    }

    String[] copyLines() {
        return Arrays.copyOf(lines, lines.length);
    }

    /**
     * Row text without the trailing newline or whole-word break space.
     */
    public String getVisibleLine(int row) {
        String line = lines[row];
        if (line.endsWith(CharCell.NEWLINE)) {
            return line.substring(0, line.length() - 1);
        }
        if (row < sections.length - 1 && line.endsWith(CharCell.SPACE)) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    public int getRowOf(int index) {
        return cells[index].getRow();
    }

    /**
     * Index of the last cell of {@code row} that is neither whitespace nor a
     * newline/sentinel, or -1 when the row has none.
     */
    public int getLastVisibleIndex(int row) {
        Section section = sections[row];
        for (int i = section.getLast(); i >= section.getFirst(); i--) {
            CharCell cell = cells[i];
            if (!cell.isSpace() && !cell.isNewline() && !cell.isSentinel()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Right edge of the row's visible content.
     */
    public double getVisibleWidth(int row) {
        int last = getLastVisibleIndex(row);
        return last < 0 ? 0 : cells[last].getXEnd();
    }

    /**
     * Widest row of the layout. A row closed by a newline or by the end of the
     * text counts up to its last cell, so typed trailing spaces widen it. A
     * wrapped row counts only its visible glyphs; the space it broke at may
     * hang past the wrap width.
     */
    public double getContentWidth() {
        double width = 0;
        for (int row = 0; row < sections.length; row++) {
            CharCell last = cells[sections[row].getLast()];
            width = Math.max(width, getVisibleWidth(row));
            if (last.isNewline() || last.isSentinel()) {
                width = Math.max(width, last.getXEnd());
            }
        }
        return width;
    }

    /**
     * Substring covering cells {@code [from, to)}; the sentinel contributes nothing.
     */
    public String getText(int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = Math.max(0, from); i < Math.min(to, cells.length); i++) {
            sb.append(cells[i].getGlyph());
        }
        return sb.toString();
    }
}
