package io.netnotes.textarea.layout;

/**
 * Shifts every row by a fraction of its free width: 0 keeps rows on the left
 * edge, 0.5 centers them, 1 pushes them to the right edge.
 */
public final class LineAligner {

    private LineAligner() {}

    public static TextLayout align(TextLayout layout, double fraction, double maxWidth) {
        if (fraction == 0 || Double.isInfinite(maxWidth)) {
            return layout;
        }

        CharCell[] cells = layout.copyCells();
        for (int row = 0; row < layout.getRowCount(); row++) {
            double dx = fraction * (maxWidth - layout.getVisibleWidth(row));
            Section section = layout.getSection(row);
            for (int p = section.getFirst(); p <= section.getLast(); p++) {
                cells[p] = cells[p].shifted(dx);
            }
        }
        return new TextLayout(cells, layout.copySections(), layout.copyLines());
    }
}
