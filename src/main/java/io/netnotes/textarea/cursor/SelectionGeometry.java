package io.netnotes.textarea.cursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.netnotes.textarea.layout.TextLayout;
import io.netnotes.textarea.ui.Rect;

/**
 * Highlight rectangles for a selection, one per covered row.
 */
public final class SelectionGeometry {
    public static final double MIN_WIDTH = 2;

    private SelectionGeometry() {}

    public static List<Rect> rectangles(TextLayout layout, Selection selection, double lineHeight) {
        if (selection.isEmpty()) {
            return Collections.emptyList();
        }

        int start = Math.max(selection.getStart(), 0);
        int end = Math.min(selection.getEnd(), layout.getSentinelIndex());
        int firstRow = layout.getRowOf(start);
        int lastRow = layout.getRowOf(end);

        List<Rect> rects = new ArrayList<>(lastRow - firstRow + 1);
        for (int row = firstRow; row <= lastRow; row++) {
            double x1 = row == firstRow
                ? layout.getCell(start).getXStart()
                : layout.getCell(layout.getSection(row).getFirst()).getXStart();
            double x2 = row == lastRow
                ? layout.getCell(end).getXStart()
                : layout.getCell(layout.getSection(row).getLast()).getXEnd();
            rects.add(span(x1, x2, row, lineHeight));
        }
        return rects;
    }

    private static Rect span(double x1, double x2, int row, double lineHeight) {
        if (x2 - x1 < MIN_WIDTH) {
            x2 = x1 + MIN_WIDTH;
        }
        return new Rect(x1, row * lineHeight, x2 - x1, lineHeight);
    }
}
