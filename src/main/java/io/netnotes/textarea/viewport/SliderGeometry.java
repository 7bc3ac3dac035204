package io.netnotes.textarea.viewport;

import io.netnotes.textarea.ui.Rect;

/**
 * Scrollbar thumb placement. The thumb is hidden (empty rect) when the
 * scroll range is at most one pixel.
 */
public final class SliderGeometry {

    private SliderGeometry() {}

    public static double thumbLength(double viewSize, double contentSize) {
        if (contentSize <= 0) {
            return 0;
        }
        return viewSize * viewSize / contentSize;
    }

    public static double thumbOffset(double viewSize, double thumbLength, double anchor, double scrollRange) {
        if (scrollRange == 0) {
            return 0;
        }
        return (viewSize - thumbLength) * anchor / scrollRange;
    }

    public static boolean isVisible(double scrollRange) {
        return scrollRange > 1;
    }

    /**
     * Thumb along the bottom edge of the view, in layout coordinates.
     */
    public static Rect horizontal(ViewportController viewport, double thickness) {
        if (!isVisible(viewport.getScrollWidth())) {
            return Rect.EMPTY;
        }
        double length = thumbLength(viewport.getViewWidth(), viewport.getContentWidth());
        double offset = thumbOffset(viewport.getViewWidth(), length, viewport.getAnchorX(), viewport.getScrollWidth());
        return new Rect(
            viewport.getOffsetX() + offset,
            viewport.getOffsetY() + viewport.getViewHeight() - thickness,
            length,
            thickness
        );
    }

    /**
     * Thumb along the right edge of the view, in layout coordinates.
     */
    public static Rect vertical(ViewportController viewport, double thickness) {
        if (!isVisible(viewport.getScrollHeight())) {
            return Rect.EMPTY;
        }
        double length = thumbLength(viewport.getViewHeight(), viewport.getContentHeight());
        double offset = thumbOffset(viewport.getViewHeight(), length, viewport.getAnchorY(), viewport.getScrollHeight());
        return new Rect(
            viewport.getOffsetX() + viewport.getViewWidth() - thickness,
            viewport.getOffsetY() + offset,
            thickness,
            length
        );
    }
}
