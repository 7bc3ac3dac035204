package io.netnotes.textarea.viewport;

import io.netnotes.textarea.ui.Rect;

/**
 * ViewportController - visible window into the laid-out content
 *
 * SCROLL STATE:
 * - scroll ranges are content minus view minus a one pixel guard, never negative
 * - the anchor is clamped into the ranges; an axis without range stays at 0
 * - valign only offsets content that fits vertically and is never stored as
 *   scroll state
 *
 * CARET FOLLOWING:
 * - a caret outside the visible band moves the anchor by the smallest amount
 *   that brings it back to the nearest edge
 * - the right edge keeps room for the caret width
 *
 * ANIMATION:
 * - animateTo() interpolates the anchor linearly, one step per tick()
 * - any direct scroll cancels a running animation
 */
public class ViewportController {
    public static final double EDGE_GUARD = 1;

    private double viewWidth;
    private double viewHeight;
    private double contentWidth;
    private double contentHeight;
    private double valign = 0;
    private double lineHeight = 0;
    private double caretWidth = 0;

    private double anchorX = 0;
    private double anchorY = 0;

    private double animFromX;
    private double animFromY;
    private double animToX;
    private double animToY;
    private int animFrames = 0;
    private int animFrame = 0;

    public ViewportController(double viewWidth, double viewHeight) {
        this.viewWidth = viewWidth;
        this.viewHeight = viewHeight;
    }

    // ===== GEOMETRY =====

    /**
     * Applies new content/view extents and re-clamps the anchor.
     */
    public void updateArea(double contentWidth, double contentHeight, double viewWidth, double viewHeight) {
        this.contentWidth = contentWidth;
        this.contentHeight = contentHeight;
        this.viewWidth = viewWidth;
        this.viewHeight = viewHeight;
        anchorX = clampX(anchorX);
        anchorY = clampY(anchorY);
        if (isAnimating()) {
            animToX = clampX(animToX);
            animToY = clampY(animToY);
        }
    }

    public void setLineHeight(double lineHeight) {
        this.lineHeight = lineHeight;
    }

    public void setCaretWidth(double caretWidth) {
        this.caretWidth = caretWidth;
    }

    public void setValign(double valign) {
        if (Double.isNaN(valign) || valign < 0 || valign > 1) {
            throw new IllegalArgumentException("[ViewportController.setValign] valign must be in [0, 1], got: " + valign);
        }
        this.valign = valign;
    }

    public double getValign() {
        return valign;
    }

    public double getViewWidth() {
        return viewWidth;
    }

    public double getViewHeight() {
        return viewHeight;
    }

    public double getContentWidth() {
        return contentWidth;
    }

    public double getContentHeight() {
        return contentHeight;
    }

    public double getScrollWidth() {
        return Math.max(contentWidth - viewWidth - EDGE_GUARD, 0);
    }

    public double getScrollHeight() {
        return Math.max(contentHeight - viewHeight - EDGE_GUARD, 0);
    }

    // ===== ANCHOR =====

    public double getAnchorX() {
        return anchorX;
    }

    public double getAnchorY() {
        return anchorY;
    }

    /**
     * Horizontal draw offset of the content.
     */
    public double getOffsetX() {
        return anchorX;
    }

    /**
     * Vertical draw offset of the content, including the valign offset when
     * the content fits.
     */
    public double getOffsetY() {
        if (getScrollHeight() == 0) {
            return valign * (contentHeight - viewHeight);
        }
        return anchorY;
    }

    /**
     * Clip rectangle in layout coordinates, one pixel larger on each leading edge.
     */
    public Rect getClip() {
        return new Rect(getOffsetX() - 1, getOffsetY() - 1, viewWidth + 1, viewHeight + 1);
    }

    public void setAnchor(double x, double y) {
        animFrames = 0;
        anchorX = clampX(x);
        anchorY = clampY(y);
    }

    /**
     * Drag scrolling: the content follows the pointer.
     */
    public void dragBy(double dx, double dy) {
        setAnchor(anchorX - dx, anchorY - dy);
    }

    /**
     * Moves the anchor so the caret at layout position (x, y) is visible.
     *
     * @return true if the anchor changed
     */
    public boolean scrollToCaret(double x, double y) {
        double oldX = anchorX;
        double oldY = anchorY;

        double newX = anchorX;
        double right = Math.min(anchorX + viewWidth, contentWidth);
        if (x > right) {
            newX = x - viewWidth + caretWidth;
        } else if (x < anchorX) {
            newX = x;
        }

        double newY = anchorY;
        double bottom = Math.min(anchorY + viewHeight, contentHeight) - lineHeight;
        if (y > bottom) {
            newY = y - viewHeight + lineHeight;
        } else if (y < anchorY) {
            newY = y;
        }

        if (newX != anchorX || newY != anchorY) {
            setAnchor(newX, newY);
        }
        return oldX != anchorX || oldY != anchorY;
    }

    // ===== ANIMATION =====

    /**
     * Starts a linear scroll to (x, y) spread over {@code frames} ticks.
     * Zero or fewer frames jump immediately.
     */
    public void animateTo(double x, double y, int frames) {
        if (frames <= 0) {
            setAnchor(x, y);
            return;
        }
        animFromX = anchorX;
        animFromY = anchorY;
        animToX = clampX(x);
        animToY = clampY(y);
        animFrames = frames;
        animFrame = 0;
    }

    public boolean isAnimating() {
        return animFrames > 0;
    }

    /**
     * Advances a running animation by one frame.
     *
     * @return true if the anchor moved
     */
    public boolean tick() {
        if (!isAnimating()) {
            return false;
        }
        animFrame++;
        double t = (double) animFrame / animFrames;
        anchorX = animFromX + (animToX - animFromX) * t;
        anchorY = animFromY + (animToY - animFromY) * t;
        if (animFrame >= animFrames) {
            anchorX = animToX;
            anchorY = animToY;
            animFrames = 0;
        }
        return true;
    }

    private double clampX(double x) {
        double range = getScrollWidth();
        if (range == 0) return 0;
        return Math.max(0, Math.min(x, range));
    }

    private double clampY(double y) {
        double range = getScrollHeight();
        if (range == 0) return 0;
        return Math.max(0, Math.min(y, range));
    }
}
