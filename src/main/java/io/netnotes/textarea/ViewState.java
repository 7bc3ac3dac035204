package io.netnotes.textarea;

import java.util.Collections;
import java.util.List;

import io.netnotes.textarea.layout.TextLayout;
import io.netnotes.textarea.ui.Rect;

/**
 * Everything a renderer needs for one frame, in layout coordinates.
 * Draw the rows at {@code row * lineHeight}, translated by
 * {@code (-offsetX, -offsetY)} and clipped to {@link #getClip()}.
 */
public final class ViewState {

    private final TextLayout layout;
    private final List<TextColor> rowColors;
    private final double lineHeight;
    private final double offsetX;
    private final double offsetY;
    private final Rect clip;
    private final Rect caret;
    private final boolean caretVisible;
    private final List<Rect> selection;
    private final Rect horizontalSlider;
    private final Rect verticalSlider;

    public ViewState(TextLayout layout, List<TextColor> rowColors, double lineHeight,
                     double offsetX, double offsetY, Rect clip,
                     Rect caret, boolean caretVisible, List<Rect> selection,
                     Rect horizontalSlider, Rect verticalSlider) {
        this.layout = layout;
        this.rowColors = Collections.unmodifiableList(rowColors);
        this.lineHeight = lineHeight;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.clip = clip;
        this.caret = caret;
        this.caretVisible = caretVisible;
        this.selection = Collections.unmodifiableList(selection);
        this.horizontalSlider = horizontalSlider;
        this.verticalSlider = verticalSlider;
    }

    public TextLayout getLayout() { return layout; }

    /** Colour per row; null entries draw with the renderer's default. */
    public List<TextColor> getRowColors() { return rowColors; }

    public double getLineHeight() { return lineHeight; }
    public double getOffsetX() { return offsetX; }
    public double getOffsetY() { return offsetY; }
    public Rect getClip() { return clip; }
    public Rect getCaret() { return caret; }
    public boolean isCaretVisible() { return caretVisible; }
    public List<Rect> getSelection() { return selection; }
    public Rect getHorizontalSlider() { return horizontalSlider; }
    public Rect getVerticalSlider() { return verticalSlider; }
}
