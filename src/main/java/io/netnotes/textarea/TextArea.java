package io.netnotes.textarea;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.netnotes.textarea.clipboard.Clipboard;
import io.netnotes.textarea.cursor.CursorModel;
import io.netnotes.textarea.cursor.Direction;
import io.netnotes.textarea.cursor.Selection;
import io.netnotes.textarea.cursor.SelectionGeometry;
import io.netnotes.textarea.history.HistoryEntry;
import io.netnotes.textarea.history.HistoryManager;
import io.netnotes.textarea.layout.CharCell;
import io.netnotes.textarea.layout.FontMetrics;
import io.netnotes.textarea.layout.Justifier;
import io.netnotes.textarea.layout.LineAligner;
import io.netnotes.textarea.layout.LineBreaker;
import io.netnotes.textarea.layout.TextAlign;
import io.netnotes.textarea.layout.TextLayout;
import io.netnotes.textarea.ui.Rect;
import io.netnotes.textarea.utils.LoggingHelpers.Log;
import io.netnotes.textarea.utils.LoggingHelpers.LogLevel;
import io.netnotes.textarea.utils.strings.CodePointHelpers;
import io.netnotes.textarea.viewport.SliderGeometry;
import io.netnotes.textarea.viewport.ViewportController;

/**
 * TextArea - editable, scrollable block of wrapped text
 *
 * PIPELINE (re-run from scratch on every text or option change):
 * - LineBreaker wraps the text (newlines become spaces in one-line mode)
 * - Justifier or LineAligner places the rows when a width is set
 * - CursorModel, ViewportController and the row colours follow the new layout
 *
 * EDITING:
 * - every text change goes through {@link #replace} which enforces maxChars
 *   and records one history level
 * - positions are code point indices; the layout sentinel index equals the
 *   text length
 *
 * Not thread-safe. Drive it from a single input/render thread, usually
 * through an {@link io.netnotes.textarea.session.EditingSession}.
 */
public class TextArea {

    private final FontMetrics metrics;

    private TextAreaOptions options;
    private String text;

    private TextLayout layout;
    private double lineHeight;
    private List<TextColor> rowColors = Collections.emptyList();

    private final CursorModel cursor;
    private final HistoryManager history;
    private final ViewportController viewport;

    private EditingFinishedListener editingFinishedListener = null;

    public TextArea(FontMetrics metrics) {
        this(metrics, null);
    }

    public TextArea(FontMetrics metrics, TextAreaOptions options) {
        if (metrics == null) {
            throw new IllegalArgumentException("[TextArea] metrics is null");
        }
        TextAreaOptions resolved = TextAreaOptions.defaults().merge(options);
        checkOptions(resolved);

        this.metrics = metrics;
        this.options = resolved;
        this.text = resolved.getText();
        this.history = new HistoryManager(resolved.getUndoLevels(), text);
        this.viewport = new ViewportController(0, 0);
        this.layout = buildLayout();
        this.cursor = new CursorModel(layout, lineHeight);
        refreshViewport();
    }

    // ===== OPTIONS =====

    /**
     * Applies the non-null fields of {@code update}. A changed text is
     * recorded in the history like an edit.
     *
     * @throws ConfigurationException when the merged options are invalid; the
     *         area is left unchanged
     */
    public void update(TextAreaOptions update) {
        TextAreaOptions merged = options.merge(update);
        checkOptions(merged);

        String newText = merged.getText();
        int caretBefore = cursor.getPosition();

        if (merged.getUndoLevels() != history.getCapacity()) {
            history.setCapacity(merged.getUndoLevels(), text);
        }
        options = merged;
        if (update != null) {
            Log.logJson("TextArea.update", update.toJson());
        }

        if (!newText.equals(text)) {
            history.record(newText, caretBefore);
            text = newText;
            relayout();
            cursor.collapseSelection();
        } else {
            relayout();
        }
    }

    /**
     * @return the current options, fully resolved, with the live text
     */
    public TextAreaOptions getOptions() {
        return options.copy().withText(text);
    }

    public void setText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("[TextArea.setText] text is null");
        }
        update(new TextAreaOptions().withText(text));
    }

    public String getText() {
        return text;
    }

    public int length() {
        return layout.getSentinelIndex();
    }

    public boolean isEditable() {
        return options.isEdit();
    }

    public boolean isScrollable() {
        return options.isScroll();
    }

    public boolean isOneLine() {
        return options.isOneLine();
    }

    public boolean hasDimensions() {
        return options.getWidth() != null && options.getHeight() != null;
    }

    /**
     * @throws ConfigurationException when the area has no width or height
     */
    public void checkFocusable() {
        if (!hasDimensions()) {
            Log.logError("[TextArea.checkFocusable] focus requested without width and height");
            throw new ConfigurationException("[TextArea.checkFocusable] set width and height to focus");
        }
    }

    public EditingFinishedListener getEditingFinishedListener() {
        return editingFinishedListener;
    }

    public void setEditingFinishedListener(EditingFinishedListener listener) {
        this.editingFinishedListener = listener;
    }

    private void checkOptions(TextAreaOptions candidate) {
        try {
            candidate.validate();
            if (candidate.getText() == null) {
                throw new ConfigurationException("[TextArea] text is null");
            }
            if ((candidate.isEdit() || candidate.isScroll())
                && (candidate.getWidth() == null || candidate.getHeight() == null)) {
                throw new ConfigurationException("[TextArea] set width and height to edit or scroll text");
            }
        } catch (ConfigurationException e) {
            Log.logError("TextArea.checkOptions", e);
            throw e;
        }
    }

    // ===== LAYOUT =====

    private TextLayout buildLayout() {
        boolean oneLine = options.isOneLine();
        Double width = options.getWidth();
        double letterSpacing = options.getLetterSpacing();

        String source = oneLine ? text.replace('\n', ' ') : text;
        double maxWidth = !oneLine && width != null ? width : LineBreaker.UNBOUNDED_WIDTH;
        int maxLineChars = options.getMaxLineChars() != null ? options.getMaxLineChars() : LineBreaker.UNBOUNDED_CHARS;

        TextLayout wrapped = LineBreaker.wrap(metrics, source, letterSpacing, maxWidth, maxLineChars,
            options.isWholeWords());

        TextAlign align = options.getAlign();
        if (width != null && !oneLine) {
            if (align.isJustified()) {
                wrapped = Justifier.justify(wrapped, metrics, width, letterSpacing);
            } else if (align.getFraction() != 0) {
                wrapped = LineAligner.align(wrapped, align.getFraction(), width);
            }
        }

        lineHeight = metrics.measureBounds(options.getSample()).getHeight() + options.getLineSpacing();
        rowColors = computeRowColors(wrapped);
        return wrapped;
    }

    private void relayout() {
        layout = buildLayout();
        cursor.setLayout(layout, lineHeight);
        Selection selection = cursor.getSelection();
        int n = layout.getSentinelIndex();
        if (selection.getAnchor() > n || selection.getMoving() > n) {
            cursor.collapseSelection();
        }
        refreshViewport();
    }

    private void refreshViewport() {
        viewport.setLineHeight(lineHeight);
        viewport.setCaretWidth(options.getCaretWidth());
        viewport.setValign(options.getValign());
        viewport.updateArea(getContentWidth(), getContentHeight(), getViewWidth(), getViewHeight());
    }

    private List<TextColor> computeRowColors(TextLayout rows) {
        List<TextColor> colors = options.getColors();
        TextColor fallback = options.getColor();
        List<TextColor> result = new ArrayList<>(rows.getRowCount());
        int paragraph = 0;
        for (int row = 0; row < rows.getRowCount(); row++) {
            TextColor color = colors != null && paragraph < colors.size() ? colors.get(paragraph) : null;
            result.add(color != null ? color : fallback);
            if (rows.getLine(row).endsWith(CharCell.NEWLINE)) {
                paragraph++;
            }
        }
        return Collections.unmodifiableList(result);
    }

    public TextLayout getLayout() {
        return layout;
    }

    public double getLineHeight() {
        return lineHeight;
    }

    /** Colour per row, null where neither colors nor color apply. */
    public List<TextColor> getRowColors() {
        return rowColors;
    }

    /**
     * Widest row, or in one-line mode the end of the text plus room for the caret.
     */
    public double getContentWidth() {
        if (options.isOneLine()) {
            return layout.getCell(layout.getSentinelIndex()).getXEnd() + options.getCaretWidth();
        }
        return layout.getContentWidth();
    }

    public double getContentHeight() {
        return layout.getRowCount() * lineHeight;
    }

    public double getViewWidth() {
        return options.getWidth() != null ? options.getWidth() : getContentWidth();
    }

    public double getViewHeight() {
        return options.getHeight() != null ? options.getHeight() : getContentHeight();
    }

    /**
     * Rows stepped by PageUp/PageDn.
     */
    public int getPageRows() {
        if (options.getHeight() == null || lineHeight <= 0) {
            return 0;
        }
        return (int) Math.floor(options.getHeight() / lineHeight);
    }

    // ===== CARET & SELECTION =====

    public CursorModel getCursor() {
        return cursor;
    }

    public int getCaret() {
        return cursor.getPosition();
    }

    /**
     * Places the caret and scrolls it into view. The selection is kept.
     */
    public void setCaret(int position) {
        cursor.setPosition(position);
        scrollToCaret();
    }

    public Selection getSelection() {
        return cursor.getSelection();
    }

    public void setSelection(int anchor, int moving) {
        int n = layout.getSentinelIndex();
        cursor.setSelection(clamp(anchor, n), clamp(moving, n));
    }

    public void collapseSelection() {
        cursor.collapseSelection();
    }

    public void selectAll() {
        cursor.selectAll();
    }

    public boolean hasSelection() {
        return cursor.hasSelection();
    }

    public void moveCaret(Direction direction, boolean extend) {
        cursor.move(direction, extend, getPageRows());
        scrollToCaret();
    }

    /**
     * @param x layout x
     * @param y layout y
     * @return caret index or {@link CursorModel#NO_MATCH}
     */
    public int hitTest(double x, double y) {
        return cursor.hitTest(x, y, getViewWidth());
    }

    /**
     * Hit test with coordinates relative to the visible window.
     */
    public int hitTestView(double viewX, double viewY) {
        return hitTest(viewX + viewport.getOffsetX(), viewY + viewport.getOffsetY());
    }

    // ===== EDITING =====

    /**
     * Replaces the selection (or inserts at the caret) with {@code insert}.
     *
     * @return false when the result would exceed maxChars; nothing changes then
     */
    public boolean insertText(String insert) {
        if (insert == null) {
            throw new IllegalArgumentException("[TextArea.insertText] text is null");
        }
        int caret = cursor.getPosition();
        Selection selection = cursor.getSelection();
        int from = selection.isEmpty() ? caret : clamp(selection.getStart(), length());
        int to = selection.isEmpty() ? caret : clamp(selection.getEnd(), length());
        return replace(from, to, insert, caret, from + CodePointHelpers.length(insert));
    }

    /**
     * @return true if a non-empty selection was deleted
     */
    public boolean deleteSelection() {
        Selection selection = cursor.getSelection();
        if (selection.isEmpty()) {
            return false;
        }
        int from = clamp(selection.getStart(), length());
        int to = clamp(selection.getEnd(), length());
        return replace(from, to, "", cursor.getPosition(), from);
    }

    /**
     * Deletes the selection, or the code point before the caret.
     */
    public boolean backspace() {
        if (deleteSelection()) {
            return true;
        }
        int pos = cursor.getPosition();
        if (pos <= 0) {
            return false;
        }
        return replace(pos - 1, pos, "", pos, pos - 1);
    }

    /**
     * Deletes the selection, or the code point after the caret.
     */
    public boolean deleteForward() {
        if (deleteSelection()) {
            return true;
        }
        int pos = cursor.getPosition();
        if (pos >= length()) {
            return false;
        }
        return replace(pos, pos + 1, "", pos, pos);
    }

    /**
     * With a selection, puts the selected text twice in its place. Without
     * one, copies the paragraph holding the caret below itself and leaves the
     * caret where it was.
     */
    public boolean duplicate() {
        Selection selection = cursor.getSelection();
        if (!selection.isEmpty()) {
            int from = clamp(selection.getStart(), length());
            int to = clamp(selection.getEnd(), length());
            String selected = CodePointHelpers.substring(text, from, to);
            return insertText(selected + selected);
        }

        int caret = cursor.getPosition();
        int row = layout.getRowOf(caret);
        int n = layout.getSentinelIndex();

        int pos1 = 0;
        for (int r = row - 1; r >= 0; r--) {
            int last = layout.getSection(r).getLast();
            if (layout.getCell(last).isNewline()) {
                pos1 = last;
                break;
            }
        }
        int pos2 = n;
        for (int r = row; r < layout.getRowCount(); r++) {
            int last = layout.getSection(r).getLast();
            if (layout.getCell(last).isNewline()) {
                pos2 = last;
                break;
            }
        }

        String paragraph = CodePointHelpers.substring(text, pos1, Math.min(pos2 + 1, n));
        if (paragraph.endsWith(CharCell.NEWLINE)) {
            paragraph = paragraph.substring(0, paragraph.length() - 1);
        }
        if (!paragraph.startsWith(CharCell.NEWLINE)) {
            paragraph = CharCell.NEWLINE + paragraph;
        }
        return replace(pos2, pos2, paragraph, caret, caret);
    }

    /**
     * Copies the selection {@code [start, end)}.
     *
     * @return false when nothing is selected
     */
    public boolean copy(Clipboard clipboard) {
        Selection selection = cursor.getSelection();
        if (selection.isEmpty()) {
            return false;
        }
        int from = clamp(selection.getStart(), length());
        int to = clamp(selection.getEnd(), length());
        clipboard.copy(CodePointHelpers.substring(text, from, to));
        return true;
    }

    public boolean cut(Clipboard clipboard) {
        copy(clipboard);
        return deleteSelection();
    }

    /**
     * @return false for an empty clipboard or a maxChars rejection
     */
    public boolean paste(Clipboard clipboard) {
        String pasted = clipboard.paste();
        if (pasted == null || pasted.isEmpty()) {
            return false;
        }
        return insertText(pasted);
    }

    /**
     * The single path for text edits: replaces code points {@code [from, to)},
     * records one history level and places the caret.
     */
    private boolean replace(int from, int to, String insert, int caretBefore, int caretAfter) {
        int insertLength = CodePointHelpers.length(insert);
        Integer maxChars = options.getMaxChars();
        if (maxChars != null && insertLength > 0 && length() - (to - from) + insertLength > maxChars) {
            return false;
        }

        String newText = CodePointHelpers.insert(CodePointHelpers.remove(text, from, to), from, insert);
        if (newText.equals(text)) {
            return false;
        }

        history.record(newText, caretBefore);
        text = newText;
        relayout();
        cursor.setPosition(caretAfter);
        cursor.collapseSelection();
        scrollToCaret();
        return true;
    }

    // ===== HISTORY =====

    public HistoryManager getHistory() {
        return history;
    }

    public boolean undo() {
        return navigateHistory(-1);
    }

    public boolean redo() {
        return navigateHistory(1);
    }

    private boolean navigateHistory(int delta) {
        HistoryEntry entry = history.navigate(delta, cursor.getPosition());
        if (entry == null) {
            return false;
        }
        Log.log("TextArea.history", "level " + history.getLevel() + " of " + history.size(), LogLevel.GENERAL);

        text = entry.getText();
        relayout();
        if (entry.hasCaret()) {
            cursor.setPosition(entry.getCaret());
        }
        cursor.collapseSelection();
        scrollToCaret();
        return true;
    }

    // ===== SCROLLING =====

    public ViewportController getViewport() {
        return viewport;
    }

    /**
     * Keeps the caret inside the visible window.
     */
    public boolean scrollToCaret() {
        CharCell cell = cursor.getCaretCell();
        return viewport.scrollToCaret(cell.getXStart(), cell.getRow() * lineHeight);
    }

    /**
     * Drag scrolling by a pointer delta; the content follows the pointer.
     */
    public void scrollBy(double dx, double dy) {
        viewport.dragBy(dx, dy);
    }

    public void scrollTo(double x, double y) {
        viewport.setAnchor(x, y);
    }

    public void smoothScrollTo(double x, double y, int frames) {
        viewport.animateTo(x, y, frames);
    }

    // ===== RENDERING =====

    public Rect getCaretRect() {
        CharCell cell = cursor.getCaretCell();
        double width = options.isEdit() ? options.getCaretWidth() : 0;
        return new Rect(cell.getXStart(), cell.getRow() * lineHeight, width, lineHeight - options.getLineSpacing());
    }

    public ViewState getViewState(boolean caretVisible) {
        double sliderWidth = options.getSliderWidth();
        return new ViewState(
            layout,
            rowColors,
            lineHeight,
            viewport.getOffsetX(),
            viewport.getOffsetY(),
            viewport.getClip(),
            getCaretRect(),
            caretVisible && options.isEdit(),
            SelectionGeometry.rectangles(layout, cursor.getSelection(), lineHeight),
            SliderGeometry.horizontal(viewport, sliderWidth),
            SliderGeometry.vertical(viewport, sliderWidth)
        );
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    @Override
    public String toString() {
        return "TextArea[length=" + length() + ", rows=" + layout.getRowCount() + ", caret=" + cursor.getPosition() + "]";
    }
}
