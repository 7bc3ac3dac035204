package io.netnotes.textarea.cursor;

import io.netnotes.textarea.layout.CharCell;
import io.netnotes.textarea.layout.Section;
import io.netnotes.textarea.layout.TextLayout;

/**
 * CursorModel - caret position and selection over a {@link TextLayout}
 *
 * STATE:
 * - position: cell index in [0, sentinel]
 * - selection: (anchor, moving), stored unnormalized
 * - sticky x: pixel column remembered across consecutive vertical moves,
 *   captured from the caret cell's xStart on the first one and dropped by any
 *   other move or explicit caret set
 *
 * HIT TESTING:
 * - row = ceil(y / lineHeight) - 1
 * - the first cell whose xEnd is past x wins; x in its right half resolves to
 *   the next boundary
 * - x beyond the row content resolves to the row's last index
 */
public class CursorModel {
    public static final int NO_MATCH = -1;

    private TextLayout layout;
    private double lineHeight;

    private int position = 0;
    private Selection selection = Selection.collapsed(0);
    private Double stickyX = null;

    public CursorModel(TextLayout layout, double lineHeight) {
        this.layout = layout;
        this.lineHeight = lineHeight;
    }

    /**
     * Switches to a regenerated layout, clamping the caret into it.
     */
    public void setLayout(TextLayout layout, double lineHeight) {
        this.layout = layout;
        this.lineHeight = lineHeight;
        position = clamp(position);
    }

    public TextLayout getLayout() {
        return layout;
    }

    public double getLineHeight() {
        return lineHeight;
    }

    // ===== CARET =====

    public int getPosition() {
        return position;
    }

    public CharCell getCaretCell() {
        return layout.getCell(position);
    }

    public int getCaretRow() {
        return layout.getRowOf(position);
    }

    /**
     * Places the caret without touching the selection and forgets the sticky column.
     */
    public void setPosition(int position) {
        this.position = clamp(position);
        stickyX = null;
    }

    public Double getStickyX() {
        return stickyX;
    }

    public void clearStickyX() {
        stickyX = null;
    }

    // ===== SELECTION =====

    public Selection getSelection() {
        return selection;
    }

    /**
     * Stores the pair literally; the order of {@code anchor} and {@code moving} is kept.
     */
    public void setSelection(int anchor, int moving) {
        selection = new Selection(anchor, moving);
    }

    public void collapseSelection() {
        selection = Selection.collapsed(position);
    }

    public void selectAll() {
        selection = new Selection(0, layout.getSentinelIndex());
    }

    public boolean hasSelection() {
        return !selection.isEmpty();
    }

    // ===== HIT TESTING =====

    /**
     * @param x layout x
     * @param y layout y
     * @param viewWidth visible width; x up to max(row content, viewWidth) still resolves
     * @return cell index or {@link #NO_MATCH}
     */
    public int hitTest(double x, double y, double viewWidth) {
        int row = (int) Math.ceil(y / lineHeight) - 1;
        if (!layout.hasRow(row)) {
            return NO_MATCH;
        }
        Section section = layout.getSection(row);
        double rowRight = layout.getCell(section.getLast()).getXEnd();
        if (x < 0 || x > Math.max(rowRight, viewWidth)) {
            return NO_MATCH;
        }
        return findInRow(row, x);
    }

    /**
     * Nearest caret boundary to {@code x} within {@code row}.
     */
    public int findInRow(int row, double x) {
        Section section = layout.getSection(row);
        for (int i = section.getFirst(); i <= section.getLast(); i++) {
            CharCell cell = layout.getCell(i);
            if (x < cell.getXEnd()) {
                return i + (x < cell.getMidX() ? 0 : 1);
            }
        }
        return section.getLast();
    }

    // ===== MOVEMENT =====

    /**
     * Moves the caret one step in {@code direction}.
     *
     * @param extend keep the anchor and move only the selection head
     * @param pageRows rows stepped by page moves
     */
    public void move(Direction direction, boolean extend, int pageRows) {
        int pos = position;
        int row = layout.getRowOf(pos);

        if (extend && selection.isEmpty()) {
            selection = Selection.collapsed(pos);
        }

        Double lastX = stickyX;
        stickyX = null;

        int target;
        switch (direction) {
            case LEFT:
                target = Math.max(pos - 1, 0);
                break;
            case RIGHT:
                target = Math.min(pos + 1, layout.getSentinelIndex());
                break;
            case HOME:
                target = layout.getSection(row).getFirst();
                break;
            case END:
                target = layout.getSection(row).getLast();
                break;
            case UP:
                target = moveVertical(row - 1, lastX);
                break;
            case DOWN:
                target = moveVertical(row + 1, lastX);
                break;
            case PAGE_UP:
                target = moveVertical(row - Math.max(pageRows, 0), lastX);
                break;
            case PAGE_DOWN:
                target = moveVertical(row + Math.max(pageRows, 0), lastX);
                break;
            default:
                throw new IllegalStateException("[CursorModel.move] unhandled direction: " + direction);
        }

        position = target;
        selection = extend ? selection.withMoving(target) : Selection.collapsed(target);
    }

    private int moveVertical(int targetRow, Double lastX) {
        double x = lastX != null ? lastX : layout.getCell(position).getXStart();
        stickyX = x;
        if (targetRow < 0) {
            return 0;
        }
        if (targetRow >= layout.getRowCount()) {
            return layout.getSentinelIndex();
        }
        return findInRow(targetRow, x);
    }

    private int clamp(int pos) {
        return Math.max(0, Math.min(pos, layout.getSentinelIndex()));
    }
}
