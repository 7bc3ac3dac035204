package io.netnotes.textarea.cursor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.netnotes.textarea.layout.FontMetrics;
import io.netnotes.textarea.layout.LineBreaker;
import io.netnotes.textarea.layout.MonospaceMetrics;
import io.netnotes.textarea.layout.TextLayout;

class CursorModelTest {
    private static final double LINE_HEIGHT = 12;

    private final FontMetrics metrics = new MonospaceMetrics();
    private CursorModel cursor;

    @BeforeEach
    void setUp() {
        cursor = new CursorModel(LineBreaker.wrap(metrics, "abc\ndef", 0), LINE_HEIGHT);
    }

    private void useText(String text) {
        cursor.setLayout(LineBreaker.wrap(metrics, text, 0), LINE_HEIGHT);
    }

    // ===== HIT TESTING =====

    @Test
    void hitTestResolvesNearestBoundary() {
        assertEquals(1, cursor.hitTest(12, 5, 100));
        assertEquals(2, cursor.hitTest(15, 5, 100));
        assertEquals(5, cursor.hitTest(12, 20, 100));
    }

    @Test
    void hitTestPastRowContentResolvesToRowEnd() {
        assertEquals(3, cursor.hitTest(50, 5, 100));
        assertEquals(7, cursor.hitTest(80, 20, 100));
    }

    @Test
    void rowBoundaryBelongsToUpperRow() {
        assertEquals(0, cursor.hitTest(2, LINE_HEIGHT, 100));
        assertEquals(4, cursor.hitTest(2, LINE_HEIGHT + 0.5, 100));
    }

    @Test
    void hitTestOutsideContentIsNoMatch() {
        assertEquals(CursorModel.NO_MATCH, cursor.hitTest(5, 0, 100));
        assertEquals(CursorModel.NO_MATCH, cursor.hitTest(5, 30, 100));
        assertEquals(CursorModel.NO_MATCH, cursor.hitTest(-1, 5, 100));
        assertEquals(CursorModel.NO_MATCH, cursor.hitTest(150, 5, 100));
    }

    // ===== MOVEMENT =====

    @Test
    void horizontalMovesClampAtEnds() {
        cursor.move(Direction.LEFT, false, 1);
        assertEquals(0, cursor.getPosition());

        cursor.setPosition(7);
        cursor.move(Direction.RIGHT, false, 1);
        assertEquals(7, cursor.getPosition());
    }

    @Test
    void homeAndEndStayOnRow() {
        cursor.setPosition(5);
        cursor.move(Direction.HOME, false, 1);
        assertEquals(4, cursor.getPosition());
        cursor.move(Direction.END, false, 1);
        assertEquals(7, cursor.getPosition());
    }

    @Test
    void verticalMovesPastFirstOrLastRowGoToTextEnds() {
        cursor.setPosition(2);
        cursor.move(Direction.UP, false, 1);
        assertEquals(0, cursor.getPosition());

        cursor.setPosition(5);
        cursor.move(Direction.DOWN, false, 1);
        assertEquals(7, cursor.getPosition());
    }

    @Test
    void stickyColumnSurvivesShortRow() {
        useText("abcdef\nab\nabcdef");
        cursor.setPosition(5);

        cursor.move(Direction.DOWN, false, 1);
        assertEquals(9, cursor.getPosition());
        assertEquals(50.0, cursor.getStickyX());

        cursor.move(Direction.DOWN, false, 1);
        assertEquals(15, cursor.getPosition());
    }

    @Test
    void horizontalMoveDropsStickyColumn() {
        useText("abcdef\nab\nabcdef");
        cursor.setPosition(5);
        cursor.move(Direction.DOWN, false, 1);
        cursor.move(Direction.LEFT, false, 1);

        assertNull(cursor.getStickyX());
        cursor.move(Direction.DOWN, false, 1);
        assertEquals(11, cursor.getPosition());
    }

    @Test
    void pageDownStepsPageRows() {
        useText("ab\ncd\nef\ngh");
        cursor.move(Direction.PAGE_DOWN, false, 2);
        assertEquals(6, cursor.getPosition());

        cursor.move(Direction.PAGE_UP, false, 5);
        assertEquals(0, cursor.getPosition());
    }

    @Test
    void extendingMoveKeepsAnchor() {
        cursor.setPosition(1);
        cursor.move(Direction.RIGHT, true, 1);
        cursor.move(Direction.RIGHT, true, 1);
        assertEquals(new Selection(1, 3), cursor.getSelection());
        assertTrue(cursor.hasSelection());

        cursor.move(Direction.LEFT, false, 1);
        assertEquals(Selection.collapsed(2), cursor.getSelection());
        assertFalse(cursor.hasSelection());
    }

    @Test
    void extendingBackwardsKeepsOrder() {
        cursor.setPosition(3);
        cursor.move(Direction.LEFT, true, 1);
        Selection selection = cursor.getSelection();

        assertEquals(3, selection.getAnchor());
        assertEquals(2, selection.getMoving());
        assertEquals(2, selection.getStart());
        assertEquals(3, selection.getEnd());
        assertEquals(1, selection.length());
    }

    // ===== LAYOUT CHANGES =====

    @Test
    void newLayoutClampsCaret() {
        cursor.setPosition(7);
        useText("ab");
        assertEquals(2, cursor.getPosition());
        assertTrue(cursor.getCaretCell().isSentinel());
    }

    @Test
    void selectAllCoversEveryCodepoint() {
        cursor.selectAll();
        assertEquals(new Selection(0, 7), cursor.getSelection());
    }

    @Test
    void caretRowFollowsLayout() {
        TextLayout layout = cursor.getLayout();
        cursor.setPosition(4);
        assertEquals(1, cursor.getCaretRow());
        assertEquals(layout.getRowOf(4), cursor.getCaretRow());
    }
}
