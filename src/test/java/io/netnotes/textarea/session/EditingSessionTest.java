package io.netnotes.textarea.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.netnotes.textarea.ConfigurationException;
import io.netnotes.textarea.TextArea;
import io.netnotes.textarea.TextAreaOptions;
import io.netnotes.textarea.ViewState;
import io.netnotes.textarea.cursor.Selection;
import io.netnotes.textarea.input.KeyDownEvent;
import io.netnotes.textarea.input.KeyUpEvent;
import io.netnotes.textarea.input.Keyboard;
import io.netnotes.textarea.input.PointerEvent;
import io.netnotes.textarea.input.SpecialKey;
import io.netnotes.textarea.layout.FontMetrics;
import io.netnotes.textarea.layout.MonospaceMetrics;

class EditingSessionTest {

    private final FontMetrics metrics = new MonospaceMetrics();
    private final List<String> finished = new ArrayList<>();

    private EditingSession session;

    @BeforeEach
    void setUp() {
        session = new EditingSession();
        finished.clear();
    }

    private TextArea area(String text, TextAreaOptions extra) {
        TextArea area = new TextArea(metrics,
            new TextAreaOptions().withText(text).withSize(200, 60).withEdit(true).merge(extra));
        area.setEditingFinishedListener((a, escaped) -> finished.add(a.getText() + (escaped ? ":esc" : ":done")));
        return area;
    }

    private TextArea area(String text) {
        return area(text, null);
    }

    private void type(String text) {
        text.codePoints().forEach(cp -> session.onKeyDown(KeyDownEvent.text(cp)));
    }

    private void press(SpecialKey key) {
        session.onKeyDown(KeyDownEvent.special(key));
        session.onKeyUp(KeyUpEvent.special(key));
    }

    private void ctrl(int keyCode) {
        session.onKeyDown(KeyDownEvent.hardware(Keyboard.KeyCode.LEFT_CONTROL, KeyDownEvent.NO_CODE_POINT));
        session.onKeyDown(KeyDownEvent.hardware(keyCode, KeyDownEvent.NO_CODE_POINT));
        session.onKeyUp(KeyUpEvent.special(SpecialKey.CTRL));
    }

    // ===== FOCUS =====

    @Test
    void focusRequiresDimensions() {
        TextArea bare = new TextArea(metrics, new TextAreaOptions().withText("x"));
        assertThrows(ConfigurationException.class, () -> session.focus(bare));
        assertNull(session.getFocused());
    }

    @Test
    void switchingFocusFinishesPreviousAreaAsEscaped() {
        TextArea first = area("");
        TextArea second = area("");

        session.focus(first);
        type("hi");
        session.focus(second);

        assertSame(second, session.getFocused());
        assertEquals(List.of("hi:esc"), finished);
    }

    @Test
    void unchangedTextFiresNoCallback() {
        TextArea area = area("same");
        session.focus(area);
        type("x");
        press(SpecialKey.BS);
        press(SpecialKey.ESC);

        assertNull(session.getFocused());
        assertTrue(finished.isEmpty());
    }

    @Test
    void blurCollapsesSelectionAndClearsModifiers() {
        TextArea area = area("abc");
        session.focus(area);
        session.onKeyDown(KeyDownEvent.special(SpecialKey.SHIFT));
        press(SpecialKey.RIGHT);
        assertTrue(area.hasSelection());

        session.blur();

        assertFalse(area.hasSelection());
        assertTrue(session.getModifiers().isEmpty());
    }

    // ===== KEYS =====

    @Test
    void typingInsertsAtCaret() {
        TextArea area = area("ac");
        session.focus(area);
        area.setCaret(1);

        type("b");

        assertEquals("abc", area.getText());
        assertEquals(2, area.getCaret());
    }

    @Test
    void rawKeysFollowShiftState() {
        TextArea area = area("");
        session.focus(area);

        session.onKeyDown(KeyDownEvent.hardware(Keyboard.KeyCode.Q, 'Q'));
        session.onKeyDown(KeyDownEvent.hardware(Keyboard.KeyCode.LEFT_SHIFT, KeyDownEvent.NO_CODE_POINT));
        session.onKeyDown(KeyDownEvent.hardware(Keyboard.KeyCode.Q, 'Q'));

        assertEquals("qQ", area.getText());
    }

    @Test
    void controlCharactersAreIgnored() {
        TextArea area = area("");
        session.focus(area);

        session.onKeyDown(KeyDownEvent.text(0x07));

        assertEquals("", area.getText());
    }

    @Test
    void enterInsertsNewlineAndShiftEnterFinishes() {
        TextArea area = area("");
        session.focus(area);

        type("a");
        press(SpecialKey.ENTER);
        type("b");
        assertEquals("a\nb", area.getText());

        session.onKeyDown(KeyDownEvent.special(SpecialKey.SHIFT));
        session.onKeyDown(KeyDownEvent.special(SpecialKey.ENTER));

        assertNull(session.getFocused());
        assertEquals(List.of("a\nb:done"), finished);
    }

    @Test
    void enterFinishesOneLineArea() {
        TextArea area = area("", new TextAreaOptions().withOneLine(true));
        session.focus(area);

        type("go");
        press(SpecialKey.NUM_ENTER);

        assertEquals("go", area.getText());
        assertEquals(List.of("go:done"), finished);
    }

    @Test
    void tabInsertsTwoSpaces() {
        TextArea area = area("");
        session.focus(area);
        press(SpecialKey.TAB);
        assertEquals("  ", area.getText());
    }

    @Test
    void ctrlChordsRunEditCommands() {
        TextArea area = area("hello");
        session.focus(area);

        ctrl(Keyboard.KeyCode.A);
        assertEquals(new Selection(0, 5), area.getSelection());

        ctrl(Keyboard.KeyCode.C);
        assertEquals("hello", session.getClipboard().getBuffer());

        area.setCaret(5);
        area.collapseSelection();
        ctrl(Keyboard.KeyCode.V);
        assertEquals("hellohello", area.getText());

        ctrl(Keyboard.KeyCode.Z);
        assertEquals("hello", area.getText());
        ctrl(Keyboard.KeyCode.Y);
        assertEquals("hellohello", area.getText());
    }

    @Test
    void unboundCtrlChordIsDropped() {
        TextArea area = area("");
        session.focus(area);

        session.onKeyDown(KeyDownEvent.special(SpecialKey.CTRL));
        session.onKeyDown(KeyDownEvent.hardware(Keyboard.KeyCode.Q, 'q'));

        assertEquals("", area.getText());
        assertTrue(session.isModifierDown(SpecialKey.CTRL));
    }

    @Test
    void virtualCommandKeys() {
        TextArea area = area("ab\ncd");
        session.focus(area);
        area.setCaret(1);

        press(SpecialKey.DUP);
        assertEquals("ab\nab\ncd", area.getText());

        press(SpecialKey.UNDO);
        assertEquals("ab\ncd", area.getText());

        press(SpecialKey.ALL);
        press(SpecialKey.CUT);
        assertEquals("", area.getText());
        assertEquals("ab\ncd", session.getClipboard().getBuffer());
    }

    @Test
    void shiftFlagOnEventExtendsSelection() {
        TextArea area = area("abc");
        session.focus(area);

        session.onKeyDown(KeyDownEvent.special(SpecialKey.RIGHT, true));
        session.onKeyDown(KeyDownEvent.special(SpecialKey.RIGHT, true));

        assertEquals(new Selection(0, 2), area.getSelection());
    }

    @Test
    void inertKeysDoNothing() {
        TextArea area = area("abc");
        session.focus(area);

        press(SpecialKey.F5);
        press(SpecialKey.MENU);
        press(SpecialKey.INSERT);

        assertEquals("abc", area.getText());
        assertSame(area, session.getFocused());
    }

    @Test
    void readOnlyAreaIgnoresKeys() {
        TextArea area = new TextArea(metrics,
            new TextAreaOptions().withText("abc").withSize(200, 60).withScroll(true));
        session.focus(area);

        type("x");
        press(SpecialKey.BS);

        assertEquals("abc", area.getText());
    }

    // ===== REPEAT & BLINK =====

    @Test
    void heldKeyRepeatsAfterDelay() {
        TextArea area = area("");
        session.focus(area);

        session.onKeyDown(KeyDownEvent.text('a'));
        session.tick(29);
        assertEquals("a", area.getText());

        session.tick(1);
        assertEquals("aa", area.getText());

        session.tick(3);
        assertEquals("aaa", area.getText());

        session.onKeyUp(KeyUpEvent.special(SpecialKey.SHIFT));
        session.tick(10);
        assertEquals("aaa", area.getText());
    }

    @Test
    void caretBlinks() {
        session.focus(area("abc"));
        assertTrue(session.isCaretVisible());

        ViewState state = session.tick(30);
        assertFalse(state.isCaretVisible());

        state = session.tick(30);
        assertTrue(state.isCaretVisible());
    }

    @Test
    void keyPressShowsCaret() {
        session.focus(area("abc"));
        session.tick(40);
        assertFalse(session.isCaretVisible());

        press(SpecialKey.LEFT);
        assertTrue(session.isCaretVisible());
    }

    @Test
    void tickWithoutFocusReturnsNull() {
        assertNull(session.tick(5));
        assertThrows(IllegalArgumentException.class, () -> session.tick(-1));
    }

    @Test
    void tickAdvancesScrollAnimation() {
        TextArea area = area("a\nb\nc\nd\ne\nf\ng\nh\ni\nj");
        session.focus(area);

        area.smoothScrollTo(0, 40, 4);
        session.tick(2);
        assertEquals(20, area.getViewport().getAnchorY());

        ViewState state = session.tick(2);
        assertNotNull(state);
        assertEquals(40, state.getOffsetY());
    }

    // ===== POINTER =====

    @Test
    void mouseDragSelects() {
        TextArea area = area("abc\ndef");

        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.DOWN, 12, 5));
        assertSame(area, session.getFocused());
        assertEquals(PointerMode.SELECT, session.getPointerMode());
        assertEquals(1, area.getCaret());

        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.MOVE, 25, 20));
        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.UP, 25, 20));

        assertEquals(new Selection(1, 7), area.getSelection());
        assertEquals(PointerMode.NONE, session.getPointerMode());
    }

    @Test
    void pointerOutsideAreaIsIgnored() {
        TextArea area = area("abc");

        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.DOWN, 250, 5));

        assertNull(session.getFocused());
        assertEquals(PointerMode.NONE, session.getPointerMode());
    }

    @Test
    void staticAreaDoesNotTakeFocus() {
        TextArea area = new TextArea(metrics, new TextAreaOptions().withText("abc").withSize(200, 60));

        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.DOWN, 5, 5));

        assertNull(session.getFocused());
    }

    @Test
    void readOnlyAreaScrollsByDragging() {
        TextArea area = new TextArea(metrics, new TextAreaOptions()
            .withText("a\nb\nc\nd\ne\nf\ng\nh\ni\nj").withSize(100, 48).withScroll(true));

        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.DOWN, 50, 40));
        assertEquals(PointerMode.DRAG, session.getPointerMode());

        session.onPointerEvent(area, PointerEvent.mouse(PointerEvent.Type.MOVE, 50, 10));

        assertEquals(30, area.getViewport().getAnchorY());
    }

    @Test
    void touchTapPlacesCaret() {
        TextArea area = area("abc\ndef");

        session.onPointerEvent(area, PointerEvent.touch(PointerEvent.Type.DOWN, 22, 20));
        assertEquals(PointerMode.DRAG, session.getPointerMode());
        assertEquals(0, area.getCaret());

        session.onPointerEvent(area, PointerEvent.touch(PointerEvent.Type.UP, 22, 20));

        assertEquals(6, area.getCaret());
        assertFalse(area.hasSelection());
    }

    @Test
    void touchDragDoesNotMoveCaret() {
        TextArea area = area("a\nb\nc\nd\ne\nf\ng\nh\ni\nj");

        session.onPointerEvent(area, PointerEvent.touch(PointerEvent.Type.DOWN, 5, 50));
        session.onPointerEvent(area, PointerEvent.touch(PointerEvent.Type.MOVE, 5, 30));
        session.onPointerEvent(area, PointerEvent.touch(PointerEvent.Type.UP, 5, 30));

        assertEquals(0, area.getCaret());
        assertEquals(20, area.getViewport().getAnchorY());
    }
}
