package io.netnotes.textarea.session;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import io.netnotes.textarea.EditingFinishedListener;
import io.netnotes.textarea.TextArea;
import io.netnotes.textarea.ViewState;
import io.netnotes.textarea.clipboard.Clipboard;
import io.netnotes.textarea.cursor.CursorModel;
import io.netnotes.textarea.input.EditCommand;
import io.netnotes.textarea.input.KeyDownEvent;
import io.netnotes.textarea.input.KeyUpEvent;
import io.netnotes.textarea.input.Keyboard;
import io.netnotes.textarea.input.PointerEvent;
import io.netnotes.textarea.input.SpecialKey;
import io.netnotes.textarea.utils.LoggingHelpers.Log;
import io.netnotes.textarea.utils.LoggingHelpers.LogLevel;
import io.netnotes.textarea.utils.strings.CodePointHelpers;

/**
 * EditingSession - the one text area that receives input
 *
 * FOCUS:
 * - focus() blurs the previous area with {@link BlurReason#SWITCH} before
 *   taking the new one
 * - blur() collapses the selection, forgets the sticky column, the modifiers
 *   and the held key, then reports the session to the area's
 *   {@link EditingFinishedListener} if the text changed since focus
 *
 * INPUT:
 * - keys reach the focused area only when it is editable
 * - Ctrl + A/C/X/V/D/Z/Y map to the edit commands, other Ctrl chords are dropped
 * - pointer coordinates are relative to the area's visible window
 *
 * FRAMES:
 * - tick() drives caret blink, key repeat and scroll animation; there are no
 *   timers or background threads
 */
public class EditingSession {

    private final Clipboard clipboard;
    private SessionSettings settings;

    private TextArea focused = null;
    private String originalText = null;

    private final EnumSet<SpecialKey> modifiers = EnumSet.noneOf(SpecialKey.class);
    private KeyDownEvent lastKeyEvent = null;
    private int repeatCounter = 0;
    private int blinkCounter = 0;

    private PointerMode pointerMode = PointerMode.NONE;
    private double pointerX = 0;
    private double pointerY = 0;
    private boolean dragged = false;

    public EditingSession() {
        this(new Clipboard(), new SessionSettings());
    }

    public EditingSession(Clipboard clipboard, SessionSettings settings) {
        if (clipboard == null) {
            throw new IllegalArgumentException("[EditingSession] clipboard is null");
        }
        this.clipboard = clipboard;
        setSettings(settings);
    }

    public Clipboard getClipboard() {
        return clipboard;
    }

    public SessionSettings getSettings() {
        return settings;
    }

    public void setSettings(SessionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("[EditingSession.setSettings] settings is null");
        }
        settings.validate();
        this.settings = settings;
    }

    // ===== FOCUS =====

    public TextArea getFocused() {
        return focused;
    }

    public boolean isFocused(TextArea area) {
        return area != null && area == focused;
    }

    /**
     * @throws io.netnotes.textarea.ConfigurationException when the area has no width or height
     */
    public void focus(TextArea area) {
        if (area == null) {
            throw new IllegalArgumentException("[EditingSession.focus] area is null");
        }
        area.checkFocusable();
        if (area == focused) {
            return;
        }
        if (focused != null) {
            blur(BlurReason.SWITCH);
        }

        focused = area;
        originalText = area.getText();
        blinkCounter = 0;
        repeatCounter = 0;
        area.scrollToCaret();

        Log.log("EditingSession.focus", area.toString(), LogLevel.GENERAL);
    }

    public void blur() {
        blur(BlurReason.PROGRAMMATIC);
    }

    public void blur(BlurReason reason) {
        if (focused == null) {
            return;
        }
        TextArea area = focused;
        String startText = originalText;

        area.collapseSelection();
        area.getCursor().clearStickyX();
        modifiers.clear();
        lastKeyEvent = null;
        repeatCounter = 0;
        pointerMode = PointerMode.NONE;
        focused = null;
        originalText = null;

        Log.log("EditingSession.blur", reason + " " + area, LogLevel.GENERAL);

        EditingFinishedListener listener = area.getEditingFinishedListener();
        if (listener != null && !area.getText().equals(startText)) {
            listener.onEditingFinished(area, reason.isEscape());
        }
    }

    // ===== KEYBOARD =====

    public Set<SpecialKey> getModifiers() {
        return Collections.unmodifiableSet(modifiers);
    }

    public boolean isModifierDown(SpecialKey key) {
        return modifiers.contains(key);
    }

    public void onKeyDown(KeyDownEvent e) {
        if (focused == null || !focused.isEditable()) {
            return;
        }
        lastKeyEvent = e;
        repeatCounter = 0;
        blinkCounter = 0;
        dispatchKey(e);
    }

    public void onKeyUp(KeyUpEvent e) {
        SpecialKey key = e.getSpecialKey();
        if (key != null && key.isModifier()) {
            modifiers.remove(key);
        }
        lastKeyEvent = null;
    }

    private void dispatchKey(KeyDownEvent e) {
        TextArea area = focused;
        boolean ctrl = modifiers.contains(SpecialKey.CTRL);

        SpecialKey key = null;
        if (ctrl) {
            EditCommand command = EditCommand.forHotkey(Keyboard.chordLetterOf(e.getKeyCode(), e.getCodePoint()));
            if (command != null) {
                key = command.toSpecialKey();
            }
        }
        if (key == null) {
            key = e.getSpecialKey();
        }
        if (ctrl && key == null) {
            return;
        }
        if (key == null && (!e.hasCodePoint() || Character.isISOControl(e.getCodePoint()))) {
            return;
        }

        if (key != null && key.isModifier()) {
            modifiers.add(key);
            lastKeyEvent = null;
            return;
        }

        boolean shift = modifiers.contains(SpecialKey.SHIFT);

        if (key == SpecialKey.PASTE) {
            area.paste(clipboard);
            return;
        }

        String text = null;
        if (key == SpecialKey.TAB) {
            text = "  ";
        } else if (key == SpecialKey.ENTER || key == SpecialKey.NUM_ENTER) {
            if (shift || area.isOneLine()) {
                key = SpecialKey.GO;
            } else {
                text = "\n";
            }
        } else if (key == null) {
            int codePoint = e.getCodePoint();
            text = e.isRawText() && !shift
                ? CodePointHelpers.lowerCase(codePoint)
                : new String(Character.toChars(codePoint));
        }
        if (text != null) {
            area.insertText(text);
            return;
        }

        switch (key) {
            case LEFT:
            case RIGHT:
            case UP:
            case DOWN:
            case HOME:
            case END:
            case PAGE_UP:
            case PAGE_DOWN:
                area.moveCaret(key.toDirection(), shift || e.isShift());
                break;
            case ALL:
                area.selectAll();
                break;
            case ESC:
                blur(BlurReason.ESC);
                break;
            case GO:
                blur(BlurReason.GO);
                break;
            case BS:
                area.backspace();
                break;
            case DELETE:
                area.deleteForward();
                break;
            case COPY:
                area.copy(clipboard);
                break;
            case CUT:
                area.cut(clipboard);
                break;
            case DUP:
                area.duplicate();
                break;
            case UNDO:
                area.undo();
                break;
            case REDO:
                area.redo();
                break;
            case MENU:
            case INSERT:
            case CAPS_LOCK:
            case NUM_LOCK:
            case SCROLL_LOCK:
            case PAUSE_BREAK:
            case F1: case F2: case F3: case F4: case F5: case F6:
            case F7: case F8: case F9: case F10: case F11: case F12:
                // no editing action
                break;
            case ENTER:
            case NUM_ENTER:
            case TAB:
            case PASTE:
            case SHIFT:
            case CTRL:
            case WIN:
            case ALT:
                throw new IllegalStateException("[EditingSession.dispatchKey] key should have been handled: " + key);
            default:
                throw new IllegalStateException("[EditingSession.dispatchKey] unhandled key: " + key);
        }
    }

    // ===== POINTER =====

    public PointerMode getPointerMode() {
        return pointerMode;
    }

    /**
     * @param target the area under the pointer, used by DOWN events to move
     *               the focus; MOVE and UP always go to the focused area
     */
    public void onPointerEvent(TextArea target, PointerEvent e) {
        switch (e.getType()) {
            case DOWN:
                pointerDown(target, e);
                break;
            case MOVE:
                pointerMove(e);
                break;
            case UP:
                pointerUp(e);
                break;
            default:
                throw new IllegalStateException("[EditingSession.onPointerEvent] unhandled type: " + e.getType());
        }
    }

    private void pointerDown(TextArea target, PointerEvent e) {
        if (target == null || !target.hasDimensions() || !isInside(target, e.x(), e.y())) {
            return;
        }
        if (target != focused) {
            if (!target.isEditable() && !target.isScrollable()) {
                return;
            }
            focus(target);
        }

        pointerX = e.x();
        pointerY = e.y();
        dragged = false;

        if (!focused.isEditable() || !e.isPrimary() || e.isTouch()) {
            pointerMode = PointerMode.DRAG;
            return;
        }

        int hit = focused.hitTestView(e.x(), e.y());
        focused.setCaret(hit != CursorModel.NO_MATCH ? hit : focused.getCaret());
        focused.collapseSelection();
        blinkCounter = 0;
        pointerMode = PointerMode.SELECT;
    }

    private void pointerMove(PointerEvent e) {
        if (focused == null || pointerMode == PointerMode.NONE) {
            return;
        }
        if (pointerMode == PointerMode.DRAG) {
            double dx = e.x() - pointerX;
            double dy = e.y() - pointerY;
            pointerX = e.x();
            pointerY = e.y();
            if (dx != 0 || dy != 0) {
                dragged = true;
                focused.scrollBy(dx, dy);
            }
            return;
        }
        placeCaret(e);
    }

    private void pointerUp(PointerEvent e) {
        if (focused == null || pointerMode == PointerMode.NONE) {
            return;
        }
        if (pointerMode == PointerMode.SELECT) {
            placeCaret(e);
        } else if (e.isTouch() && !dragged && focused.isEditable()) {
            placeCaret(e);
        }
        focused.getCursor().clearStickyX();
        pointerMode = PointerMode.NONE;
    }

    /**
     * Moves the caret under the pointer. Mouse input extends the selection
     * from its anchor; touch input collapses it and is clamped to the window.
     */
    private void placeCaret(PointerEvent e) {
        double x = e.x();
        double y = e.y();
        if (e.isTouch()) {
            x = Math.max(0, Math.min(x, focused.getViewWidth()));
            y = Math.max(0, Math.min(y, focused.getViewHeight()));
        }
        int anchor = focused.getSelection().getAnchor();
        int hit = focused.hitTestView(x, y);
        focused.setCaret(hit != CursorModel.NO_MATCH ? hit : focused.getCaret());

        int caret = focused.getCaret();
        focused.setSelection(e.isTouch() ? caret : anchor, caret);
        blinkCounter = 0;
    }

    private static boolean isInside(TextArea area, double x, double y) {
        return x >= 0 && y >= 0 && x <= area.getViewWidth() && y <= area.getViewHeight();
    }

    // ===== FRAMES =====

    public boolean isCaretVisible() {
        return focused != null && focused.isEditable() && blinkCounter < settings.getCursorShowTime();
    }

    /**
     * Advances caret blink, key repeat and scroll animation.
     *
     * @return the focused area's state after the last frame, or null when
     *         nothing is focused
     */
    public ViewState tick(int frames) {
        if (frames < 0) {
            throw new IllegalArgumentException("[EditingSession.tick] frames must be >= 0, got: " + frames);
        }
        for (int i = 0; i < frames && focused != null; i++) {
            tickFrame();
        }
        return getViewState();
    }

    public ViewState getViewState() {
        return focused == null ? null : focused.getViewState(isCaretVisible());
    }

    private void tickFrame() {
        if (lastKeyEvent != null) {
            int counter = repeatCounter + 1;
            int delay = settings.getRepeatDelayFrames();
            int span = settings.getRepeatSpanFrames();
            repeatCounter = counter;
            if (counter >= delay && (counter - delay) % span == 0) {
                dispatchKey(lastKeyEvent);
            }
        } else {
            repeatCounter = 0;
        }

        if (focused == null) {
            return;
        }
        blinkCounter = (blinkCounter + 1) % settings.getBlinkPeriod();
        focused.getViewport().tick();
    }
}
