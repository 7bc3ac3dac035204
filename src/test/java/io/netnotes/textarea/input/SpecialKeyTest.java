package io.netnotes.textarea.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import io.netnotes.textarea.cursor.Direction;

class SpecialKeyTest {

    @Test
    void lookupByLabel() {
        assertEquals(SpecialKey.PAGE_DOWN, SpecialKey.fromName("PageDn"));
        assertEquals(SpecialKey.DUP, SpecialKey.fromName("Dup"));
        assertNull(SpecialKey.fromName("pagedn"));
        assertNull(SpecialKey.fromName(null));
    }

    @Test
    void navigationKeysMapToDirections() {
        assertEquals(Direction.PAGE_UP, SpecialKey.PAGE_UP.toDirection());
        assertEquals(Direction.HOME, SpecialKey.HOME.toDirection());
        assertNull(SpecialKey.BS.toDirection());
    }

    @Test
    void commandKeysRoundTripThroughHotkeys() {
        for (EditCommand command : EditCommand.values()) {
            assertEquals(command, command.toSpecialKey().toCommand());
            assertEquals(command, EditCommand.forHotkey(Character.toLowerCase(command.getHotkey())));
        }
        assertNull(EditCommand.forHotkey('Q'));
        assertNull(SpecialKey.ENTER.toCommand());
    }

    @Test
    void modifiers() {
        assertTrue(SpecialKey.CTRL.isModifier());
        assertTrue(SpecialKey.WIN.isModifier());
        assertFalse(SpecialKey.CAPS_LOCK.isModifier());
    }
}
