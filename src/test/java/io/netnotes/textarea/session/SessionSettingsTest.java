package io.netnotes.textarea.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParser;

import io.netnotes.textarea.ConfigurationException;

class SessionSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsConvertToFrames() {
        SessionSettings settings = new SessionSettings();

        assertEquals(60, settings.getBlinkPeriod());
        assertEquals(30, settings.getRepeatDelayFrames());
        assertEquals(3, settings.getRepeatSpanFrames());
    }

    @Test
    void repeatSpanIsAtLeastOneFrame() {
        SessionSettings settings = new SessionSettings().withRepeatSpan(0);
        assertEquals(1, settings.getRepeatSpanFrames());
    }

    @Test
    void zeroBlinkPeriodIsRejected() {
        SessionSettings settings = new SessionSettings().withCursorShowTime(0).withCursorHideTime(0);
        assertThrows(ConfigurationException.class, settings::validate);
    }

    @Test
    void missingFileGivesDefaults() throws IOException {
        SessionSettings settings = SessionSettings.load(tempDir.resolve("absent.json"));
        assertEquals(SessionSettings.DEFAULT_REPEAT_DELAY, settings.getRepeatDelay());
    }

    @Test
    void saveThenLoad() throws IOException {
        Path file = tempDir.resolve("conf").resolve("session.json");
        new SessionSettings().withCursorShowTime(20).withRepeatDelay(250).save(file);

        SessionSettings loaded = SessionSettings.load(file);

        assertEquals(20, loaded.getCursorShowTime());
        assertEquals(SessionSettings.DEFAULT_CURSOR_HIDE_TIME, loaded.getCursorHideTime());
        assertEquals(250, loaded.getRepeatDelay());
    }

    @Test
    void partialJsonKeepsDefaults() {
        SessionSettings settings = SessionSettings.fromJson(
            JsonParser.parseString("{\"repeatSpan\":100}").getAsJsonObject());

        assertEquals(100, settings.getRepeatSpan());
        assertEquals(SessionSettings.DEFAULT_CURSOR_SHOW_TIME, settings.getCursorShowTime());
    }

    @Test
    void malformedFileIsConfigurationError() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ repeatDelay: ", StandardCharsets.UTF_8);

        assertThrows(ConfigurationException.class, () -> SessionSettings.load(file));
    }

    @Test
    void wrongTypeIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> SessionSettings.fromJson(
            JsonParser.parseString("{\"repeatDelay\":\"soon\"}").getAsJsonObject()));
    }
}
