package io.netnotes.textarea.session;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import io.netnotes.textarea.ConfigurationException;

/**
 * SessionSettings - caret blink and key repeat timing
 *
 * Blink times are in frames, repeat times in milliseconds converted to frames
 * at {@link #FRAMES_PER_MS} (60 frames per second).
 */
public class SessionSettings {
    public static final double FRAMES_PER_MS = 0.06;

    public static final String CURSOR_SHOW_TIME = "cursorShowTime";
    public static final String CURSOR_HIDE_TIME = "cursorHideTime";
    public static final String REPEAT_DELAY = "repeatDelay";
    public static final String REPEAT_SPAN = "repeatSpan";

    public static final int DEFAULT_CURSOR_SHOW_TIME = 30;
    public static final int DEFAULT_CURSOR_HIDE_TIME = 30;
    public static final int DEFAULT_REPEAT_DELAY = 500;
    public static final int DEFAULT_REPEAT_SPAN = 50;

    private int cursorShowTime = DEFAULT_CURSOR_SHOW_TIME;
    private int cursorHideTime = DEFAULT_CURSOR_HIDE_TIME;
    private int repeatDelay = DEFAULT_REPEAT_DELAY;
    private int repeatSpan = DEFAULT_REPEAT_SPAN;

    public SessionSettings() {}

    public SessionSettings withCursorShowTime(int frames) {
        this.cursorShowTime = frames;
        return this;
    }

    public SessionSettings withCursorHideTime(int frames) {
        this.cursorHideTime = frames;
        return this;
    }

    public SessionSettings withRepeatDelay(int millis) {
        this.repeatDelay = millis;
        return this;
    }

    public SessionSettings withRepeatSpan(int millis) {
        this.repeatSpan = millis;
        return this;
    }

    public int getCursorShowTime() { return cursorShowTime; }
    public int getCursorHideTime() { return cursorHideTime; }
    public int getRepeatDelay() { return repeatDelay; }
    public int getRepeatSpan() { return repeatSpan; }

    public int getBlinkPeriod() {
        return cursorShowTime + cursorHideTime;
    }

    /** Frames a key is held before it starts repeating. */
    public int getRepeatDelayFrames() {
        return (int) Math.floor(repeatDelay * FRAMES_PER_MS);
    }

    /** Frames between two repeats, at least one. */
    public int getRepeatSpanFrames() {
        return Math.max(1, (int) Math.floor(repeatSpan * FRAMES_PER_MS));
    }

    public void validate() {
        if (cursorShowTime < 0 || cursorHideTime < 0 || getBlinkPeriod() == 0) {
            throw new ConfigurationException("[SessionSettings] blink times must be >= 0 with a positive sum, got: "
                + cursorShowTime + "/" + cursorHideTime);
        }
        if (repeatDelay < 0 || repeatSpan < 0) {
            throw new ConfigurationException("[SessionSettings] repeat times must be >= 0, got: "
                + repeatDelay + "/" + repeatSpan);
        }
    }

    // ===== SERIALIZATION =====

    public static SessionSettings fromJson(JsonObject json) {
        SessionSettings settings = new SessionSettings();
        if (json == null) {
            return settings;
        }
        try {
            JsonElement e;
            if ((e = json.get(CURSOR_SHOW_TIME)) != null && !e.isJsonNull()) settings.cursorShowTime = e.getAsInt();
            if ((e = json.get(CURSOR_HIDE_TIME)) != null && !e.isJsonNull()) settings.cursorHideTime = e.getAsInt();
            if ((e = json.get(REPEAT_DELAY)) != null && !e.isJsonNull()) settings.repeatDelay = e.getAsInt();
            if ((e = json.get(REPEAT_SPAN)) != null && !e.isJsonNull()) settings.repeatSpan = e.getAsInt();
        } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException ex) {
            throw new ConfigurationException("[SessionSettings.fromJson] invalid settings: " + ex.getMessage(), ex);
        }
        settings.validate();
        return settings;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty(CURSOR_SHOW_TIME, cursorShowTime);
        json.addProperty(CURSOR_HIDE_TIME, cursorHideTime);
        json.addProperty(REPEAT_DELAY, repeatDelay);
        json.addProperty(REPEAT_SPAN, repeatSpan);
        return json;
    }

    /**
     * Reads settings from a JSON file; a missing file yields the defaults.
     */
    public static SessionSettings load(Path file) throws IOException {
        if (!Files.exists(file)) {
            return new SessionSettings();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        try {
            JsonElement element = JsonParser.parseString(content);
            if (!element.isJsonObject()) {
                throw new ConfigurationException("[SessionSettings.load] not a JSON object: " + file);
            }
            return fromJson(element.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new ConfigurationException("[SessionSettings.load] malformed JSON in " + file, e);
        }
    }

    public void save(Path file) throws IOException {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, gson.toJson(toJson()), StandardCharsets.UTF_8);
    }
}
