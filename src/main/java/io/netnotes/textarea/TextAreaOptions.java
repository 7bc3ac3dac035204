package io.netnotes.textarea;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import io.netnotes.textarea.layout.TextAlign;

/**
 * TextAreaOptions - partial configuration for a {@link TextArea}
 *
 * Every field is nullable: null means "not given". {@link TextArea#update}
 * merges the given fields onto the current values, so a single option can
 * change without restating the rest.
 *
 * SERIALIZATION:
 * - fromJson()/toJson() use the property names below as JSON keys
 * - align is a string ("L", "C", "R", "J" or a constant name) or a number
 * - colours use the encoded form of {@link TextColor}
 */
public class TextAreaOptions {
    public static final String TEXT = "text";
    public static final String SAMPLE = "sample";
    public static final String ALIGN = "align";
    public static final String VALIGN = "valign";
    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";
    public static final String LETTER_SPACING = "letterSpacing";
    public static final String LINE_SPACING = "lineSpacing";
    public static final String COLOR = "color";
    public static final String COLORS = "colors";
    public static final String WHOLE_WORDS = "wholeWords";
    public static final String ONE_LINE = "oneLine";
    public static final String MAX_CHARS = "maxChars";
    public static final String MAX_LINE_CHARS = "maxLineChars";
    public static final String UNDO_LEVELS = "undoLevels";
    public static final String CARET_WIDTH = "caretWidth";
    public static final String CARET_COLOR = "caretColor";
    public static final String CARET_ALPHA = "caretAlpha";
    public static final String SELECTION_COLOR = "selectionColor";
    public static final String SELECTION_ALPHA = "selectionAlpha";
    public static final String SLIDER_WIDTH = "sliderWidth";
    public static final String SLIDER_COLOR = "sliderColor";
    public static final String SLIDER_ALPHA = "sliderAlpha";
    public static final String EDIT = "edit";
    public static final String SCROLL = "scroll";

    public static final String DEFAULT_SAMPLE = "qP|";
    public static final int DEFAULT_UNDO_LEVELS = 10;

    private String text = null;
    private String sample = null;
    private TextAlign align = null;
    private Double valign = null;
    private Double width = null;
    private Double height = null;
    private Double letterSpacing = null;
    private Double lineSpacing = null;
    private TextColor color = null;
    private List<TextColor> colors = null;
    private Boolean wholeWords = null;
    private Boolean oneLine = null;
    private Integer maxChars = null;
    private Integer maxLineChars = null;
    private Integer undoLevels = null;
    private Double caretWidth = null;
    private Integer caretColor = null;
    private Double caretAlpha = null;
    private Integer selectionColor = null;
    private Double selectionAlpha = null;
    private Double sliderWidth = null;
    private Integer sliderColor = null;
    private Double sliderAlpha = null;
    private Boolean edit = null;
    private Boolean scroll = null;

    public TextAreaOptions() {}

    /**
     * Options with every defaulted field filled in. Width, height, colours and
     * the character limits stay absent.
     */
    public static TextAreaOptions defaults() {
        return new TextAreaOptions()
            .withText("")
            .withSample(DEFAULT_SAMPLE)
            .withAlign(TextAlign.LEFT)
            .withValign(0)
            .withLetterSpacing(0)
            .withLineSpacing(0)
            .withWholeWords(false)
            .withOneLine(false)
            .withUndoLevels(DEFAULT_UNDO_LEVELS)
            .withCaretWidth(2)
            .withCaretColor(0x000000)
            .withCaretAlpha(1)
            .withSelectionColor(0x888888)
            .withSelectionAlpha(0.25)
            .withSliderWidth(2)
            .withSliderColor(0x888888)
            .withSliderAlpha(0.5)
            .withEdit(false)
            .withScroll(false);
    }

    // ===== BUILDER STYLE =====

    public TextAreaOptions withText(String text) { this.text = text; return this; }
    public TextAreaOptions withSample(String sample) { this.sample = sample; return this; }
    public TextAreaOptions withAlign(TextAlign align) { this.align = align; return this; }
    public TextAreaOptions withValign(double valign) { this.valign = valign; return this; }
    public TextAreaOptions withWidth(double width) { this.width = width; return this; }
    public TextAreaOptions withHeight(double height) { this.height = height; return this; }

    public TextAreaOptions withSize(double width, double height) {
        this.width = width;
        this.height = height;
        return this;
    }

    public TextAreaOptions withLetterSpacing(double letterSpacing) { this.letterSpacing = letterSpacing; return this; }
    public TextAreaOptions withLineSpacing(double lineSpacing) { this.lineSpacing = lineSpacing; return this; }
    public TextAreaOptions withColor(TextColor color) { this.color = color; return this; }

    public TextAreaOptions withColors(List<TextColor> colors) {
        this.colors = colors == null ? null : Collections.unmodifiableList(new ArrayList<>(colors));
        return this;
    }

    public TextAreaOptions withWholeWords(boolean wholeWords) { this.wholeWords = wholeWords; return this; }
    public TextAreaOptions withOneLine(boolean oneLine) { this.oneLine = oneLine; return this; }
    public TextAreaOptions withMaxChars(int maxChars) { this.maxChars = maxChars; return this; }
    public TextAreaOptions withMaxLineChars(int maxLineChars) { this.maxLineChars = maxLineChars; return this; }
    public TextAreaOptions withUndoLevels(int undoLevels) { this.undoLevels = undoLevels; return this; }
    public TextAreaOptions withCaretWidth(double caretWidth) { this.caretWidth = caretWidth; return this; }
    public TextAreaOptions withCaretColor(int caretColor) { this.caretColor = caretColor; return this; }
    public TextAreaOptions withCaretAlpha(double caretAlpha) { this.caretAlpha = caretAlpha; return this; }
    public TextAreaOptions withSelectionColor(int selectionColor) { this.selectionColor = selectionColor; return this; }
    public TextAreaOptions withSelectionAlpha(double selectionAlpha) { this.selectionAlpha = selectionAlpha; return this; }
    public TextAreaOptions withSliderWidth(double sliderWidth) { this.sliderWidth = sliderWidth; return this; }
    public TextAreaOptions withSliderColor(int sliderColor) { this.sliderColor = sliderColor; return this; }
    public TextAreaOptions withSliderAlpha(double sliderAlpha) { this.sliderAlpha = sliderAlpha; return this; }
    public TextAreaOptions withEdit(boolean edit) { this.edit = edit; return this; }
    public TextAreaOptions withScroll(boolean scroll) { this.scroll = scroll; return this; }

    // ===== GETTERS =====

    public String getText() { return text; }
    public String getSample() { return sample; }
    public TextAlign getAlign() { return align; }
    public Double getValign() { return valign; }
    public Double getWidth() { return width; }
    public Double getHeight() { return height; }
    public Double getLetterSpacing() { return letterSpacing; }
    public Double getLineSpacing() { return lineSpacing; }
    public TextColor getColor() { return color; }
    public List<TextColor> getColors() { return colors; }
    public Boolean isWholeWords() { return wholeWords; }
    public Boolean isOneLine() { return oneLine; }
    public Integer getMaxChars() { return maxChars; }
    public Integer getMaxLineChars() { return maxLineChars; }
    public Integer getUndoLevels() { return undoLevels; }
    public Double getCaretWidth() { return caretWidth; }
    public Integer getCaretColor() { return caretColor; }
    public Double getCaretAlpha() { return caretAlpha; }
    public Integer getSelectionColor() { return selectionColor; }
    public Double getSelectionAlpha() { return selectionAlpha; }
    public Double getSliderWidth() { return sliderWidth; }
    public Integer getSliderColor() { return sliderColor; }
    public Double getSliderAlpha() { return sliderAlpha; }
    public Boolean isEdit() { return edit; }
    public Boolean isScroll() { return scroll; }

    // ===== MERGE / VALIDATION =====

    /**
     * @return a new instance holding this instance's values overridden by
     *         every non-null field of {@code update}
     */
    public TextAreaOptions merge(TextAreaOptions update) {
        TextAreaOptions merged = copy();
        if (update == null) {
            return merged;
        }
        if (update.text != null) merged.text = update.text;
        if (update.sample != null) merged.sample = update.sample;
        if (update.align != null) merged.align = update.align;
        if (update.valign != null) merged.valign = update.valign;
        if (update.width != null) merged.width = update.width;
        if (update.height != null) merged.height = update.height;
        if (update.letterSpacing != null) merged.letterSpacing = update.letterSpacing;
        if (update.lineSpacing != null) merged.lineSpacing = update.lineSpacing;
        if (update.color != null) merged.color = update.color;
        if (update.colors != null) merged.colors = update.colors;
        if (update.wholeWords != null) merged.wholeWords = update.wholeWords;
        if (update.oneLine != null) merged.oneLine = update.oneLine;
        if (update.maxChars != null) merged.maxChars = update.maxChars;
        if (update.maxLineChars != null) merged.maxLineChars = update.maxLineChars;
        if (update.undoLevels != null) merged.undoLevels = update.undoLevels;
        if (update.caretWidth != null) merged.caretWidth = update.caretWidth;
        if (update.caretColor != null) merged.caretColor = update.caretColor;
        if (update.caretAlpha != null) merged.caretAlpha = update.caretAlpha;
        if (update.selectionColor != null) merged.selectionColor = update.selectionColor;
        if (update.selectionAlpha != null) merged.selectionAlpha = update.selectionAlpha;
        if (update.sliderWidth != null) merged.sliderWidth = update.sliderWidth;
        if (update.sliderColor != null) merged.sliderColor = update.sliderColor;
        if (update.sliderAlpha != null) merged.sliderAlpha = update.sliderAlpha;
        if (update.edit != null) merged.edit = update.edit;
        if (update.scroll != null) merged.scroll = update.scroll;
        return merged;
    }

    public TextAreaOptions copy() {
        TextAreaOptions copy = new TextAreaOptions();
        copy.text = text;
        copy.sample = sample;
        copy.align = align;
        copy.valign = valign;
        copy.width = width;
        copy.height = height;
        copy.letterSpacing = letterSpacing;
        copy.lineSpacing = lineSpacing;
        copy.color = color;
        copy.colors = colors;
        copy.wholeWords = wholeWords;
        copy.oneLine = oneLine;
        copy.maxChars = maxChars;
        copy.maxLineChars = maxLineChars;
        copy.undoLevels = undoLevels;
        copy.caretWidth = caretWidth;
        copy.caretColor = caretColor;
        copy.caretAlpha = caretAlpha;
        copy.selectionColor = selectionColor;
        copy.selectionAlpha = selectionAlpha;
        copy.sliderWidth = sliderWidth;
        copy.sliderColor = sliderColor;
        copy.sliderAlpha = sliderAlpha;
        copy.edit = edit;
        copy.scroll = scroll;
        return copy;
    }

    /**
     * Checks the ranges of the fields that are set.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public void validate() {
        if (valign != null && (valign.isNaN() || valign < 0 || valign > 1)) {
            throw new ConfigurationException("[TextAreaOptions] valign must be in [0, 1], got: " + valign);
        }
        if (width != null && !(width > 0)) {
            throw new ConfigurationException("[TextAreaOptions] width must be > 0, got: " + width);
        }
        if (height != null && !(height > 0)) {
            throw new ConfigurationException("[TextAreaOptions] height must be > 0, got: " + height);
        }
        if (undoLevels != null && undoLevels < 0) {
            throw new ConfigurationException("[TextAreaOptions] undoLevels must be >= 0, got: " + undoLevels);
        }
        if (maxChars != null && maxChars < 0) {
            throw new ConfigurationException("[TextAreaOptions] maxChars must be >= 0, got: " + maxChars);
        }
        if (maxLineChars != null && maxLineChars < 1) {
            throw new ConfigurationException("[TextAreaOptions] maxLineChars must be >= 1, got: " + maxLineChars);
        }
        if (caretWidth != null && caretWidth < 0) {
            throw new ConfigurationException("[TextAreaOptions] caretWidth must be >= 0, got: " + caretWidth);
        }
        if (sliderWidth != null && sliderWidth < 0) {
            throw new ConfigurationException("[TextAreaOptions] sliderWidth must be >= 0, got: " + sliderWidth);
        }
        checkAlpha(CARET_ALPHA, caretAlpha);
        checkAlpha(SELECTION_ALPHA, selectionAlpha);
        checkAlpha(SLIDER_ALPHA, sliderAlpha);
    }

    private static void checkAlpha(String name, Double alpha) {
        if (alpha != null && (alpha.isNaN() || alpha < 0 || alpha > 1)) {
            throw new ConfigurationException("[TextAreaOptions] " + name + " must be in [0, 1], got: " + alpha);
        }
    }

    // ===== SERIALIZATION =====

    public static TextAreaOptions fromJson(JsonObject json) {
        TextAreaOptions options = new TextAreaOptions();
        if (json == null) {
            return options;
        }
        try {
            JsonElement e;
            if ((e = json.get(TEXT)) != null && !e.isJsonNull()) options.text = e.getAsString();
            if ((e = json.get(SAMPLE)) != null && !e.isJsonNull()) options.sample = e.getAsString();
            if ((e = json.get(ALIGN)) != null && !e.isJsonNull()) options.align = parseAlign(e);
            if ((e = json.get(VALIGN)) != null && !e.isJsonNull()) options.valign = e.getAsDouble();
            if ((e = json.get(WIDTH)) != null && !e.isJsonNull()) options.width = e.getAsDouble();
            if ((e = json.get(HEIGHT)) != null && !e.isJsonNull()) options.height = e.getAsDouble();
            if ((e = json.get(LETTER_SPACING)) != null && !e.isJsonNull()) options.letterSpacing = e.getAsDouble();
            if ((e = json.get(LINE_SPACING)) != null && !e.isJsonNull()) options.lineSpacing = e.getAsDouble();
            if ((e = json.get(COLOR)) != null && !e.isJsonNull()) options.color = TextColor.fromEncoded(e.getAsDouble());
            if ((e = json.get(COLORS)) != null && !e.isJsonNull()) options.withColors(parseColors(e.getAsJsonArray()));
            if ((e = json.get(WHOLE_WORDS)) != null && !e.isJsonNull()) options.wholeWords = e.getAsBoolean();
            if ((e = json.get(ONE_LINE)) != null && !e.isJsonNull()) options.oneLine = e.getAsBoolean();
            if ((e = json.get(MAX_CHARS)) != null && !e.isJsonNull()) options.maxChars = e.getAsInt();
            if ((e = json.get(MAX_LINE_CHARS)) != null && !e.isJsonNull()) options.maxLineChars = e.getAsInt();
            if ((e = json.get(UNDO_LEVELS)) != null && !e.isJsonNull()) options.undoLevels = e.getAsInt();
            if ((e = json.get(CARET_WIDTH)) != null && !e.isJsonNull()) options.caretWidth = e.getAsDouble();
            if ((e = json.get(CARET_COLOR)) != null && !e.isJsonNull()) options.caretColor = e.getAsInt();
            if ((e = json.get(CARET_ALPHA)) != null && !e.isJsonNull()) options.caretAlpha = e.getAsDouble();
            if ((e = json.get(SELECTION_COLOR)) != null && !e.isJsonNull()) options.selectionColor = e.getAsInt();
            if ((e = json.get(SELECTION_ALPHA)) != null && !e.isJsonNull()) options.selectionAlpha = e.getAsDouble();
            if ((e = json.get(SLIDER_WIDTH)) != null && !e.isJsonNull()) options.sliderWidth = e.getAsDouble();
            if ((e = json.get(SLIDER_COLOR)) != null && !e.isJsonNull()) options.sliderColor = e.getAsInt();
            if ((e = json.get(SLIDER_ALPHA)) != null && !e.isJsonNull()) options.sliderAlpha = e.getAsDouble();
            if ((e = json.get(EDIT)) != null && !e.isJsonNull()) options.edit = e.getAsBoolean();
            if ((e = json.get(SCROLL)) != null && !e.isJsonNull()) options.scroll = e.getAsBoolean();
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException ex) {
            throw new ConfigurationException("[TextAreaOptions.fromJson] invalid options: " + ex.getMessage(), ex);
        }
        return options;
    }

    private static TextAlign parseAlign(JsonElement element) {
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return TextAlign.of(primitive.getAsDouble());
        }
        return TextAlign.parse(primitive.getAsString());
    }

    private static List<TextColor> parseColors(JsonArray array) {
        List<TextColor> list = new ArrayList<>(array.size());
        for (JsonElement element : array) {
            list.add(TextColor.fromEncoded(element.getAsDouble()));
        }
        return list;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();

        if (text != null) json.addProperty(TEXT, text);
        if (sample != null) json.addProperty(SAMPLE, sample);
        if (align != null) {
            if (align.isJustified()) {
                json.addProperty(ALIGN, "J");
            } else {
                json.addProperty(ALIGN, align.getFraction());
            }
        }
        if (valign != null) json.addProperty(VALIGN, valign);
        if (width != null) json.addProperty(WIDTH, width);
        if (height != null) json.addProperty(HEIGHT, height);
        if (letterSpacing != null) json.addProperty(LETTER_SPACING, letterSpacing);
        if (lineSpacing != null) json.addProperty(LINE_SPACING, lineSpacing);
        if (color != null) json.addProperty(COLOR, color.toEncoded());
        if (colors != null) {
            JsonArray array = new JsonArray();
            for (TextColor c : colors) {
                array.add(c.toEncoded());
            }
            json.add(COLORS, array);
        }
        if (wholeWords != null) json.addProperty(WHOLE_WORDS, wholeWords);
        if (oneLine != null) json.addProperty(ONE_LINE, oneLine);
        if (maxChars != null) json.addProperty(MAX_CHARS, maxChars);
        if (maxLineChars != null) json.addProperty(MAX_LINE_CHARS, maxLineChars);
        if (undoLevels != null) json.addProperty(UNDO_LEVELS, undoLevels);
        if (caretWidth != null) json.addProperty(CARET_WIDTH, caretWidth);
        if (caretColor != null) json.addProperty(CARET_COLOR, caretColor);
        if (caretAlpha != null) json.addProperty(CARET_ALPHA, caretAlpha);
        if (selectionColor != null) json.addProperty(SELECTION_COLOR, selectionColor);
        if (selectionAlpha != null) json.addProperty(SELECTION_ALPHA, selectionAlpha);
        if (sliderWidth != null) json.addProperty(SLIDER_WIDTH, sliderWidth);
        if (sliderColor != null) json.addProperty(SLIDER_COLOR, sliderColor);
        if (sliderAlpha != null) json.addProperty(SLIDER_ALPHA, sliderAlpha);
        if (edit != null) json.addProperty(EDIT, edit);
        if (scroll != null) json.addProperty(SCROLL, scroll);
        return json;
    }
}
