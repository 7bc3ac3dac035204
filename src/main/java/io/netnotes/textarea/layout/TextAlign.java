package io.netnotes.textarea.layout;

import java.util.Locale;

/**
 * TextAlign - horizontal placement of wrapped rows
 *
 * A fraction in [0, 1] positions each row inside the free width of its row
 * (0 = left, 0.5 = center, 1 = right). {@link #JUSTIFIED} stretches the gaps
 * between words instead.
 */
public final class TextAlign {

    public static final TextAlign LEFT = new TextAlign("LEFT", 0, false);
    public static final TextAlign CENTER = new TextAlign("CENTER", 0.5, false);
    public static final TextAlign RIGHT = new TextAlign("RIGHT", 1, false);
    public static final TextAlign JUSTIFIED = new TextAlign("JUSTIFIED", 0, true);

    private final String name;
    private final double fraction;
    private final boolean justified;

    private TextAlign(String name, double fraction, boolean justified) {
        this.name = name;
        this.fraction = fraction;
        this.justified = justified;
    }

    /**
     * Alignment at an arbitrary fraction of the free width; -1 means justified.
     */
    public static TextAlign of(double fraction) {
        if (fraction == -1) {
            return JUSTIFIED;
        }
        if (Double.isNaN(fraction) || fraction < 0 || fraction > 1) {
            throw new IllegalArgumentException("[TextAlign.of] fraction must be in [0, 1] or -1, got: " + fraction);
        }
        if (fraction == 0) return LEFT;
        if (fraction == 0.5) return CENTER;
        if (fraction == 1) return RIGHT;
        return new TextAlign(Double.toString(fraction), fraction, false);
    }

    /**
     * Accepts "L", "C", "R", "J", the constant names, or a number.
     */
    public static TextAlign parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("[TextAlign.parse] value is null");
        }
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "L":
            case "LEFT":
                return LEFT;
            case "C":
            case "CENTER":
                return CENTER;
            case "R":
            case "RIGHT":
                return RIGHT;
            case "J":
            case "JUSTIFIED":
                return JUSTIFIED;
            default:
                try {
                    return of(Double.parseDouble(value.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("[TextAlign.parse] unknown alignment: " + value, e);
                }
        }
    }

    public double getFraction() {
        return fraction;
    }

    public boolean isJustified() {
        return justified;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TextAlign)) return false;
        TextAlign other = (TextAlign) obj;
        return justified == other.justified && fraction == other.fraction;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(fraction) * 31 + (justified ? 1 : 0);
    }

    @Override
    public String toString() {
        return name;
    }
}
