package io.netnotes.textarea;

/**
 * Row text colour: 0xRRGGBB plus alpha in [0, 1].
 *
 * The encoded form packs both into one number, the integer part being the
 * RGB value and the fractional part the alpha ({@code 0xFF0000 + 0.5} is half
 * transparent red). A zero fraction means opaque.
 */
public final class TextColor {
    public static final TextColor BLACK = new TextColor(0x000000, 1);

    private final int rgb;
    private final double alpha;

    public TextColor(int rgb, double alpha) {
        if (rgb < 0 || rgb > 0xFFFFFF) {
            throw new IllegalArgumentException("[TextColor] rgb out of range: " + Integer.toHexString(rgb));
        }
        if (Double.isNaN(alpha) || alpha < 0 || alpha > 1) {
            throw new IllegalArgumentException("[TextColor] alpha must be in [0, 1], got: " + alpha);
        }
        this.rgb = rgb;
        this.alpha = alpha;
    }

    public static TextColor rgb(int rgb) {
        return new TextColor(rgb, 1);
    }

    public static TextColor fromEncoded(double encoded) {
        if (Double.isNaN(encoded) || encoded < 0 || encoded >= 0x1000000) {
            throw new IllegalArgumentException("[TextColor.fromEncoded] value out of range: " + encoded);
        }
        int rgb = (int) Math.floor(encoded);
        double alpha = encoded - rgb;
        return new TextColor(rgb, alpha > 0 ? alpha : 1);
    }

    public double toEncoded() {
        return alpha < 1 ? rgb + alpha : rgb;
    }

    public int getRgb() {
        return rgb;
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TextColor)) return false;
        TextColor other = (TextColor) obj;
        return rgb == other.rgb && Double.compare(alpha, other.alpha) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * rgb + Double.hashCode(alpha);
    }

    @Override
    public String toString() {
        return String.format("#%06X@%.2f", rgb, alpha);
    }
}
