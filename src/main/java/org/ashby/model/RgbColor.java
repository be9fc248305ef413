package org.ashby.model;

import java.util.Locale;

/**
 * Toolkit-independent 8-bit RGB color.
 */
public record RgbColor(int red, int green, int blue) {

    public RgbColor {
        requireChannel(red, "red");
        requireChannel(green, "green");
        requireChannel(blue, "blue");
    }

    /**
     * HSB (a.k.a. HSV) to RGB.
     *
     * @param hueDegrees any angle; wrapped into [0, 360)
     * @param saturation in [0, 1]
     * @param brightness in [0, 1]
     */
    public static RgbColor fromHsb(double hueDegrees, double saturation, double brightness) {
        if (saturation < 0 || saturation > 1 || brightness < 0 || brightness > 1) {
            throw new IllegalArgumentException("saturation and brightness must be in [0, 1]");
        }
        double h = ((hueDegrees % 360.0) + 360.0) % 360.0 / 60.0;
        double c = brightness * saturation;
        double x = c * (1 - Math.abs(h % 2 - 1));
        double m = brightness - c;

        double r, g, b;
        switch ((int) h) {
            case 0 -> { r = c; g = x; b = 0; }
            case 1 -> { r = x; g = c; b = 0; }
            case 2 -> { r = 0; g = c; b = x; }
            case 3 -> { r = 0; g = x; b = c; }
            case 4 -> { r = x; g = 0; b = c; }
            default -> { r = c; g = 0; b = x; }
        }
        return new RgbColor(channel(r + m), channel(g + m), channel(b + m));
    }

    /**
     * Parses "#rrggbb" or "rrggbb" (case-insensitive).
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex must not be null");
        }
        String s = hex.strip();
        if (s.startsWith("#")) s = s.substring(1);
        if (!s.matches("[0-9a-fA-F]{6}")) {
            throw new IllegalArgumentException("Not a #rrggbb color: " + hex);
        }
        int rgb = Integer.parseInt(s, 16);
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
    }

    private static int channel(double unit) {
        return (int) Math.round(Math.max(0.0, Math.min(1.0, unit)) * 255.0);
    }

    private static void requireChannel(int v, String name) {
        if (v < 0 || v > 255) {
            throw new IllegalArgumentException(name + " must be in [0, 255]: " + v);
        }
    }

    @Override
    public String toString() {
        return toHex();
    }
}
