package org.iceforge.tilecut.extract;

import java.util.Locale;

/**
 * Window dimensions in pixels.
 */
public record WindowSize(int height, int width) {

    public WindowSize {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got " + height + "x" + width);
        }
    }

    public static WindowSize square(int n) {
        return new WindowSize(n, n);
    }

    /**
     * Parses {@code "64"} (square) or {@code "64x32"} (height x width).
     */
    public static WindowSize parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Window size must not be blank");
        }
        String t = text.trim().toLowerCase(Locale.ROOT);
        try {
            int x = t.indexOf('x');
            if (x < 0) {
                return square((int) Math.round(Double.parseDouble(t)));
            }
            return new WindowSize(Integer.parseInt(t.substring(0, x).trim()), Integer.parseInt(t.substring(x + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unparseable window size: " + text, e);
        }
    }

    public boolean isSquare() {
        return height == width;
    }

    @Override
    public String toString() {
        return height + "x" + width;
    }
}
