package io.poolflow.config;

import java.util.Locale;

/**
 * Human byte sizes: plain bytes or a number with a binary K, M, G or T suffix ({@code 512M},
 * {@code 1.5G}). A trailing {@code B} or {@code iB} is accepted.
 */
public final class ByteSizes {
    private static final String UNITS = "KMGT";

    private ByteSizes() {}

    public static long parse(String text) {
        if (text == null) throw new IllegalArgumentException("size is null");
        String s = text.trim().toUpperCase(Locale.ROOT);
        if (s.endsWith("IB")) s = s.substring(0, s.length() - 2);
        else if (s.endsWith("B")) s = s.substring(0, s.length() - 1);
        if (s.isEmpty()) throw new IllegalArgumentException("invalid size '" + text + "'");
        int exp = UNITS.indexOf(s.charAt(s.length() - 1)) + 1;
        String number = exp > 0 ? s.substring(0, s.length() - 1).trim() : s;
        double value;
        try {
            value = Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid size '" + text + "'", e);
        }
        if (value < 0 || Double.isNaN(value)) throw new IllegalArgumentException("size must be >= 0: '" + text + "'");
        double bytes = value * Math.pow(1024, exp);
        if (bytes >= Long.MAX_VALUE) throw new IllegalArgumentException("size too large: '" + text + "'");
        return (long) bytes;
    }

    /** Largest unit that keeps the value at or above 1, one decimal ({@code 1.5G}, {@code 900}). */
    public static String format(long bytes) {
        if (bytes == Long.MAX_VALUE) return "unbounded";
        if (bytes < 1024) return Long.toString(bytes);
        int exp = 0;
        double v = bytes;
        while (v >= 1024 && exp < UNITS.length()) { v /= 1024; exp++; }
        String num = v == Math.rint(v) ? Long.toString((long) v) : String.format(Locale.ROOT, "%.1f", v);
        return num + UNITS.charAt(exp - 1);
    }
}
