package org.iceforge.governor.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly byte sizes like "64MiB", "100MB", "1.5GB" or "4*1024*1024".
 * <p>
 * Units are binary (KB = 1024). IEC spellings (KiB, MiB, GiB, TiB) are accepted as aliases and
 * terms may be multiplied with '*'. Fractions are floored to whole bytes.
 */
public final class DataSizeParser {
    private static final Pattern TOKEN = Pattern.compile("\\d+\\.\\d*|\\d+|\\*|KB|MB|GB|TB|B");

    private DataSizeParser() {}

    /**
     * @throws IllegalArgumentException if the expression is blank, malformed or not positive
     */
    public static long parseBytes(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("size expression is blank");
        }
        String s = expr.replaceAll("\\s+", "").toUpperCase(Locale.ROOT)
                .replace("KIB", "KB").replace("MIB", "MB").replace("GIB", "GB").replace("TIB", "TB");
        BigDecimal result = BigDecimal.ONE;
        for (String token : tokenize(s, expr)) {
            switch (token) {
                case "*", "B" -> { }
                case "KB" -> result = result.multiply(BigDecimal.valueOf(1L << 10));
                case "MB" -> result = result.multiply(BigDecimal.valueOf(1L << 20));
                case "GB" -> result = result.multiply(BigDecimal.valueOf(1L << 30));
                case "TB" -> result = result.multiply(BigDecimal.valueOf(1L << 40));
                default -> result = result.multiply(new BigDecimal(token));
            }
        }
        BigDecimal floored = result.setScale(0, RoundingMode.FLOOR);
        if (floored.signum() <= 0 || floored.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            throw new IllegalArgumentException("size out of range: " + expr);
        }
        return floored.longValueExact();
    }

    private static List<String> tokenize(String s, String original) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(s);
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) break;
            tokens.add(matcher.group());
            consumed = matcher.end();
        }
        if (consumed != s.length() || tokens.isEmpty()) {
            throw new IllegalArgumentException("invalid size expression: " + original);
        }
        return tokens;
    }
}
