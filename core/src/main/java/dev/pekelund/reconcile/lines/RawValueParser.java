package dev.pekelund.reconcile.lines;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Reads numbers from extractor output. Accepts currency symbols, thousands separators, decimal commas
 * and accounting-style negatives such as {@code (5.00)}.
 */
public final class RawValueParser {

    private static final Pattern NUMBER_WITH_UNIT = Pattern.compile("^(-?[\\d.,\\s]+)\\s*(\\p{L}+)\\.?$");

    private RawValueParser() {
        // Utility class
    }

    /**
     * @return the parsed value, or null when the text holds no number
     */
    public static BigDecimal parseDecimal(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String text = raw.trim();
        boolean negative = false;
        if (text.startsWith("(") && text.endsWith(")")) {
            negative = true;
            text = text.substring(1, text.length() - 1);
        }
        text = text.replaceAll("[$€£¥\\s\\u00a0]", "");
        if (text.endsWith("-")) {
            negative = true;
            text = text.substring(0, text.length() - 1);
        }
        if (text.startsWith("-")) {
            negative = !negative;
            text = text.substring(1);
        }
        text = normalizeSeparators(text);
        if (!text.matches("\\d+(\\.\\d+)?|\\.\\d+")) {
            return null;
        }
        BigDecimal value = new BigDecimal(text);
        return negative ? value.negate() : value;
    }

    /**
     * Splits values like {@code 2.84 kg} into number and unit text.
     *
     * @return a two element array of number text and unit text, or null when the value has no unit suffix
     */
    public static String[] splitUnit(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        Matcher matcher = NUMBER_WITH_UNIT.matcher(raw.trim());
        if (!matcher.matches()) {
            return null;
        }
        return new String[] {matcher.group(1).trim(), matcher.group(2)};
    }

    private static String normalizeSeparators(String text) {
        int lastComma = text.lastIndexOf(',');
        int lastDot = text.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                return text.replace(".", "").replace(',', '.');
            }
            return text.replace(",", "");
        }
        if (lastComma >= 0) {
            int decimals = text.length() - lastComma - 1;
            if (text.indexOf(',') == lastComma && decimals != 3) {
                return text.replace(',', '.');
            }
            return text.replace(",", "");
        }
        return text;
    }
}
