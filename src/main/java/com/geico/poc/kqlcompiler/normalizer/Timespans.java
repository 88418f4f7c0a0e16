package com.geico.poc.kqlcompiler.normalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * KQL timespan literals ({@code 7d}, {@code 2h30m}, {@code 500ms}) and their SQL interval form.
 */
public final class Timespans {

    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|us|d|h|m|s)");
    private static final Pattern WHOLE = Pattern.compile("(?:\\d+(?:\\.\\d+)?(?:ms|us|d|h|m|s))+");

    private static final Map<String, String> INTERVAL_UNITS = new LinkedHashMap<>();
    private static final Map<String, String> TRUNC_UNITS = new LinkedHashMap<>();

    static {
        INTERVAL_UNITS.put("d", "days");
        INTERVAL_UNITS.put("h", "hours");
        INTERVAL_UNITS.put("m", "minutes");
        INTERVAL_UNITS.put("s", "seconds");
        INTERVAL_UNITS.put("ms", "milliseconds");
        INTERVAL_UNITS.put("us", "microseconds");

        TRUNC_UNITS.put("1d", "day");
        TRUNC_UNITS.put("1h", "hour");
        TRUNC_UNITS.put("1m", "minute");
        TRUNC_UNITS.put("1s", "second");
    }

    private Timespans() {
    }

    public static boolean isTimespan(String text) {
        return text != null && WHOLE.matcher(text.trim()).matches();
    }

    /**
     * {@code "2h30m"} becomes {@code "2 hours 30 minutes"}.
     */
    public static String toInterval(String text) {
        if (!isTimespan(text)) {
            throw new NormalizationException("Not a timespan: " + text);
        }
        StringBuilder sb = new StringBuilder();
        Matcher matcher = PART.matcher(text.trim());
        while (matcher.find()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(matcher.group(1)).append(' ').append(INTERVAL_UNITS.get(matcher.group(2)));
        }
        return sb.toString();
    }

    /**
     * DATE_TRUNC unit for a single-unit bucket size such as {@code 1h}.
     */
    public static String toTruncUnit(String text) {
        String unit = text == null ? null : TRUNC_UNITS.get(text.trim());
        if (unit == null) {
            throw new NormalizationException("Unsupported bucket size for bin(): " + text
                    + " (supported: " + TRUNC_UNITS.keySet() + ")");
        }
        return unit;
    }
}
