package com.geico.poc.kqlcompiler.normalizer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * KQL function name to SQL function name.
 *
 * Names not in the table pass through uppercased ({@code coalesce -> COALESCE}); that
 * fallback is how functions sharing a name in both languages are supported.
 */
public final class FunctionMapping {

    private static final Map<String, String> FUNCTIONS;

    static {
        Map<String, String> map = new HashMap<>();
        map.put("toupper", "UPPER");
        map.put("tolower", "LOWER");
        map.put("strcat", "CONCAT");
        map.put("strlen", "LENGTH");
        map.put("now", "NOW");
        map.put("gethour", "EXTRACT");
        map.put("datetime_part", "EXTRACT");
        map.put("ago", "NOW");
        map.put("count", "COUNT");
        map.put("dcount", "COUNT");
        map.put("min", "MIN");
        map.put("max", "MAX");
        map.put("avg", "AVG");
        map.put("sum", "SUM");
        map.put("date_trunc", "DATE_TRUNC");
        map.put("bin", "DATE_TRUNC");
        FUNCTIONS = Collections.unmodifiableMap(map);
    }

    private FunctionMapping() {
    }

    public static String toSql(String kqlName) {
        String lower = kqlName.toLowerCase(Locale.ROOT);
        String mapped = FUNCTIONS.get(lower);
        return mapped != null ? mapped : kqlName.toUpperCase(Locale.ROOT);
    }

    public static boolean isMapped(String kqlName) {
        return FUNCTIONS.containsKey(kqlName.toLowerCase(Locale.ROOT));
    }
}
