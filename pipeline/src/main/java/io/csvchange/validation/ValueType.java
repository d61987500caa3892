package io.csvchange.validation;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Inferred column type. Declaration order is the precedence used both for classifying a value and for breaking ties.
 */
public enum ValueType {
    NUMBER, BOOLEAN, DATE, EMAIL, URL, STRING, EMPTY;

    public static final int SAMPLE_SIZE = 100;

    private static final Pattern NUMBER_RE = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern BOOLEAN_RE = Pattern.compile("^(true|false|yes|no|y|n)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern US_DATE_RE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}");
    private static final Pattern URL_RE = Pattern.compile("^https?://");

    public String id() { return name().toLowerCase(Locale.ROOT); }

    public static ValueType classify(String raw) {
        String v = raw.trim();
        if (NUMBER_RE.matcher(v).matches()) return NUMBER;
        if (BOOLEAN_RE.matcher(v).matches()) return BOOLEAN;
        if (ISO_DATE_RE.matcher(v).find() || US_DATE_RE.matcher(v).find()) return DATE;
        if (BuiltInValidators.EMAIL.matcher(v).matches()) return EMAIL;
        if (URL_RE.matcher(v).find()) return URL;
        return STRING;
    }

    /** Majority type over the first {@link #SAMPLE_SIZE} non-empty values; EMPTY when there are none. */
    public static ValueType infer(List<String> values) {
        Map<ValueType, Integer> counts = new EnumMap<>(ValueType.class);
        int seen = 0;
        for (String v : values) {
            if (v == null || v.isEmpty()) continue;
            counts.merge(classify(v), 1, Integer::sum);
            if (++seen == SAMPLE_SIZE) break;
        }
        if (seen == 0) return EMPTY;
        ValueType best = STRING;
        int bestCount = -1;
        for (Map.Entry<ValueType, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
