package io.csvchange.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Per-column constraint of a {@link ValidationSchema}. {@code pattern} and {@code uri} apply to non-empty values;
 * {@code minLength} applies to every value, so a minimum of 1 makes the column mandatory per row.
 */
public record ColumnRule(Pattern pattern, int minLength, boolean uri) {

    public static ColumnRule any() { return new ColumnRule(null, 0, false); }
    public static ColumnRule nonEmpty() { return new ColumnRule(null, 1, false); }
    public static ColumnRule matching(String regex) { return new ColumnRule(Pattern.compile(regex), 0, false); }
    public static ColumnRule uriFormat() { return new ColumnRule(null, 0, true); }

    Optional<String> check(String value) {
        String v = value == null ? "" : value;
        if (v.length() < minLength) return Optional.of("must NOT have fewer than " + minLength + " characters");
        if (v.isEmpty()) return Optional.empty();
        if (pattern != null && !pattern.matcher(v).find()) return Optional.of("must match pattern \"" + pattern.pattern() + "\"");
        if (uri && !isAbsoluteUri(v)) return Optional.of("must match format \"uri\"");
        return Optional.empty();
    }

    private static boolean isAbsoluteUri(String v) {
        try {
            return new URI(v).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
