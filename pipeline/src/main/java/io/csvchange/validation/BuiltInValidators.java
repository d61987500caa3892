package io.csvchange.validation;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validators registered on every {@link CsvValidationPipeline} unless it is built without them.
 */
public final class BuiltInValidators {
    static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^[\\d\\s\\-()+.]+$");
    private static final Pattern HTTP = Pattern.compile("^https?://");

    private BuiltInValidators() {}

    public static List<FieldValidator> all() {
        return List.of(email(), phone(), url(), coordinates());
    }

    public static FieldValidator email() {
        return FieldValidator.of("email-format", "Validate email format", (value, row, i, column) -> {
            if (!"email".equals(column) || isBlank(value) || EMAIL.matcher(value).matches()) return Optional.empty();
            return Optional.of(ValidationError.ofValue(ErrorType.FORMAT, Severity.ERROR, "INVALID_EMAIL_FORMAT",
                    "Invalid email format: \"" + value + "\"", value));
        });
    }

    public static FieldValidator phone() {
        return FieldValidator.of("phone-format", "Validate phone number format", (value, row, i, column) -> {
            if (!"phone".equals(column) || isBlank(value) || PHONE.matcher(value).matches()) return Optional.empty();
            return Optional.of(ValidationError.ofValue(ErrorType.FORMAT, Severity.WARNING, "UNUSUAL_PHONE_FORMAT",
                    "Unusual phone number format: \"" + value + "\"", value));
        });
    }

    public static FieldValidator url() {
        return FieldValidator.of("url-format", "Validate URL format", (value, row, i, column) -> {
            if (!"website".equals(column) || isBlank(value) || HTTP.matcher(value).find()) return Optional.empty();
            return Optional.of(ValidationError.ofValue(ErrorType.FORMAT, Severity.WARNING, "INVALID_URL_FORMAT",
                    "URL should start with http:// or https://: \"" + value + "\"", value));
        });
    }

    public static FieldValidator coordinates() {
        return FieldValidator.of("coordinate-range", "Validate latitude/longitude ranges", (value, row, i, column) -> {
            boolean lat = "latitude".equals(column);
            if ((!lat && !"longitude".equals(column)) || isBlank(value)) return Optional.empty();
            double num;
            try {
                num = Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                return Optional.of(ValidationError.ofValue(ErrorType.DATA, Severity.ERROR, "INVALID_COORDINATE",
                        "Invalid coordinate value: \"" + value + "\"", value));
            }
            if (lat && (num < -90 || num > 90)) {
                return Optional.of(ValidationError.ofValue(ErrorType.DATA, Severity.ERROR, "LATITUDE_OUT_OF_RANGE",
                        "Latitude out of range (-90 to 90): " + num, value));
            }
            if (!lat && (num < -180 || num > 180)) {
                return Optional.of(ValidationError.ofValue(ErrorType.DATA, Severity.ERROR, "LONGITUDE_OUT_OF_RANGE",
                        "Longitude out of range (-180 to 180): " + num, value));
            }
            return Optional.empty();
        });
    }

    private static boolean isBlank(String v) { return v == null || v.isEmpty(); }
}
