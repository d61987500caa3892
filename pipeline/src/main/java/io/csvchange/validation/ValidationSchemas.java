package io.csvchange.validation;

/**
 * Schemas for the data sets this pipeline was first built around.
 */
public final class ValidationSchemas {
    private static final String DECIMAL = "^-?\\d+(\\.\\d+)?$";
    private static final String OPTIONAL_REVIEW_RATING = "^([1-5](\\.\\d+)?)?$";

    private ValidationSchemas() {}

    /** Store directory listing: one row per store with address, coordinates, hours and up to five reviews. */
    public static ValidationSchema storeDirectory() {
        ValidationSchema.Builder b = ValidationSchema.builder()
                .require("name", "category", "city", "full_address")
                .columns(ColumnRule.nonEmpty(), "name", "category", "city", "full_address")
                .columns(ColumnRule.any(), "description", "phone", "street", "postal_code", "state",
                        "working_hours", "business_status", "place_id",
                        "mon_hours", "tues_hours", "wed_hours", "thur_hours", "fri_hours", "sat_hours", "sun_hours")
                .columns(ColumnRule.uriFormat(), "site", "photo", "street_view", "location_link")
                .columns(ColumnRule.matching(DECIMAL), "latitude", "longitude")
                .column("rating", ColumnRule.matching("^[0-5](\\.\\d+)?$"))
                .column("reviews", ColumnRule.matching("^\\d+$"))
                .additionalColumns(false);
        for (int i = 1; i <= 5; i++) {
            String p = "review_" + i + "_";
            b.columns(ColumnRule.any(), p + "author", p + "time", p + "text");
            b.column(p + "rating", ColumnRule.matching(OPTIONAL_REVIEW_RATING));
        }
        return b.build();
    }
}
