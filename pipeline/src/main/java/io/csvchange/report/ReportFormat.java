package io.csvchange.report;

import java.util.Locale;

public enum ReportFormat {
    CONSOLE("txt"),
    HTML("html"),
    JSON("json"),
    MARKDOWN("md");

    private final String extension;

    ReportFormat(String extension) { this.extension = extension; }

    public String extension() { return extension; }

    public static ReportFormat parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
