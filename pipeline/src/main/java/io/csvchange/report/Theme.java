package io.csvchange.report;

/** Colour scheme for HTML reports. */
public enum Theme {
    LIGHT("#ffffff", "#1f2328", "#f6f8fa", "#d0d7de"),
    DARK("#0d1117", "#e6edf3", "#161b22", "#30363d");

    final String background;
    final String text;
    final String panel;
    final String border;

    Theme(String background, String text, String panel, String border) {
        this.background = background;
        this.text = text;
        this.panel = panel;
        this.border = border;
    }
}
