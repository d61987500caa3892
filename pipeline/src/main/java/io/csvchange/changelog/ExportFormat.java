package io.csvchange.changelog;

public enum ExportFormat { JSON, CSV }
