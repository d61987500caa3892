package io.csvchange.validation;

public enum WarningType { DATA_QUALITY, PERFORMANCE, FORMAT }
