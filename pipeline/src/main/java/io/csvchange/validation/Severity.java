package io.csvchange.validation;

/** Only CRITICAL and ERROR make a result invalid. */
public enum Severity { CRITICAL, ERROR, WARNING }
