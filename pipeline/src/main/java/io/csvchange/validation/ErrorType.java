package io.csvchange.validation;

public enum ErrorType { STRUCTURE, SCHEMA, DATA, FORMAT }
