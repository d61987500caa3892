package io.csvchange.diff;

public enum ChangeType { ADDED, REMOVED, MODIFIED, MOVED, UNCHANGED }
