package io.csvchange.backup;

import java.nio.file.Path;

/** Retention could not remove an old backup of {@code original}; the backup that triggered it was kept. */
public record RetentionFailure(Path original, Exception error) {
}
