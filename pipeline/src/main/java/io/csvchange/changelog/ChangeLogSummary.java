package io.csvchange.changelog;

import java.time.Instant;
import java.util.Map;

public record ChangeLogSummary(int totalChanges,
                               Map<String, Integer> changesByType,
                               Map<String, Integer> changesByFile,
                               Instant firstChange,
                               Instant lastChange) {

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Total Changes: ").append(totalChanges).append("\n\nChanges by Type:\n");
        changesByType.forEach((k, v) -> sb.append("  ").append(k).append(": ").append(v).append('\n'));
        sb.append("\nChanges by File:\n");
        changesByFile.forEach((k, v) -> sb.append("  ").append(k).append(": ").append(v).append('\n'));
        if (firstChange != null && lastChange != null) {
            sb.append("\nFirst Change: ").append(firstChange).append("\nLast Change: ").append(lastChange).append('\n');
        }
        return sb.toString();
    }
}
