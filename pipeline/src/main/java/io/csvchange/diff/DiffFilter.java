package io.csvchange.diff;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Post-processing applied to a finished {@link DiffResult}. Empty include lists and change-type sets mean "all".
 */
public record DiffFilter(boolean ignoreCase,
                         boolean ignoreWhitespace,
                         List<String> includeColumns,
                         List<String> excludeColumns,
                         Set<ChangeType> changeTypes) {

    public static final DiffFilter NONE = new DiffFilter(false, false, List.of(), List.of(), Set.of());

    public DiffFilter {
        includeColumns = includeColumns == null ? List.of() : List.copyOf(includeColumns);
        excludeColumns = excludeColumns == null ? List.of() : List.copyOf(excludeColumns);
        changeTypes = changeTypes == null || changeTypes.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(changeTypes));
    }

    public boolean isEmpty() {
        return !ignoreCase && !ignoreWhitespace && includeColumns.isEmpty() && excludeColumns.isEmpty() && changeTypes.isEmpty();
    }

    public DiffFilter withIgnoreCase(boolean b) { return new DiffFilter(b, ignoreWhitespace, includeColumns, excludeColumns, changeTypes); }
    public DiffFilter withIgnoreWhitespace(boolean b) { return new DiffFilter(ignoreCase, b, includeColumns, excludeColumns, changeTypes); }
    public DiffFilter includingColumns(List<String> c) { return new DiffFilter(ignoreCase, ignoreWhitespace, c, excludeColumns, changeTypes); }
    public DiffFilter excludingColumns(List<String> c) { return new DiffFilter(ignoreCase, ignoreWhitespace, includeColumns, c, changeTypes); }
    public DiffFilter onlyTypes(Set<ChangeType> t) { return new DiffFilter(ignoreCase, ignoreWhitespace, includeColumns, excludeColumns, t); }

    boolean columnVisible(String column) {
        if (!includeColumns.isEmpty() && !includeColumns.contains(column)) return false;
        return !excludeColumns.contains(column);
    }

    boolean typeVisible(ChangeType t) { return changeTypes.isEmpty() || changeTypes.contains(t); }

    String normalize(String v) {
        String s = v == null ? "" : v;
        if (ignoreWhitespace) s = s.replaceAll("\\s+", " ").trim();
        if (ignoreCase) s = s.toLowerCase(Locale.ROOT);
        return s;
    }
}
