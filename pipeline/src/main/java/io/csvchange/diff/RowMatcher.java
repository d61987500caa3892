package io.csvchange.diff;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pairs rows of two versions of a table.
 * <ol>
 *   <li>Rows with equal identity pair first, in order of appearance for duplicates. Identity is the pipe-joined
 *       key values when key columns are given, otherwise the full content over the common columns when move
 *       detection is on, otherwise the row position.</li>
 *   <li>With row matching on, leftover rows pair by similarity: at least {@code minSimilarity} and at most
 *       {@code proximityWindow} positions apart, best similarity first, then nearest, then earliest.</li>
 *   <li>Anything still unpaired is an addition or a removal.</li>
 * </ol>
 * The tie-breaks are symmetric, so swapping old and new swaps additions with removals and keeps the same pairs.
 */
final class RowMatcher {

    record Pair(int oldIndex, int newIndex, boolean bySimilarity, double similarity) {}

    record Outcome(List<Pair> pairs, List<Integer> unmatchedOld, List<Integer> unmatchedNew) {}

    private final List<String> keyColumns;
    private final List<String> commonColumns;
    private final DiffOptions options;

    RowMatcher(List<String> keyColumns, List<String> commonColumns, DiffOptions options) {
        this.keyColumns = keyColumns;
        this.commonColumns = commonColumns;
        this.options = options;
    }

    String identity(Map<String, String> row, int position) {
        if (!keyColumns.isEmpty()) return join(row, keyColumns);
        if (options.moveDetection()) return join(row, commonColumns);
        return "#" + position;
    }

    String keyOf(Map<String, String> row) {
        return keyColumns.isEmpty() ? null : join(row, keyColumns);
    }

    boolean sameContent(Map<String, String> a, Map<String, String> b) {
        for (String c : commonColumns) {
            if (!Objects.equals(a.get(c), b.get(c))) return false;
        }
        return true;
    }

    double similarity(Map<String, String> a, Map<String, String> b) {
        if (commonColumns.isEmpty()) return 0.0;
        int same = 0;
        for (String c : commonColumns) {
            if (Objects.equals(a.get(c), b.get(c))) same++;
        }
        return (double) same / commonColumns.size();
    }

    Outcome match(List<Map<String, String>> oldRows, List<Map<String, String>> newRows) {
        Map<String, Deque<Integer>> byIdentity = new HashMap<>();
        for (int i = 0; i < oldRows.size(); i++) {
            byIdentity.computeIfAbsent(identity(oldRows.get(i), i), k -> new ArrayDeque<>()).addLast(i);
        }
        boolean[] oldTaken = new boolean[oldRows.size()];
        boolean[] newTaken = new boolean[newRows.size()];
        List<Pair> pairs = new ArrayList<>();
        for (int j = 0; j < newRows.size(); j++) {
            Deque<Integer> q = byIdentity.get(identity(newRows.get(j), j));
            if (q == null || q.isEmpty()) continue;
            int i = q.pollFirst();
            oldTaken[i] = true;
            newTaken[j] = true;
            pairs.add(new Pair(i, j, false, 1.0));
        }

        if (options.rowMatching()) {
            List<Pair> candidates = new ArrayList<>();
            for (int i = 0; i < oldRows.size(); i++) {
                if (oldTaken[i]) continue;
                int lo = Math.max(0, i - options.proximityWindow());
                int hi = Math.min(newRows.size() - 1, i + options.proximityWindow());
                for (int j = lo; j <= hi; j++) {
                    if (newTaken[j]) continue;
                    double s = similarity(oldRows.get(i), newRows.get(j));
                    if (s >= options.minSimilarity() && s > 0) candidates.add(new Pair(i, j, true, s));
                }
            }
            candidates.sort(Comparator.comparingDouble(Pair::similarity).reversed()
                    .thenComparingInt(p -> Math.abs(p.oldIndex() - p.newIndex()))
                    .thenComparingInt(p -> p.oldIndex() + p.newIndex()));
            for (Pair p : candidates) {
                if (oldTaken[p.oldIndex()] || newTaken[p.newIndex()]) continue;
                oldTaken[p.oldIndex()] = true;
                newTaken[p.newIndex()] = true;
                pairs.add(p);
            }
        }

        pairs.sort(Comparator.comparingInt(Pair::oldIndex));
        List<Integer> unmatchedOld = new ArrayList<>();
        for (int i = 0; i < oldTaken.length; i++) if (!oldTaken[i]) unmatchedOld.add(i);
        List<Integer> unmatchedNew = new ArrayList<>();
        for (int j = 0; j < newTaken.length; j++) if (!newTaken[j]) unmatchedNew.add(j);
        return new Outcome(pairs, unmatchedOld, unmatchedNew);
    }

    /**
     * Marks the pairs (sorted by old index) that lie on one longest chain with increasing new index.
     * Pairs off the chain changed relative order.
     */
    static boolean[] inOrder(List<Pair> pairsByOld) {
        int n = pairsByOld.size();
        int[] tails = new int[n];
        int[] prev = new int[n];
        int len = 0;
        for (int i = 0; i < n; i++) {
            int val = pairsByOld.get(i).newIndex();
            int lo = 0;
            int hi = len;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (pairsByOld.get(tails[mid]).newIndex() < val) lo = mid + 1;
                else hi = mid;
            }
            prev[i] = lo > 0 ? tails[lo - 1] : -1;
            tails[lo] = i;
            if (lo == len) len++;
        }
        boolean[] on = new boolean[n];
        Arrays.fill(on, false);
        int k = len > 0 ? tails[len - 1] : -1;
        while (k >= 0) {
            on[k] = true;
            k = prev[k];
        }
        return on;
    }

    private static String join(Map<String, String> row, List<String> columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append('|');
            String v = row.get(columns.get(i));
            sb.append(v == null ? "" : v);
        }
        return sb.toString();
    }
}
