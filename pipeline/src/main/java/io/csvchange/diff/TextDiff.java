package io.csvchange.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Myers line diff and unified patch rendering.
 * <p>
 * Common leading and trailing lines are stripped before the search. When the remaining edit distance exceeds
 * {@link #MAX_EDIT_DISTANCE} the middle block is reported as one replacement, which keeps memory bounded.
 */
public final class TextDiff {
    public static final int MAX_EDIT_DISTANCE = 2000;
    public static final int DEFAULT_CONTEXT = 3;

    public enum Op { EQUAL, DELETE, INSERT }

    /** {@code oldLine}/{@code newLine} are 0-based and -1 where the line does not exist on that side. */
    public record Edit(Op op, String text, int oldLine, int newLine) {}

    private TextDiff() {}

    /** Splits on LF, dropping a trailing CR per line and the empty string after a final newline. */
    public static List<String> lines(String text) {
        if (text.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                out.add(stripCr(text.substring(start, i)));
                start = i + 1;
            }
        }
        if (start < text.length()) out.add(stripCr(text.substring(start)));
        return out;
    }

    private static String stripCr(String s) {
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }

    public static List<Edit> diff(List<String> a, List<String> b) {
        int n = a.size();
        int m = b.size();
        int prefix = 0;
        while (prefix < n && prefix < m && a.get(prefix).equals(b.get(prefix))) prefix++;
        int suffix = 0;
        while (suffix < n - prefix && suffix < m - prefix && a.get(n - 1 - suffix).equals(b.get(m - 1 - suffix))) suffix++;

        List<Op> ops = new ArrayList<>(n + m);
        for (int i = 0; i < prefix; i++) ops.add(Op.EQUAL);
        ops.addAll(middle(a.subList(prefix, n - suffix), b.subList(prefix, m - suffix)));
        for (int i = 0; i < suffix; i++) ops.add(Op.EQUAL);

        List<Edit> edits = new ArrayList<>(ops.size());
        int x = 0;
        int y = 0;
        for (Op op : ops) {
            switch (op) {
                case EQUAL -> edits.add(new Edit(op, a.get(x), x++, y++));
                case DELETE -> edits.add(new Edit(op, a.get(x), x++, -1));
                case INSERT -> edits.add(new Edit(op, b.get(y), -1, y++));
            }
        }
        return edits;
    }

    private static List<Op> middle(List<String> a, List<String> b) {
        int n = a.size();
        int m = b.size();
        if (n == 0 || m == 0) return replace(n, m);
        int max = n + m;
        int off = max;
        int[] v = new int[2 * max + 2];
        List<int[]> trace = new ArrayList<>();
        for (int d = 0; d <= max; d++) {
            if (d > MAX_EDIT_DISTANCE) return replace(n, m);
            int[] snap = new int[2 * d + 1];
            System.arraycopy(v, off - d, snap, 0, 2 * d + 1);
            trace.add(snap);
            for (int k = -d; k <= d; k += 2) {
                int x = (k == -d || (k != d && v[off + k - 1] < v[off + k + 1])) ? v[off + k + 1] : v[off + k - 1] + 1;
                int y = x - k;
                while (x < n && y < m && a.get(x).equals(b.get(y))) {
                    x++;
                    y++;
                }
                v[off + k] = x;
                if (x >= n && y >= m) return backtrack(trace, n, m);
            }
        }
        return replace(n, m);
    }

    private static List<Op> backtrack(List<int[]> trace, int n, int m) {
        List<Op> out = new ArrayList<>();
        int x = n;
        int y = m;
        for (int d = trace.size() - 1; d >= 0; d--) {
            int k = x - y;
            int prevX;
            int prevY;
            if (d == 0) {
                prevX = 0;
                prevY = 0;
            } else {
                int[] v = trace.get(d);
                int prevK = (k == -d || (k != d && v[k - 1 + d] < v[k + 1 + d])) ? k + 1 : k - 1;
                prevX = v[prevK + d];
                prevY = prevX - prevK;
            }
            while (x > prevX && y > prevY) {
                out.add(Op.EQUAL);
                x--;
                y--;
            }
            if (d > 0) {
                if (x == prevX) out.add(Op.INSERT);
                else out.add(Op.DELETE);
            }
            x = prevX;
            y = prevY;
        }
        Collections.reverse(out);
        return out;
    }

    private static List<Op> replace(int n, int m) {
        List<Op> out = new ArrayList<>(n + m);
        for (int i = 0; i < n; i++) out.add(Op.DELETE);
        for (int i = 0; i < m; i++) out.add(Op.INSERT);
        return out;
    }

    public static int count(List<Edit> edits, Op op) {
        int c = 0;
        for (Edit e : edits) if (e.op() == op) c++;
        return c;
    }

    /** Unified patch with {@code context} lines around each change; empty string when nothing changed. */
    public static String unified(String oldName, String newName, List<Edit> edits, int context) {
        List<Integer> changes = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) if (edits.get(i).op() != Op.EQUAL) changes.add(i);
        if (changes.isEmpty()) return "";

        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(oldName).append('\n');
        sb.append("+++ ").append(newName).append('\n');
        int c = 0;
        while (c < changes.size()) {
            int from = Math.max(0, changes.get(c) - context);
            int last = changes.get(c);
            while (c + 1 < changes.size() && changes.get(c + 1) - last <= 2 * context) {
                last = changes.get(++c);
            }
            int to = Math.min(edits.size() - 1, last + context);
            c++;
            appendHunk(sb, edits, from, to);
        }
        return sb.toString();
    }

    private static void appendHunk(StringBuilder sb, List<Edit> edits, int from, int to) {
        int oldCount = 0;
        int newCount = 0;
        int oldStart = -1;
        int newStart = -1;
        for (int i = from; i <= to; i++) {
            Edit e = edits.get(i);
            if (e.oldLine() >= 0) {
                if (oldStart < 0) oldStart = e.oldLine();
                oldCount++;
            }
            if (e.newLine() >= 0) {
                if (newStart < 0) newStart = e.newLine();
                newCount++;
            }
        }
        sb.append("@@ -").append(range(oldStart, oldCount, precedingLine(edits, from, true)))
                .append(" +").append(range(newStart, newCount, precedingLine(edits, from, false)))
                .append(" @@\n");
        for (int i = from; i <= to; i++) {
            Edit e = edits.get(i);
            char marker = e.op() == Op.EQUAL ? ' ' : e.op() == Op.DELETE ? '-' : '+';
            sb.append(marker).append(e.text()).append('\n');
        }
    }

    private static int precedingLine(List<Edit> edits, int from, boolean old) {
        for (int i = from - 1; i >= 0; i--) {
            int l = old ? edits.get(i).oldLine() : edits.get(i).newLine();
            if (l >= 0) return l + 1;
        }
        return 0;
    }

    private static String range(int start, int count, int whenEmpty) {
        if (count == 0) return whenEmpty + ",0";
        return (start + 1) + "," + count;
    }
}
