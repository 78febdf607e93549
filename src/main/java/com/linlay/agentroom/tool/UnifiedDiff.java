package com.linlay.agentroom.tool;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-based unified diff ({@code --- a/path}, {@code +++ b/path}, {@code @@} hunks with three
 * lines of context).
 */
public final class UnifiedDiff {

    static final int CONTEXT_LINES = 3;
    // above this many LCS cells the whole file is reported as replaced
    private static final long MAX_TABLE_CELLS = 4_000_000L;

    private final List<Edit> edits;

    private UnifiedDiff(List<Edit> edits) {
        this.edits = edits;
    }

    public static UnifiedDiff between(String oldContent, String newContent) {
        return new UnifiedDiff(computeEdits(lines(oldContent), lines(newContent)));
    }

    public int addedLines() {
        return (int) edits.stream().filter(edit -> edit.type == '+').count();
    }

    public int removedLines() {
        return (int) edits.stream().filter(edit -> edit.type == '-').count();
    }

    public boolean isEmpty() {
        return edits.stream().allMatch(edit -> edit.type == ' ');
    }

    /**
     * @return the formatted diff, or an empty string when nothing changed
     */
    public String format(String path) {
        if (isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        out.append("--- a/").append(path).append('\n');
        out.append("+++ b/").append(path).append('\n');

        for (int[] hunk : hunkRanges()) {
            int from = hunk[0];
            int to = hunk[1];
            Edit first = edits.get(from);
            int oldCount = 0;
            int newCount = 0;
            for (int i = from; i < to; i++) {
                char type = edits.get(i).type;
                if (type != '+') {
                    oldCount++;
                }
                if (type != '-') {
                    newCount++;
                }
            }
            out.append("@@ -").append(range(first.oldIndex, oldCount))
                    .append(" +").append(range(first.newIndex, newCount))
                    .append(" @@\n");
            for (int i = from; i < to; i++) {
                Edit edit = edits.get(i);
                out.append(edit.type).append(edit.line).append('\n');
            }
        }
        return out.toString();
    }

    private List<int[]> hunkRanges() {
        List<int[]> ranges = new ArrayList<>();
        int i = 0;
        while (i < edits.size()) {
            if (edits.get(i).type == ' ') {
                i++;
                continue;
            }
            int start = Math.max(0, i - CONTEXT_LINES);
            int end = i;
            int unchangedRun = 0;
            int j = i;
            while (j < edits.size()) {
                if (edits.get(j).type == ' ') {
                    unchangedRun++;
                    if (unchangedRun > 2 * CONTEXT_LINES) {
                        break;
                    }
                } else {
                    unchangedRun = 0;
                    end = j;
                }
                j++;
            }
            int stop = Math.min(edits.size(), end + 1 + CONTEXT_LINES);
            ranges.add(new int[]{start, stop});
            i = stop;
        }
        return ranges;
    }

    private static String range(int startIndex, int count) {
        int beginning = startIndex + 1;
        if (count == 1) {
            return String.valueOf(beginning);
        }
        if (count == 0) {
            beginning -= 1;
        }
        return beginning + "," + count;
    }

    private static List<Edit> computeEdits(List<String> a, List<String> b) {
        int n = a.size();
        int m = b.size();
        List<Edit> result = new ArrayList<>();

        int prefix = 0;
        while (prefix < n && prefix < m && a.get(prefix).equals(b.get(prefix))) {
            result.add(new Edit(' ', a.get(prefix), prefix, prefix));
            prefix++;
        }
        int suffix = 0;
        while (suffix < n - prefix && suffix < m - prefix
                && a.get(n - 1 - suffix).equals(b.get(m - 1 - suffix))) {
            suffix++;
        }

        int rows = n - prefix - suffix;
        int cols = m - prefix - suffix;
        if ((long) rows * cols > MAX_TABLE_CELLS) {
            for (int i = 0; i < rows; i++) {
                result.add(new Edit('-', a.get(prefix + i), prefix + i, prefix));
            }
            for (int j = 0; j < cols; j++) {
                result.add(new Edit('+', b.get(prefix + j), prefix + rows, prefix + j));
            }
        } else {
            int[][] lcs = new int[rows + 1][cols + 1];
            for (int i = rows - 1; i >= 0; i--) {
                for (int j = cols - 1; j >= 0; j--) {
                    lcs[i][j] = a.get(prefix + i).equals(b.get(prefix + j))
                            ? lcs[i + 1][j + 1] + 1
                            : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
            int i = 0;
            int j = 0;
            while (i < rows || j < cols) {
                int oldIndex = prefix + i;
                int newIndex = prefix + j;
                if (i < rows && j < cols && a.get(oldIndex).equals(b.get(newIndex))) {
                    result.add(new Edit(' ', a.get(oldIndex), oldIndex, newIndex));
                    i++;
                    j++;
                } else if (j < cols && (i == rows || lcs[i][j + 1] > lcs[i + 1][j])) {
                    result.add(new Edit('+', b.get(newIndex), oldIndex, newIndex));
                    j++;
                } else {
                    result.add(new Edit('-', a.get(oldIndex), oldIndex, newIndex));
                    i++;
                }
            }
        }

        for (int k = suffix; k > 0; k--) {
            result.add(new Edit(' ', a.get(n - k), n - k, m - k));
        }
        return result;
    }

    private static List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        String[] split = content.split("\n", -1);
        int count = content.endsWith("\n") ? split.length - 1 : split.length;
        List<String> lines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            lines.add(split[i]);
        }
        return lines;
    }

    private record Edit(char type, String line, int oldIndex, int newIndex) {
    }
}
