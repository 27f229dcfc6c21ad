package org.carball.pginsight.explain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scans text-format EXPLAIN output line by line for known node markers.
 */
public class TextPlanSignalExtractor implements PlanSignalExtractor {

    private static final String SEQ_SCAN_ON = "SEQ SCAN ON ";
    private static final Pattern HASH_JOIN = Pattern.compile(" HASH (\\w+ )?JOIN ");
    private static final Pattern MERGE_JOIN = Pattern.compile(" MERGE (\\w+ )?JOIN ");

    @Override
    public PlanSignals extract(List<String> planLines) {
        Set<String> seqTables = new LinkedHashSet<>();
        boolean sort = false;
        boolean bitmap = false;
        JoinKind join = null;
        boolean parallel = false;
        boolean cte = false;

        for (String line : planLines) {
            if (line == null) {
                continue;
            }
            String upper = line.toUpperCase(Locale.ROOT);
            // padded so markers at the start or end of a line match the same way
            String padded = " " + upper.replace('\t', ' ') + " ";

            int seqIndex = upper.indexOf(SEQ_SCAN_ON);
            if (seqIndex >= 0) {
                String table = tableName(line.substring(seqIndex + SEQ_SCAN_ON.length()));
                if (!table.isEmpty()) {
                    seqTables.add(table);
                }
            }
            if (upper.trim().startsWith("SORT ") || padded.contains(" SORT ")) {
                sort = true;
            }
            if (upper.contains("BITMAP ")) {
                bitmap = true;
            }

            JoinKind lineJoin = joinKind(padded);
            if (lineJoin != null && (lineJoin.isSpecific() || join == null)) {
                join = lineJoin;
            }

            if (upper.contains("PARALLEL ") || upper.contains("GATHER")) {
                parallel = true;
            }
            if (upper.contains("CTE ") || upper.contains("WITH ")) {
                cte = true;
            }
        }

        return new PlanSignals(new ArrayList<>(seqTables), sort, bitmap, join, parallel, cte);
    }

    static JoinKind joinKind(String paddedUpper) {
        if (paddedUpper.contains(" NESTED LOOP ")) {
            return JoinKind.NESTED_LOOP;
        }
        if (HASH_JOIN.matcher(paddedUpper).find()) {
            return JoinKind.HASH_JOIN;
        }
        if (MERGE_JOIN.matcher(paddedUpper).find()) {
            return JoinKind.MERGE_JOIN;
        }
        if (paddedUpper.contains(" JOIN ")) {
            return JoinKind.GENERIC;
        }
        return null;
    }

    static String tableName(String rest) {
        String trimmed = rest.trim();
        int end = 0;
        while (end < trimmed.length()) {
            char c = trimmed.charAt(end);
            if (Character.isWhitespace(c) || c == '(') {
                break;
            }
            end++;
        }
        return trimmed.substring(0, end).replace("\"", "");
    }
}
