package org.carball.pginsight.explain;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.db.Row;
import org.carball.pginsight.exception.QueryFailedException;
import org.carball.pginsight.model.collection.CollectionResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects estimated plans without executing the statement. Parameterized statements go
 * through PREPARE / EXPLAIN EXECUTE / DEALLOCATE, falling back to a NULL-substituted EXPLAIN
 * when the statement cannot be prepared. ANALYZE is never used.
 */
@Slf4j
public class SafePlanExecutor {

    static final Duration PREPARE_TIMEOUT = Duration.ofSeconds(3);
    static final Duration EXPLAIN_TIMEOUT = Duration.ofSeconds(5);
    static final Duration DEALLOCATE_TIMEOUT = Duration.ofSeconds(1);
    static final String PREPARED_NAME_PREFIX = "__pginsight_prep_";
    // PostgreSQL accepts at most this many bind parameters per statement
    static final int MAX_PARAMETERS = 65535;

    private static final Pattern PARAMETER = Pattern.compile("\\$(\\d+)");

    private final DatabaseSession session;

    public SafePlanExecutor(DatabaseSession session) {
        this.session = session;
    }

    /**
     * @param query   statement text as captured by pg_stat_statements
     * @param ordinal position of the statement in its list, used to name the prepared statement
     * @return the plan lines, or the failure that stopped collection
     */
    public CollectionResult<List<String>> collect(String query, int ordinal) {
        String text = stripTrailingSemicolons(query);
        if (text.isEmpty()) {
            return CollectionResult.skipped("empty statement");
        }
        int maxParameter = highestParameter(text);
        if (maxParameter == 0) {
            return explain("EXPLAIN " + text);
        }
        if (maxParameter > MAX_PARAMETERS) {
            log.debug("Parameter marker ${} is out of range, explaining with NULL substitution", maxParameter);
            return explain(nullSubstituted(text));
        }

        String name = PREPARED_NAME_PREFIX + ordinal;
        try {
            if (prepare(name, text)) {
                return explain("EXPLAIN EXECUTE " + name + nullArguments(maxParameter));
            }
            return explain(nullSubstituted(text));
        } finally {
            deallocate(name);
        }
    }

    private boolean prepare(String name, String text) {
        try {
            session.execute("PREPARE " + name + " AS " + text, PREPARE_TIMEOUT);
            return true;
        } catch (QueryFailedException e) {
            log.debug("PREPARE failed, falling back to NULL substitution: {}", e.getMessage());
            return false;
        }
    }

    private CollectionResult<List<String>> explain(String sql) {
        try {
            List<String> lines = new ArrayList<>();
            for (Row row : session.query(sql, EXPLAIN_TIMEOUT)) {
                Object line = row.first();
                if (line != null) {
                    lines.add(line.toString());
                }
            }
            return CollectionResult.collected(lines);
        } catch (QueryFailedException e) {
            log.debug("Plan collection failed: {}", e.getMessage());
            return CollectionResult.failed(e);
        }
    }

    private void deallocate(String name) {
        try {
            session.execute("DEALLOCATE " + name, DEALLOCATE_TIMEOUT);
        } catch (QueryFailedException e) {
            log.debug("DEALLOCATE {} failed: {}", name, e.getMessage());
        }
    }

    /**
     * Highest {@code $n} marker in the text; markers too long to fit an int count as {@link Integer#MAX_VALUE}.
     */
    static int highestParameter(String text) {
        int max = 0;
        Matcher matcher = PARAMETER.matcher(text);
        while (matcher.find()) {
            String digits = matcher.group(1);
            int value = digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
            max = Math.max(max, value);
        }
        return max;
    }

    private static String nullSubstituted(String text) {
        return "EXPLAIN " + PARAMETER.matcher(text).replaceAll("NULL");
    }

    static String nullArguments(int count) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (int i = 0; i < count; i++) {
            joiner.add("NULL");
        }
        return joiner.toString();
    }

    private static String stripTrailingSemicolons(String query) {
        String text = query == null ? "" : query.trim();
        while (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        return text;
    }
}
