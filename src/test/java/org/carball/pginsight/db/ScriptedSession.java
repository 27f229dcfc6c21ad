package org.carball.pginsight.db;

import org.carball.pginsight.exception.QueryFailedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory {@link DatabaseSession} for tests. Statements are matched against scripted
 * fragments in registration order; unmatched queries return no rows and unmatched
 * commands succeed. Every statement issued is recorded.
 */
public class ScriptedSession implements DatabaseSession {

    private final String database;
    private final List<Rule> rules = new ArrayList<>();
    private final List<String> issued = new ArrayList<>();
    private final List<Duration> timeouts = new ArrayList<>();
    private boolean closed;

    public ScriptedSession() {
        this("appdb");
    }

    public ScriptedSession(String database) {
        this.database = database;
    }

    public ScriptedSession onQuery(String fragment, Row... rows) {
        rules.add(new Rule(fragment, Arrays.asList(rows), false));
        return this;
    }

    public ScriptedSession onQuery(String fragment, List<Row> rows) {
        rules.add(new Rule(fragment, rows, false));
        return this;
    }

    public ScriptedSession failOn(String fragment) {
        rules.add(new Rule(fragment, List.of(), true));
        return this;
    }

    @Override
    public List<Row> query(String sql, Duration timeout) throws QueryFailedException {
        return respond(sql, timeout);
    }

    @Override
    public void execute(String sql, Duration timeout) throws QueryFailedException {
        respond(sql, timeout);
    }

    @Override
    public String databaseName() {
        return database;
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> issued() {
        return issued;
    }

    public List<Duration> timeouts() {
        return timeouts;
    }

    public long countIssued(String fragment) {
        return issued.stream().filter(sql -> sql.contains(fragment)).count();
    }

    public boolean isClosed() {
        return closed;
    }

    private List<Row> respond(String sql, Duration timeout) throws QueryFailedException {
        issued.add(sql);
        timeouts.add(timeout);
        for (Rule rule : rules) {
            if (sql.contains(rule.fragment)) {
                if (rule.fail) {
                    throw new QueryFailedException(sql, "scripted failure");
                }
                return rule.rows;
            }
        }
        return List.of();
    }

    private static final class Rule {
        private final String fragment;
        private final List<Row> rows;
        private final boolean fail;

        private Rule(String fragment, List<Row> rows, boolean fail) {
            this.fragment = fragment;
            this.rows = rows;
            this.fail = fail;
        }
    }
}
