package org.carball.pginsight.db;

import org.carball.pginsight.exception.QueryFailedException;

import java.time.Duration;
import java.util.List;

/**
 * A live connection to one database that runs parameterless SQL, each call under its own timeout.
 */
public interface DatabaseSession extends AutoCloseable {

    List<Row> query(String sql, Duration timeout) throws QueryFailedException;

    void execute(String sql, Duration timeout) throws QueryFailedException;

    String databaseName();

    @Override
    void close();
}
