package org.carball.pginsight.db;

import java.sql.SQLException;

@FunctionalInterface
public interface SessionFactory {

    DatabaseSession open(String url, RunDeadline deadline) throws SQLException;
}
