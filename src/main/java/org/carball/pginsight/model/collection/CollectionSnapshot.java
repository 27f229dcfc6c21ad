package org.carball.pginsight.model.collection;

import lombok.Data;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.snapshot.CatalogSnapshot;
import org.carball.pginsight.model.statement.RankedStatements;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything gathered from the target server in one run.
 */
@Data
public class CollectionSnapshot {
    private String serverVersion;
    private String database;
    private String user;
    private StatsCapability capability = StatsCapability.unavailable();
    private CatalogSnapshot catalog = new CatalogSnapshot();
    private RankedStatements statements = RankedStatements.empty();
    private List<String> errors = new ArrayList<>();
    private Instant startedAt;
    private Duration duration;

    public void addError(String error) {
        errors.add(error);
    }
}
