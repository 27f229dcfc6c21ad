package org.carball.pginsight.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.config.InsightConfig;
import org.carball.pginsight.config.InsightThresholds;
import org.carball.pginsight.db.ConnectionUrls;
import org.carball.pginsight.db.DatabaseSession;
import org.carball.pginsight.db.JdbcDatabaseSession;
import org.carball.pginsight.db.Row;
import org.carball.pginsight.db.RunDeadline;
import org.carball.pginsight.db.SessionFactory;
import org.carball.pginsight.exception.CollectionException;
import org.carball.pginsight.exception.QueryFailedException;
import org.carball.pginsight.explain.AdviceSynthesizer;
import org.carball.pginsight.explain.ExplainBudgeter;
import org.carball.pginsight.explain.StatementInsightPipeline;
import org.carball.pginsight.explain.TextPlanSignalExtractor;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.collection.CollectionSnapshot;
import org.carball.pginsight.model.statement.RankedStatements;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs one collection against the target server: server info, capability, catalog snapshot
 * of the primary and any extra databases, then the statement pipeline. Only a failed primary
 * connection aborts the run.
 */
@Slf4j
public class InsightCollector {

    static final Duration SERVER_INFO_TIMEOUT = Duration.ofSeconds(5);
    static final String SERVER_INFO =
            "select version() as version, current_database() as database, current_user as username";

    private final InsightConfig config;
    private final SessionFactory sessionFactory;
    private final CapabilityProber prober;
    private final CatalogSnapshotCollector catalogCollector;
    private final StatsWindowResolver windowResolver;
    private final StatementInsightPipeline pipeline;
    private final Clock clock;

    public InsightCollector(InsightConfig config) {
        this(config, JdbcDatabaseSession::open, Clock.systemUTC());
    }

    public InsightCollector(InsightConfig config, SessionFactory sessionFactory, Clock clock) {
        this(config, sessionFactory, new CapabilityProber(), new CatalogSnapshotCollector(),
                new StatsWindowResolver(clock), pipelineFor(config.getThresholds()), clock);
    }

    InsightCollector(InsightConfig config, SessionFactory sessionFactory, CapabilityProber prober,
                     CatalogSnapshotCollector catalogCollector, StatsWindowResolver windowResolver,
                     StatementInsightPipeline pipeline, Clock clock) {
        this.config = config;
        this.sessionFactory = sessionFactory;
        this.prober = prober;
        this.catalogCollector = catalogCollector;
        this.windowResolver = windowResolver;
        this.pipeline = pipeline;
        this.clock = clock;
    }

    static StatementInsightPipeline pipelineFor(InsightThresholds thresholds) {
        return new StatementInsightPipeline(
                new StatementRanker(new RankingQueryBuilder(), thresholds.getRankedListLimit()),
                new ExplainBudgeter(thresholds.effectiveExplainCap()),
                new TextPlanSignalExtractor(),
                new AdviceSynthesizer());
    }

    public CollectionSnapshot collect() {
        Instant started = clock.instant();
        RunDeadline deadline = RunDeadline.after(config.getTimeout(), clock);
        CollectionSnapshot snapshot = new CollectionSnapshot();
        snapshot.setStartedAt(started);

        DatabaseSession session;
        try {
            session = sessionFactory.open(config.getUrl(), deadline);
        } catch (SQLException e) {
            throw new CollectionException("connect", e);
        }

        try (session) {
            readServerInfo(session, snapshot);

            StatsCapability capability = prober.probe(session);
            snapshot.setCapability(capability);

            catalogCollector.collect(session, snapshot.getCatalog(), true).forEach(snapshot::addError);
            collectExtraDatabases(snapshot, deadline);

            StatsWindow window = capability.available()
                    ? windowResolver.resolve(session, capability, config.getStatsSince())
                    : StatsWindow.unknown();
            RankedStatements statements = pipeline.run(session, capability, snapshot.getCatalog(), window);
            snapshot.setStatements(statements);
        }

        snapshot.setDuration(Duration.between(started, clock.instant()));
        log.info("Collection finished in {} ms with {} non-fatal errors",
                snapshot.getDuration().toMillis(), snapshot.getErrors().size());
        return snapshot;
    }

    private void readServerInfo(DatabaseSession session, CollectionSnapshot snapshot) {
        try {
            List<Row> rows = session.query(SERVER_INFO, SERVER_INFO_TIMEOUT);
            if (!rows.isEmpty()) {
                Row row = rows.get(0);
                snapshot.setServerVersion(row.getString("version"));
                snapshot.setDatabase(row.getString("database"));
                snapshot.setUser(row.getString("username"));
            }
        } catch (QueryFailedException e) {
            log.debug("Server info unavailable: {}", e.getMessage());
            snapshot.addError("server info: " + e.getMessage());
        }
        if (snapshot.getDatabase() == null) {
            snapshot.setDatabase(session.databaseName());
        }
    }

    private void collectExtraDatabases(CollectionSnapshot snapshot, RunDeadline deadline) {
        for (String database : config.getDatabases()) {
            if (database == null || database.isBlank() || database.equals(snapshot.getDatabase())) {
                continue;
            }
            if (deadline.isExpired()) {
                snapshot.addError(String.format("db '%s': run deadline exceeded", database));
                continue;
            }
            try (DatabaseSession extra = sessionFactory.open(ConnectionUrls.withDatabase(config.getUrl(), database), deadline)) {
                catalogCollector.collect(extra, snapshot.getCatalog(), false).forEach(snapshot::addError);
            } catch (SQLException | IllegalArgumentException e) {
                log.debug("Could not connect to database '{}': {}", database, e.getMessage());
                snapshot.addError(String.format("db '%s': %s", database, e.getMessage()));
            }
        }
    }
}
