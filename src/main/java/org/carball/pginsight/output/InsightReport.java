package org.carball.pginsight.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pginsight.config.ConfigurationLoader;
import org.carball.pginsight.config.Durations;
import org.carball.pginsight.config.OutputFormat;
import org.carball.pginsight.model.capability.StatsCapability;
import org.carball.pginsight.model.collection.CollectionSnapshot;
import org.carball.pginsight.model.finding.Analysis;
import org.carball.pginsight.model.finding.Finding;
import org.carball.pginsight.model.statement.PlanAdvice;
import org.carball.pginsight.model.statement.RankedStatements;
import org.carball.pginsight.model.statement.RankingOrder;
import org.carball.pginsight.model.statement.Statement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class InsightReport {

    public static final String VERSION = "1.0.0";
    private static final DateTimeFormatter TS_PLACEHOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmm");
    private static final int QUERY_PREVIEW_LENGTH = 80;

    private final CollectionSnapshot snapshot;
    private final Analysis analysis;
    private final Instant timestamp;
    private final ObjectMapper objectMapper;

    public InsightReport(CollectionSnapshot snapshot, Analysis analysis) {
        this(snapshot, analysis, Instant.now());
    }

    public InsightReport(CollectionSnapshot snapshot, Analysis analysis, Instant timestamp) {
        this.snapshot = snapshot;
        this.analysis = analysis;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (IOException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# PostgreSQL Insight Report\n\n");
        md.append("**Generated:** ").append(timestamp).append("  \n");
        md.append("**pg-insight Version:** ").append(VERSION).append("  \n\n");

        md.append("## Server\n\n");
        md.append("| Property | Value |\n");
        md.append("|----------|-------|\n");
        md.append("| Version | ").append(orDash(snapshot.getServerVersion())).append(" |\n");
        md.append("| Database | ").append(orDash(snapshot.getDatabase())).append(" |\n");
        md.append("| User | ").append(orDash(snapshot.getUser())).append(" |\n");
        md.append("| pg_stat_statements | ").append(describe(snapshot.getCapability())).append(" |\n");
        md.append("| Tables in snapshot | ").append(snapshot.getCatalog().getTables().size()).append(" |\n");
        md.append("| Indexes in snapshot | ").append(snapshot.getCatalog().getIndexes().size()).append(" |\n");
        if (snapshot.getDuration() != null) {
            md.append("| Collection time | ").append(snapshot.getDuration().toMillis()).append(" ms |\n");
        }
        md.append("\n");

        appendFindings(md, "Recommendations", analysis.getRecommendations());
        appendFindings(md, "Warnings", analysis.getWarnings());
        appendFindings(md, "Information", analysis.getInfos());

        appendStatements(md, snapshot.getStatements());
        return md.toString();
    }

    /**
     * Writes the report in the requested format(s).
     *
     * @return the files written
     */
    public List<Path> write(OutputFormat format, String outputFile) throws IOException {
        String resolved = resolveOutputPath(outputFile, timestamp);
        String baseFileName = ConfigurationLoader.removeFileExtension(resolved);
        List<Path> written = new ArrayList<>();

        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            Path jsonFile = Paths.get(format == OutputFormat.BOTH ? baseFileName + ".json" : resolved);
            Files.writeString(jsonFile, toJson());
            written.add(jsonFile);
        }
        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            Path markdownFile = Paths.get(format == OutputFormat.BOTH ? baseFileName + ".md" : resolved);
            Files.writeString(markdownFile, toMarkdown());
            written.add(markdownFile);
        }
        log.debug("Report written to {}", written);
        return written;
    }

    /**
     * Expands the {@code {ts}} placeholder with the local time as {@code yyyy-MM-dd_HHmm}.
     */
    public static String resolveOutputPath(String path, Instant timestamp) {
        return path.replace("{ts}", TS_PLACEHOLDER_FORMAT.format(timestamp.atZone(ZoneId.systemDefault())));
    }

    private void appendFindings(StringBuilder md, String heading, List<Finding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        md.append("## ").append(heading).append("\n\n");
        for (Finding finding : findings) {
            md.append("### ").append(finding.getSeverity().getIcon()).append(" ").append(finding.getTitle());
            if (finding.getCode() != null) {
                md.append(" (`").append(finding.getCode()).append("`)");
            }
            md.append("\n\n");
            if (finding.getDescription() != null) {
                md.append(finding.getDescription()).append("\n\n");
            }
            if (finding.getAction() != null) {
                md.append("**Action:** ").append(finding.getAction()).append("\n\n");
            }
        }
    }

    private void appendStatements(StringBuilder md, RankedStatements statements) {
        md.append("## Top Statements\n\n");
        if (!statements.isAvailable()) {
            md.append(statements.getSkippedReason() != null
                    ? statements.getSkippedReason()
                    : "No statement statistics were collected.").append("\n\n");
            return;
        }
        if (statements.getStatsResetTime() != null) {
            md.append("Statistics since ").append(statements.getStatsResetTime())
                    .append(" (").append(Durations.format(Duration.ofSeconds(statements.getStatsWindowAge().getSeconds())))
                    .append(").\n\n");
        }

        for (RankingOrder order : RankingOrder.values()) {
            List<Statement> list = statements.list(order);
            if (list.isEmpty()) {
                continue;
            }
            md.append("### ").append(order.getDisplayName()).append("\n\n");
            md.append("| # | Query | Calls | Total (ms) | Mean (ms) | Calls/hr | Attention |\n");
            md.append("|---|-------|-------|------------|-----------|----------|-----------|\n");
            int rank = 1;
            for (Statement statement : list) {
                md.append("| ").append(rank++)
                        .append(" | `").append(preview(statement.getQuery())).append("`")
                        .append(" | ").append(String.format("%,.0f", statement.getCalls()))
                        .append(" | ").append(String.format("%,.1f", statement.getTotalTime()))
                        .append(" | ").append(String.format("%,.2f", statement.getMeanTime()))
                        .append(" | ").append(String.format("%,.1f", statement.getCallsPerHour()))
                        .append(" | ").append(statement.isNeedsAttention() ? "⚠️" : "")
                        .append(" |\n");
            }
            md.append("\n");

            for (Statement statement : list) {
                if (statement.hasAdvice()) {
                    appendAdvice(md, statement);
                }
            }
        }
    }

    private void appendAdvice(StringBuilder md, Statement statement) {
        PlanAdvice advice = statement.getAdvice();
        md.append("#### Plan for `").append(preview(statement.getQuery())).append("`\n\n");
        if (!advice.getHighlights().isEmpty()) {
            md.append("**Highlights:** ").append(String.join(", ", advice.getHighlights())).append("\n\n");
        }
        for (String suggestion : advice.getSuggestions()) {
            md.append("- ").append(suggestion).append("\n");
        }
        if (!advice.getSuggestions().isEmpty()) {
            md.append("\n");
        }
        if (advice.getPlan() != null && !advice.getPlan().isEmpty()) {
            md.append("```\n").append(advice.getPlan()).append("\n```\n\n");
        }
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        ReportMetadata metadata = new ReportMetadata();
        metadata.setGeneratedAt(timestamp);
        metadata.setToolVersion(VERSION);
        metadata.setServerVersion(snapshot.getServerVersion());
        metadata.setDatabase(snapshot.getDatabase());
        metadata.setUser(snapshot.getUser());
        metadata.setCollectionMillis(snapshot.getDuration() == null ? null : snapshot.getDuration().toMillis());
        metadata.setTableCount(snapshot.getCatalog().getTables().size());
        metadata.setIndexCount(snapshot.getCatalog().getIndexes().size());

        data.setMetadata(metadata);
        data.setCapability(snapshot.getCapability());
        data.setAnalysis(analysis);
        data.setStatements(snapshot.getStatements());
        data.setErrors(snapshot.getErrors());
        return data;
    }

    private static String describe(StatsCapability capability) {
        if (!capability.available()) {
            return "not available";
        }
        return "available" + (capability.hasSchema() ? " (schema " + capability.schema() + ")" : "");
    }

    private static String preview(String query) {
        if (query == null) {
            return "";
        }
        String flattened = query.replaceAll("\\s+", " ").trim().replace("`", "'").replace("|", "\\|");
        return flattened.length() > QUERY_PREVIEW_LENGTH
                ? flattened.substring(0, QUERY_PREVIEW_LENGTH) + "..."
                : flattened;
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private StatsCapability capability;
        private Analysis analysis;
        private RankedStatements statements;
        private List<String> errors;
    }

    @lombok.Data
    private static class ReportMetadata {
        private Instant generatedAt;
        private String toolVersion;
        private String serverVersion;
        private String database;
        private String user;
        private Long collectionMillis;
        private int tableCount;
        private int indexCount;
    }
}
