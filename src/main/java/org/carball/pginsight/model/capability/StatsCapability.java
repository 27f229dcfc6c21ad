package org.carball.pginsight.model.capability;

/**
 * Which pg_stat_statements relation and column families the target server offers.
 * Resolved once per run; SQL builders branch only on these flags.
 */
public record StatsCapability(
        boolean available,
        String schema,
        boolean modernTimeColumns,
        boolean ioTimeColumns,
        boolean blockColumns
) {

    public StatsCapability {
        schema = schema == null ? "" : schema;
    }

    public static StatsCapability unavailable() {
        return new StatsCapability(false, "", false, false, false);
    }

    public boolean hasSchema() {
        return !schema.isEmpty();
    }

    public TimeColumns preferredTimeColumns() {
        return modernTimeColumns ? TimeColumns.MODERN : TimeColumns.LEGACY;
    }
}
