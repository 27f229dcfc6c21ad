package org.carball.pginsight.model.snapshot;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class IndexStat {
    private String database;
    private String schema;
    private String table;
    private String name;
    private long scans;
    private long sizeBytes;
    private String definition;
}
