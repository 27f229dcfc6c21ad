package org.carball.pginsight.model.snapshot;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TableStat {
    private String database;
    private String schema;
    private String name;
    private long seqScans;
    private long idxScans;
    private long liveRows;
    private long deadRows;
    private long sizeBytes;

    public String qualifiedName() {
        return schema + "." + name;
    }
}
