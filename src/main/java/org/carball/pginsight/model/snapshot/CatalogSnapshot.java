package org.carball.pginsight.model.snapshot;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Table sizes and index inventory gathered from the catalog, used to size sequential-scan targets.
 */
@Data
public class CatalogSnapshot {
    private List<TableStat> tables = new ArrayList<>();
    private List<IndexStat> indexes = new ArrayList<>();

    public void addTable(TableStat table) {
        tables.add(table);
    }

    public void addIndex(IndexStat index) {
        indexes.add(index);
    }

    /**
     * Finds a table by name, ignoring case. A schema-qualified name also matches on schema.
     */
    public Optional<TableStat> findTable(String name) {
        RelationName relation = RelationName.parse(name);
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(relation.name()))
                .filter(t -> !relation.hasSchema() || relation.schema().equalsIgnoreCase(t.getSchema()))
                .findFirst();
    }

    public boolean hasAnyIndex(String tableName) {
        RelationName relation = RelationName.parse(tableName);
        return indexes.stream()
                .filter(i -> i.getTable().equalsIgnoreCase(relation.name()))
                .anyMatch(i -> !relation.hasSchema() || relation.schema().equalsIgnoreCase(i.getSchema()));
    }

    record RelationName(String schema, String name) {

        static RelationName parse(String raw) {
            String cleaned = raw.replace("\"", "").trim();
            int dot = cleaned.lastIndexOf('.');
            if (dot > 0 && dot < cleaned.length() - 1) {
                return new RelationName(cleaned.substring(0, dot), cleaned.substring(dot + 1));
            }
            return new RelationName("", cleaned);
        }

        boolean hasSchema() {
            return !schema.isEmpty();
        }
    }
}
