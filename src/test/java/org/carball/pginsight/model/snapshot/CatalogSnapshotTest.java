package org.carball.pginsight.model.snapshot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class CatalogSnapshotTest {

    @Test
    void shouldFindTablesByPlainOrQualifiedName() {
        // Given
        CatalogSnapshot catalog = new CatalogSnapshot();
        catalog.addTable(TableStat.builder().schema("public").name("Orders").liveRows(10).build());
        catalog.addTable(TableStat.builder().schema("audit").name("events").liveRows(20).build());

        // Then
        assertThat(catalog.findTable("orders")).isPresent();
        assertThat(catalog.findTable("\"public\".\"Orders\"")).isPresent();
        assertThat(catalog.findTable("audit.orders")).isEmpty();
        assertThat(catalog.findTable("audit.events").orElseThrow().getLiveRows()).isEqualTo(20);
    }

    @Test
    void shouldMatchIndexesOnTableAndSchema() {
        // Given
        CatalogSnapshot catalog = new CatalogSnapshot();
        catalog.addIndex(IndexStat.builder().schema("public").table("orders").name("orders_pkey").build());

        // Then
        assertThat(catalog.hasAnyIndex("orders")).isTrue();
        assertThat(catalog.hasAnyIndex("public.orders")).isTrue();
        assertThat(catalog.hasAnyIndex("audit.orders")).isFalse();
        assertThat(catalog.hasAnyIndex("events")).isFalse();
    }
}
