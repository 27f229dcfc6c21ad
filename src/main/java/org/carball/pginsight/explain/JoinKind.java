package org.carball.pginsight.explain;

import lombok.Getter;

@Getter
public enum JoinKind {
    NESTED_LOOP("Nested Loop"),
    HASH_JOIN("Hash Join"),
    MERGE_JOIN("Merge Join"),
    GENERIC("Join");

    private final String label;

    JoinKind(String label) {
        this.label = label;
    }

    public boolean isSpecific() {
        return this != GENERIC;
    }
}
