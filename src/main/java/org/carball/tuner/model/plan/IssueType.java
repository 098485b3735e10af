package org.carball.tuner.model.plan;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    SEQUENTIAL_SCAN("sequential_scan"),
    HASH_JOIN_WITHOUT_INDEX("hash_join_without_index"),
    EXPENSIVE_FILTER("expensive_filter"),
    INEFFICIENT_SORT("inefficient_sort");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
