package org.carball.tuner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class AdvisorThresholds {

    // Plan analysis
    @Builder.Default
    @JsonProperty("seq_scan_rows")
    private long seqScanRows = 1000;

    @Builder.Default
    @JsonProperty("hash_join_cost")
    private double hashJoinCost = 1000;

    @Builder.Default
    @JsonProperty("filter_selectivity_ratio")
    private double filterSelectivityRatio = 10;

    @Builder.Default
    @JsonProperty("index_backed_sort_method")
    private String indexBackedSortMethod = "Index Scan";

    // Regression detection
    @Builder.Default
    @JsonProperty("regression_factor")
    private double regressionFactor = 1.25;

    // Relational index advisor
    @Builder.Default
    @JsonProperty("missing_index_live_rows")
    private long missingIndexLiveRows = 10_000;

    @Builder.Default
    @JsonProperty("missing_index_min_seq_scans")
    private long missingIndexMinSeqScans = 50;

    @Builder.Default
    @JsonProperty("missing_index_limit")
    private int missingIndexLimit = 10;

    @Builder.Default
    @JsonProperty("unused_index_scans")
    private long unusedIndexScans = 50;

    @Builder.Default
    @JsonProperty("unused_index_live_rows")
    private long unusedIndexLiveRows = 1000;

    // Document index advisor
    @Builder.Default
    @JsonProperty("document_collection_size")
    private long documentCollectionSize = 10_000;

    @Builder.Default
    @JsonProperty("document_index_min_operations")
    private long documentIndexMinOperations = 10;

    @Builder.Default
    @JsonProperty("document_profile_sample")
    private int documentProfileSample = 5;

    // Collection and retention
    @Builder.Default
    @JsonProperty("slow_query_limit")
    private int slowQueryLimit = 50;

    @Builder.Default
    @JsonProperty("plan_capture_limit")
    private int planCaptureLimit = 10;

    @Builder.Default
    @JsonProperty("audit_retention")
    private int auditRetention = 100;

    public static AdvisorThresholds defaults() {
        return AdvisorThresholds.builder().build();
    }

    /**
     * Logs warnings for values that would make the analysis meaningless.
     */
    public void validate() {
        if (regressionFactor <= 1.0) {
            log.warn("Regression factor ({}) should be greater than 1.0", regressionFactor);
        }

        if (filterSelectivityRatio <= 1.0) {
            log.warn("Filter selectivity ratio ({}) should be greater than 1.0", filterSelectivityRatio);
        }

        if (slowQueryLimit <= 0) {
            log.warn("Slow query limit ({}) should be positive", slowQueryLimit);
        }

        if (planCaptureLimit > slowQueryLimit) {
            log.warn("Plan capture limit ({}) exceeds slow query limit ({})", planCaptureLimit, slowQueryLimit);
        }

        if (auditRetention <= 0) {
            log.warn("Audit retention ({}) should be positive", auditRetention);
        }

        log.debug("Using thresholds - SeqScan: {}, HashJoin: {}, Regression: {}, Retention: {}",
                seqScanRows, hashJoinCost, regressionFactor, auditRetention);
    }

    public String getConfigurationSummary() {
        return String.format("SeqScan rows: %d | HashJoin cost: %.0f | Regression: x%.2f | Unused scans: %d | Retention: %d",
                seqScanRows, hashJoinCost, regressionFactor, unusedIndexScans, auditRetention);
    }
}
