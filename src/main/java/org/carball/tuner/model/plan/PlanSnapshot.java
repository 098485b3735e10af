package org.carball.tuner.model.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The most recent captured plan for one query fingerprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanSnapshot {
    private String queryFingerprint;
    private Instant capturedAt;
    private String queryText;
    private Double executionTimeMs;
    private PlanNode root;
    private PlanMetrics metrics;
}
