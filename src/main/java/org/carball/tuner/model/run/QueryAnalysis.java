package org.carball.tuner.model.run;

import lombok.Builder;
import lombok.Data;
import org.carball.tuner.model.plan.PlanIssue;
import org.carball.tuner.model.plan.PlanMetrics;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.regression.Regression;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-query findings of one run. The query text is sanitized and truncated to a preview.
 */
@Data
@Builder
public class QueryAnalysis {
    private StoreKind storeKind;
    private String queryFingerprint;
    private String queryPreview;
    private PlanMetrics metrics;
    @Builder.Default
    private List<PlanIssue> issues = new ArrayList<>();
    @Builder.Default
    private List<Regression> regressions = new ArrayList<>();
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
}
