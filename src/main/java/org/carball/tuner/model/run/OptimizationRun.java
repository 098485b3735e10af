package org.carball.tuner.model.run;

import lombok.Builder;
import lombok.Data;
import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.recommendation.IndexAction;
import org.carball.tuner.model.recommendation.MaintenanceAction;
import org.carball.tuner.model.recommendation.Recommendation;
import org.carball.tuner.model.regression.Regression;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one scheduled cycle found. Holds sanitized query text only.
 */
@Data
@Builder
public class OptimizationRun {
    private Instant timestamp;
    @Builder.Default
    private List<SanitizedQueryRecord> relationalSlowQueries = new ArrayList<>();
    @Builder.Default
    private List<SanitizedQueryRecord> documentSlowQueries = new ArrayList<>();
    @Builder.Default
    private List<QueryAnalysis> queryAnalyses = new ArrayList<>();
    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();
    @Builder.Default
    private List<IndexAction> indexActions = new ArrayList<>();
    @Builder.Default
    private List<MaintenanceAction> maintenanceActions = new ArrayList<>();
    private boolean executeRecommendations;
    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, StoreHealth> health = new LinkedHashMap<>();
    @Builder.Default
    private List<String> alerts = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public int getSlowQueryCount() {
        return relationalSlowQueries.size() + documentSlowQueries.size();
    }

    public List<Regression> getRegressions() {
        List<Regression> regressions = new ArrayList<>();
        for (QueryAnalysis analysis : queryAnalyses) {
            regressions.addAll(analysis.getRegressions());
        }
        return regressions;
    }

    public boolean hasAnomalies() {
        return getSlowQueryCount() > 0 || !getRegressions().isEmpty() || !recommendations.isEmpty()
                || health.values().stream().anyMatch(store -> store.status() == StoreHealth.Status.ERROR)
                || maintenanceActions.stream().anyMatch(action -> !action.success());
    }
}
