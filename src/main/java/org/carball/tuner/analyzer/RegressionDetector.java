package org.carball.tuner.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.config.AdvisorThresholds;
import org.carball.tuner.model.plan.PlanNode;
import org.carball.tuner.model.plan.PlanSnapshot;
import org.carball.tuner.model.regression.ExecutionTimeRegression;
import org.carball.tuner.model.regression.JoinTypeRegression;
import org.carball.tuner.model.regression.PlanTypeRegression;
import org.carball.tuner.model.regression.Regression;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares a freshly captured snapshot with the stored one for the same fingerprint.
 */
@Slf4j
public class RegressionDetector {

    private final double regressionFactor;

    public RegressionDetector() {
        this(AdvisorThresholds.defaults());
    }

    public RegressionDetector(AdvisorThresholds thresholds) {
        this.regressionFactor = thresholds.getRegressionFactor();
    }

    /**
     * Returns the regressions of {@code current} relative to {@code previous}. A missing previous
     * snapshot is a first capture and never a regression.
     */
    public List<Regression> detect(PlanSnapshot previous, PlanSnapshot current) {
        List<Regression> regressions = new ArrayList<>();
        if (previous == null || current == null) {
            return regressions;
        }

        detectExecutionTimeRegression(previous, current, regressions);
        detectPlanShapeRegressions(previous.getRoot(), current.getRoot(), regressions);

        if (!regressions.isEmpty()) {
            log.info("Detected {} regressions for query {}", regressions.size(), current.getQueryFingerprint());
        }
        return regressions;
    }

    private void detectExecutionTimeRegression(PlanSnapshot previous, PlanSnapshot current,
                                               List<Regression> regressions) {
        if (previous.getMetrics() == null || current.getMetrics() == null) {
            return;
        }

        double oldTime = previous.getMetrics().meanTime();
        double newTime = current.getMetrics().meanTime();
        if (oldTime <= 0) {
            return;
        }

        if (newTime > oldTime * regressionFactor) {
            double pctIncrease = (newTime - oldTime) / oldTime * 100;
            regressions.add(new ExecutionTimeRegression(oldTime, newTime, pctIncrease));
        }
    }

    private static void detectPlanShapeRegressions(PlanNode oldRoot, PlanNode newRoot, List<Regression> regressions) {
        if (oldRoot == null || newRoot == null) {
            return;
        }

        List<String> oldTypes = oldRoot.flattenNodeTypes();
        List<String> newTypes = newRoot.flattenNodeTypes();

        if (oldTypes.contains(PlanNode.INDEX_SCAN)
                && !newTypes.contains(PlanNode.INDEX_SCAN)
                && newTypes.contains(PlanNode.SEQ_SCAN)) {
            regressions.add(new PlanTypeRegression(PlanNode.INDEX_SCAN, PlanNode.SEQ_SCAN));
        }

        if (oldTypes.contains(PlanNode.NESTED_LOOP)
                && !newTypes.contains(PlanNode.NESTED_LOOP)
                && newTypes.contains(PlanNode.HASH_JOIN)) {
            regressions.add(new JoinTypeRegression(PlanNode.NESTED_LOOP, PlanNode.HASH_JOIN));
        }
    }
}
