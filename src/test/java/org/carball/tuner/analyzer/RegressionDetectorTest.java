package org.carball.tuner.analyzer;

import org.carball.tuner.model.plan.PlanMetrics;
import org.carball.tuner.model.plan.PlanNode;
import org.carball.tuner.model.plan.PlanSnapshot;
import org.carball.tuner.model.regression.ExecutionTimeRegression;
import org.carball.tuner.model.regression.JoinTypeRegression;
import org.carball.tuner.model.regression.PlanTypeRegression;
import org.carball.tuner.model.regression.Regression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RegressionDetectorTest {

    private RegressionDetector detector;

    @BeforeEach
    void setUp() {
        detector = new RegressionDetector();
    }

    @Test
    void shouldDetectExecutionTimeRegressionAboveFactor() {
        // Given
        PlanSnapshot previous = snapshot(100, null);
        PlanSnapshot current = snapshot(126, null);

        // When
        List<Regression> regressions = detector.detect(previous, current);

        // Then
        assertThat(regressions).hasSize(1);
        ExecutionTimeRegression regression = (ExecutionTimeRegression) regressions.get(0);
        assertThat(regression.oldTime()).isEqualTo(100);
        assertThat(regression.newTime()).isEqualTo(126);
        assertThat(regression.pctIncrease()).isCloseTo(26.0, within(0.001));
        assertThat(regression.recommendation()).startsWith("Query performance has regressed from");
    }

    @Test
    void shouldNotDetectRegressionBelowFactor() {
        assertThat(detector.detect(snapshot(100, null), snapshot(124, null))).isEmpty();
        assertThat(detector.detect(snapshot(100, null), snapshot(125, null))).isEmpty();
    }

    @Test
    void shouldTreatFirstCaptureAsBaseline() {
        assertThat(detector.detect(null, snapshot(5000, null))).isEmpty();
    }

    @Test
    void shouldDetectIndexScanReplacedBySequentialScan() {
        // Given
        PlanNode before = node(PlanNode.INDEX_SCAN);
        PlanNode after = node(PlanNode.SEQ_SCAN);

        // When
        List<Regression> regressions = detector.detect(snapshot(10, before), snapshot(10, after));

        // Then
        assertThat(regressions).containsExactly(new PlanTypeRegression("Index Scan", "Seq Scan"));
    }

    @Test
    void shouldNotFlagPlanWhenIndexScanStillPresent() {
        // Given
        PlanNode after = node(PlanNode.HASH_JOIN, node(PlanNode.SEQ_SCAN), node(PlanNode.INDEX_SCAN));

        // Then
        assertThat(detector.detect(snapshot(10, node(PlanNode.INDEX_SCAN)), snapshot(10, after))).isEmpty();
    }

    @Test
    void shouldDetectNestedLoopReplacedByHashJoin() {
        // Given
        PlanNode before = node(PlanNode.NESTED_LOOP, node(PlanNode.SEQ_SCAN), node(PlanNode.SEQ_SCAN));
        PlanNode after = node(PlanNode.HASH_JOIN, node(PlanNode.SEQ_SCAN), node("Hash", node(PlanNode.SEQ_SCAN)));

        // When
        List<Regression> regressions = detector.detect(snapshot(10, before), snapshot(40, after));

        // Then
        assertThat(regressions).hasSize(2);
        assertThat(regressions.get(0)).isInstanceOf(ExecutionTimeRegression.class);
        assertThat(regressions.get(1)).isEqualTo(new JoinTypeRegression("Nested Loop", "Hash Join"));
    }

    private static PlanSnapshot snapshot(double meanTime, PlanNode root) {
        return PlanSnapshot.builder()
                .queryFingerprint("abc123def0")
                .metrics(new PlanMetrics(10, meanTime * 10, meanTime, 100))
                .root(root)
                .build();
    }

    private static PlanNode node(String type, PlanNode... children) {
        return PlanNode.builder().nodeType(type).children(List.of(children)).build();
    }
}
