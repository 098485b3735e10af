package org.carball.tuner.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.config.AdvisorThresholds;
import org.carball.tuner.model.plan.IssueType;
import org.carball.tuner.model.plan.PlanIssue;
import org.carball.tuner.model.plan.PlanNode;
import org.carball.tuner.sanitize.QuerySanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks an execution plan once, in pre-order, and applies every rule to every node.
 * A node may raise several issues; traversal always continues into its children.
 */
@Slf4j
public class PlanTreeAnalyzer {

    /**
     * Inspects a single node; returns an issue when the node matches the anti-pattern.
     */
    @FunctionalInterface
    interface PlanRule {
        Optional<PlanIssue> inspect(PlanNode node);
    }

    private final List<PlanRule> rules;

    public PlanTreeAnalyzer() {
        this(AdvisorThresholds.defaults());
    }

    public PlanTreeAnalyzer(AdvisorThresholds thresholds) {
        this.rules = List.of(
                node -> sequentialScan(node, thresholds),
                node -> hashJoinWithoutIndex(node, thresholds),
                node -> expensiveFilter(node, thresholds),
                node -> inefficientSort(node, thresholds)
        );
    }

    public List<PlanIssue> analyze(PlanNode root) {
        List<PlanIssue> issues = new ArrayList<>();
        if (root == null) {
            return issues;
        }

        root.walk(node -> {
            for (PlanRule rule : rules) {
                rule.inspect(node).ifPresent(issues::add);
            }
        });

        log.debug("Plan analysis found {} issues", issues.size());
        return issues;
    }

    private static Optional<PlanIssue> sequentialScan(PlanNode node, AdvisorThresholds thresholds) {
        if (!node.isType(PlanNode.SEQ_SCAN) || node.getActualRows() <= thresholds.getSeqScanRows()) {
            return Optional.empty();
        }

        return Optional.of(PlanIssue.builder()
                .type(IssueType.SEQUENTIAL_SCAN)
                .relation(node.getRelationName())
                .actualRows(node.getActualRows())
                .cost(node.getTotalCost())
                .recommendation(String.format(
                        "Consider adding an index on table \"%s\" to avoid sequential scan", node.getRelationName()))
                .build());
    }

    private static Optional<PlanIssue> hashJoinWithoutIndex(PlanNode node, AdvisorThresholds thresholds) {
        if (!node.isType(PlanNode.HASH_JOIN) || node.getTotalCost() <= thresholds.getHashJoinCost()) {
            return Optional.empty();
        }

        // Direct children only
        List<PlanNode> children = node.getChildren() != null ? node.getChildren() : List.of();
        Optional<PlanNode> scannedChild = children.stream()
                .filter(child -> child.isType(PlanNode.SEQ_SCAN))
                .findFirst();

        return scannedChild.map(child -> PlanIssue.builder()
                .type(IssueType.HASH_JOIN_WITHOUT_INDEX)
                .relation(child.getRelationName())
                .cost(node.getTotalCost())
                .actualRows(child.getActualRows())
                .recommendation(String.format(
                        "Consider adding an index on the join columns of table \"%s\" to improve hash join performance",
                        child.getRelationName()))
                .build());
    }

    private static Optional<PlanIssue> expensiveFilter(PlanNode node, AdvisorThresholds thresholds) {
        if (node.getFilterExpression() == null
                || node.getActualRows() >= node.getEstimatedRows() / thresholds.getFilterSelectivityRatio()) {
            return Optional.empty();
        }

        // Filters carry literals from the statement text
        String filter = QuerySanitizer.sanitize(node.getFilterExpression());

        return Optional.of(PlanIssue.builder()
                .type(IssueType.EXPENSIVE_FILTER)
                .relation(node.getRelationName())
                .filter(filter)
                .estimatedRows(node.getEstimatedRows())
                .actualRows(node.getActualRows())
                .cost(node.getTotalCost())
                .recommendation("Consider adding an index to support filter: " + filter)
                .build());
    }

    private static Optional<PlanIssue> inefficientSort(PlanNode node, AdvisorThresholds thresholds) {
        if (!node.isType(PlanNode.SORT) || thresholds.getIndexBackedSortMethod().equals(node.getSortMethod())) {
            return Optional.empty();
        }

        List<String> sortKey = node.getSortKey() != null ? node.getSortKey() : List.of();
        String columns = sortKey.isEmpty() ? "sort keys" : String.join(", ", sortKey);

        return Optional.of(PlanIssue.builder()
                .type(IssueType.INEFFICIENT_SORT)
                .sortKey(sortKey)
                .sortMethod(node.getSortMethod())
                .cost(node.getTotalCost())
                .actualRows(node.getActualRows())
                .recommendation("Consider adding an index on columns (" + columns + ") to avoid in-memory sorting")
                .build());
    }
}
