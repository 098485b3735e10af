package org.carball.tuner.analyzer;

import org.carball.tuner.config.AdvisorThresholds;
import org.carball.tuner.model.query.OperationStats;
import org.carball.tuner.model.query.SanitizedQueryRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the profiler details of one document-store operation into tuning advice.
 * Document stores expose no plan tree, so the checks work on profiler counters alone.
 */
public class DocumentProfileAnalyzer {

    private static final long EXAMINED_DOCUMENTS_FLOOR = 1000;

    private final double selectivityRatio;

    public DocumentProfileAnalyzer() {
        this(AdvisorThresholds.defaults());
    }

    public DocumentProfileAnalyzer(AdvisorThresholds thresholds) {
        this.selectivityRatio = thresholds.getFilterSelectivityRatio();
    }

    public List<String> analyze(SanitizedQueryRecord record) {
        List<String> recommendations = new ArrayList<>();
        OperationStats stats = record.operationStats();
        if (stats == null) {
            return recommendations;
        }

        if (!stats.usedIndex()) {
            recommendations.add("Create an index for the collection " + record.source() + " on queried fields");
        }

        if (stats.docsExamined() > EXAMINED_DOCUMENTS_FLOOR
                && stats.documentsReturned() < stats.docsExamined() / selectivityRatio) {
            recommendations.add("Query is examining too many documents relative to results. Improve index coverage.");
        }

        if (stats.hasSort() && !stats.usedIndex()) {
            recommendations.add("Add an index to support the sort operation and avoid in-memory sorting");
        }

        if (stats.aggregation()) {
            recommendations.add("Review aggregation pipeline for optimization opportunities");
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Consider using projection to limit returned fields");
            recommendations.add("Review query patterns and data model for potential denormalization");
        }

        return recommendations;
    }
}
