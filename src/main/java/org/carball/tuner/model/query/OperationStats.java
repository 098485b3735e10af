package org.carball.tuner.model.query;

/**
 * Profiler details captured for a single document-store operation.
 */
public record OperationStats(
        String operation,
        String planSummary,
        long docsExamined,
        long keysExamined,
        long documentsReturned,
        boolean hasSort,
        boolean aggregation
) {

    public boolean usedIndex() {
        return planSummary != null && planSummary.contains("IXSCAN");
    }
}
