package org.carball.tuner.model.regression;

/**
 * Mean execution time grew past the tolerated factor. Times are in milliseconds.
 */
public record ExecutionTimeRegression(double oldTime, double newTime, double pctIncrease) implements Regression {

    @Override
    public String recommendation() {
        return String.format("Query performance has regressed from %.2f ms to %.2f ms (+%.1f%%). "
                + "Consider reverting recent schema or query changes.", oldTime, newTime, pctIncrease);
    }
}
