package org.carball.tuner.model.regression;

public record PlanTypeRegression(String oldType, String newType) implements Regression {

    @Override
    public String recommendation() {
        return "Query plan has regressed from " + oldType + " to " + newType
                + ". Check if indexes were dropped or statistics are outdated.";
    }
}
