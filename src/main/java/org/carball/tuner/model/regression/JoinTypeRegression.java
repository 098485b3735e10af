package org.carball.tuner.model.regression;

public record JoinTypeRegression(String oldType, String newType) implements Regression {

    @Override
    public String recommendation() {
        return "Join strategy has changed from " + oldType + " to " + newType
                + ". This might indicate missing indexes or outdated statistics.";
    }
}
