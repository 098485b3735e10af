package org.carball.tuner.model.recommendation;

public record RedundantIndex(String table, String keepName, String dropName, String reason, String command)
        implements Recommendation {}
