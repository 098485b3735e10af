package org.carball.tuner.model.recommendation;

import org.carball.tuner.model.query.StoreKind;

public record UnusedIndex(StoreKind store, String owner, String name, long scans, String reason, String command)
        implements Recommendation {}
