package org.carball.tuner.model.recommendation;

import org.carball.tuner.model.query.StoreKind;

/**
 * @param column {@code null} when no queried field could be identified and the owner needs manual review
 */
public record MissingIndex(StoreKind store, String table, String column, String reason, String command)
        implements Recommendation {

    public boolean needsReview() {
        return column == null;
    }
}
