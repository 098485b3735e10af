package org.carball.tuner.model.recommendation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An index change proposed by the advisor. Recommendations are descriptive; nothing is applied
 * unless the caller explicitly asks the advisor to execute missing-index creation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MissingIndex.class, name = "missing_index"),
        @JsonSubTypes.Type(value = RedundantIndex.class, name = "redundant_index"),
        @JsonSubTypes.Type(value = UnusedIndex.class, name = "unused_index")
})
public interface Recommendation {

    String reason();

    /**
     * SQL statement or shell command that would apply this recommendation.
     */
    String command();
}
