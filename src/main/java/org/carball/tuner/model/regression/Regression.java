package org.carball.tuner.model.regression;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A measured or structural decline between two captures of the same query.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExecutionTimeRegression.class, name = "execution_time_regression"),
        @JsonSubTypes.Type(value = PlanTypeRegression.class, name = "plan_type_regression"),
        @JsonSubTypes.Type(value = JoinTypeRegression.class, name = "join_type_regression")
})
public interface Regression {

    String recommendation();
}
