package org.carball.tuner.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * An anti-pattern found in an execution plan, with the context needed to act on it.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanIssue {
    private IssueType type;
    private String relation;
    private Double cost;
    private Double estimatedRows;
    private Double actualRows;
    private String filter;
    private List<String> sortKey;
    private String sortMethod;
    private String recommendation;
}
