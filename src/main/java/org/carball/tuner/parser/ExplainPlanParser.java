package org.carball.tuner.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.tuner.model.plan.PlanNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the output of {@code EXPLAIN (ANALYZE, BUFFERS, FORMAT JSON)} into a {@link PlanNode} tree.
 */
public class ExplainPlanParser {

    private final ObjectMapper objectMapper;

    public ExplainPlanParser() {
        this(new ObjectMapper());
    }

    public ExplainPlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the JSON document returned by PostgreSQL for one statement.
     *
     * @throws IllegalArgumentException when the text is not a plan document
     */
    public ParsedPlan parse(String explainJson) {
        if (explainJson == null || explainJson.isBlank()) {
            throw new IllegalArgumentException("Empty EXPLAIN output");
        }

        JsonNode document;
        try {
            document = objectMapper.readTree(explainJson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid EXPLAIN JSON: " + e.getOriginalMessage(), e);
        }

        // PostgreSQL wraps the plan in a one-element array
        if (document.isArray()) {
            if (document.isEmpty()) {
                throw new IllegalArgumentException("EXPLAIN output contains no plan");
            }
            document = document.get(0);
        }

        JsonNode plan = document.get("Plan");
        if (plan == null || !plan.isObject()) {
            throw new IllegalArgumentException("Missing Plan section in EXPLAIN output");
        }

        JsonNode executionTime = document.get("Execution Time");
        Double executionTimeMs = executionTime != null && executionTime.isNumber()
                ? executionTime.asDouble()
                : null;

        return new ParsedPlan(parseNode(plan), executionTimeMs);
    }

    private PlanNode parseNode(JsonNode node) {
        JsonNode nodeType = node.get("Node Type");
        if (nodeType == null || !nodeType.isTextual()) {
            throw new IllegalArgumentException("Plan node without Node Type");
        }

        List<PlanNode> children = new ArrayList<>();
        JsonNode plans = node.get("Plans");
        if (plans != null && plans.isArray()) {
            for (JsonNode child : plans) {
                children.add(parseNode(child));
            }
        }

        return PlanNode.builder()
                .nodeType(nodeType.asText())
                .relationName(textOrNull(node, "Relation Name"))
                .filterExpression(textOrNull(node, "Filter"))
                .estimatedRows(node.path("Plan Rows").asDouble(0))
                .actualRows(node.path("Actual Rows").asDouble(0))
                .totalCost(node.path("Total Cost").asDouble(0))
                .sortKey(parseSortKey(node.get("Sort Key")))
                .sortMethod(textOrNull(node, "Sort Method"))
                .children(children)
                .build();
    }

    private static List<String> parseSortKey(JsonNode sortKey) {
        if (sortKey == null || !sortKey.isArray()) {
            return null;
        }
        List<String> keys = new ArrayList<>();
        for (JsonNode key : sortKey) {
            keys.add(key.asText());
        }
        return keys;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    /**
     * Plan tree plus the measured execution time, when the plan was captured with ANALYZE.
     */
    public record ParsedPlan(PlanNode root, Double executionTimeMs) {}
}
