package org.carball.tuner.model.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * One step of a PostgreSQL execution plan. Children are owned by their parent node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanNode {

    public static final String SEQ_SCAN = "Seq Scan";
    public static final String INDEX_SCAN = "Index Scan";
    public static final String HASH_JOIN = "Hash Join";
    public static final String NESTED_LOOP = "Nested Loop";
    public static final String SORT = "Sort";

    private String nodeType;
    private String relationName;
    private String filterExpression;
    private double estimatedRows;
    private double actualRows;
    private double totalCost;
    private List<String> sortKey;
    private String sortMethod;

    @Builder.Default
    private List<PlanNode> children = new ArrayList<>();

    public boolean isType(String type) {
        return type.equals(nodeType);
    }

    /**
     * Visits this node and every descendant in pre-order.
     */
    public void walk(Consumer<PlanNode> visitor) {
        visitor.accept(this);
        if (children != null) {
            for (PlanNode child : children) {
                child.walk(visitor);
            }
        }
    }

    /**
     * Node types of the whole tree in pre-order.
     */
    public List<String> flattenNodeTypes() {
        List<String> types = new ArrayList<>();
        walk(node -> {
            if (node.getNodeType() != null) {
                types.add(node.getNodeType());
            }
        });
        return types;
    }
}
