package com.tablebridge.clause;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses JSON clause descriptors into {@link ClauseSpec} variants.
 *
 * <p>Input is a JSON array of descriptor objects, each tagged by a
 * {@code type} field:
 * <pre>
 * [
 *   {"type": "where", "column": "region", "operator": "=", "value": "EU"},
 *   {"type": "group_by", "columns": ["region"]},
 *   {"type": "having", "column": "region", "operator": "=", "value": "EU"},
 *   {"type": "case_if", "column": "flag",
 *    "conditions": [{"column": "status", "value": "open", "result": "yes"}],
 *    "default": "no"},
 *   {"type": "count", "column": "order_id"},
 *   {"type": "window_function", "function": "rank", "column": "amount",
 *    "output_name": "amount_rank", "partition_by": ["region"], "order_by": ["amount"]},
 *   {"type": "cte", "name": "recent", "columns": ["order_id"], "query": "FROM main.orders"}
 * ]
 * </pre>
 *
 * <p>An unknown type or a missing required field is rejected; nothing is
 * silently skipped. For {@code case_if} the {@code column} field names the
 * output column. For {@code window_function} the output name defaults to
 * the argument column when {@code output_name} is absent.
 */
public class ClauseDescriptorParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a JSON array of clause descriptors.
     *
     * @param json the descriptor array
     * @return the clauses, in input order
     * @throws IllegalArgumentException if the JSON is malformed or a descriptor is invalid
     */
    public static List<ClauseSpec> parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Clause descriptor JSON cannot be null or empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse clause descriptors: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    /**
     * Parses an already-read JSON array of clause descriptors.
     *
     * @param root the descriptor array node
     * @return the clauses, in input order
     * @throws IllegalArgumentException if a descriptor is invalid
     */
    public static List<ClauseSpec> parse(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Clause descriptors must be a JSON array");
        }

        List<ClauseSpec> clauses = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            try {
                clauses.add(parseClause(node));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "Invalid clause descriptor at index " + index + ": " + e.getMessage(), e);
            }
            index++;
        }
        return clauses;
    }

    /**
     * Parses a single descriptor object.
     */
    private static ClauseSpec parseClause(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("descriptor must be a JSON object");
        }

        String type = requiredText(node, "type");
        switch (type) {
            case "where":
                return Filter.of(requiredText(node, "column"), requiredText(node, "operator"),
                                 toValue(node.get("value")));
            case "having":
                return Having.of(requiredText(node, "column"), requiredText(node, "operator"),
                                 toValue(node.get("value")));
            case "group_by":
                return new GroupBy(requiredTextList(node, "columns"));
            case "case_if":
                return parseCase(node);
            case "count":
                return new CountProjection(requiredText(node, "column"));
            case "window_function": {
                String column = requiredText(node, "column");
                String outputName = node.hasNonNull("output_name") ? node.get("output_name").asText() : column;
                return new WindowProjection(
                    outputName,
                    requiredText(node, "function"),
                    column,
                    optionalTextList(node, "partition_by"),
                    optionalTextList(node, "order_by"));
            }
            case "cte":
                return new CteSpec(requiredText(node, "name"), requiredTextList(node, "columns"),
                                   requiredText(node, "query"));
            default:
                throw new IllegalArgumentException("unknown clause type '" + type + "'");
        }
    }

    private static CaseProjection parseCase(JsonNode node) {
        JsonNode conditionsNode = node.get("conditions");
        if (conditionsNode == null || !conditionsNode.isArray()) {
            throw new IllegalArgumentException("case_if requires a 'conditions' array");
        }

        List<CaseCondition> conditions = new ArrayList<>();
        for (JsonNode condition : conditionsNode) {
            if (!condition.has("value")) {
                throw new IllegalArgumentException("case_if condition requires a 'value' field");
            }
            conditions.add(new CaseCondition(
                requiredText(condition, "column"),
                toValue(condition.get("value")),
                toValue(condition.get("result"))));
        }

        return new CaseProjection(requiredText(node, "column"), conditions, toValue(node.get("default")));
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing or non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static List<String> requiredTextList(JsonNode node, String field) {
        List<String> values = optionalTextList(node, field);
        if (values == null) {
            throw new IllegalArgumentException("missing array field '" + field + "'");
        }
        return values;
    }

    private static List<String> optionalTextList(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return null;
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("field '" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("field '" + field + "' must contain only strings");
            }
            values.add(element.asText());
        }
        return values;
    }

    /**
     * Converts a scalar JSON node to the Java value bound as a parameter.
     */
    static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isLong()) {
            return node.longValue();
        }
        if (node.isBigDecimal()) {
            return node.decimalValue();
        }
        if (node.isNumber()) {
            return node.isIntegralNumber() ? new BigDecimal(node.bigIntegerValue()) : (Object) node.doubleValue();
        }
        throw new IllegalArgumentException("clause values must be scalars, got " + node.getNodeType());
    }
}
