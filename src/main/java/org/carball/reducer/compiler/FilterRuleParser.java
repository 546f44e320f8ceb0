package org.carball.reducer.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.exception.MalformedOperandException;
import org.carball.reducer.model.filter.FilterLogic;
import org.carball.reducer.model.filter.FilterRule;
import org.carball.reducer.model.filter.FilterValue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a filter payload of the form
 * <pre>{"logic": "AND", "filters": [{"column": "amount", "op": "between", "value": [100, 500]}]}</pre>
 * into filter rules. Operators are passed through untouched for the compiler to judge.
 */
@Slf4j
public class FilterRuleParser {

    private final ObjectMapper objectMapper;

    public FilterRuleParser() {
        this(new ObjectMapper());
    }

    public FilterRuleParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record FilterRequest(List<FilterRule> rules, FilterLogic logic) {}

    public FilterRequest parse(Path payloadFile) throws IOException {
        if (!Files.exists(payloadFile)) {
            throw new IOException("Filter payload file not found: " + payloadFile);
        }
        return parse(Files.readString(payloadFile));
    }

    public FilterRequest parse(String payload) throws IOException {
        JsonNode root = objectMapper.readTree(payload);
        if (root == null || !root.isObject()) {
            throw new IOException("Filter payload must be a JSON object");
        }

        FilterLogic logic = FilterLogic.fromString(root.path("logic").asText(null));
        List<FilterRule> rules = new ArrayList<>();

        JsonNode filters = root.get("filters");
        if (filters != null && !filters.isNull()) {
            if (!filters.isArray()) {
                throw new IOException("'filters' must be an array");
            }
            for (JsonNode filterNode : filters) {
                rules.add(parseRule(filterNode));
            }
        }

        log.debug("Parsed {} filter rules joined with {}", rules.size(), logic);
        return new FilterRequest(rules, logic);
    }

    private FilterRule parseRule(JsonNode node) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Each filter must be a JSON object");
        }
        String column = textOrNull(node.get("column"));
        JsonNode operatorNode = node.has("op") ? node.get("op") : node.get("operator");
        String operator = textOrNull(operatorNode);

        JsonNode valueNode = node.get("value");
        FilterValue value;
        if (valueNode == null) {
            value = null;
        } else if (valueNode.isArray()) {
            List<Object> elements = new ArrayList<>();
            for (JsonNode element : valueNode) {
                elements.add(toScalar(element, column, operator));
            }
            value = FilterValue.list(elements);
        } else {
            value = FilterValue.scalar(toScalar(valueNode, column, operator));
        }

        return new FilterRule(column, operator, value);
    }

    private static Object toScalar(JsonNode node, String column, String operator) {
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : (Object) node.doubleValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        throw new MalformedOperandException(column, operator, "values must be strings, numbers or booleans");
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
