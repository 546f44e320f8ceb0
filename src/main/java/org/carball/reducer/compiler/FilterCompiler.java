package org.carball.reducer.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.engine.SqlDialect;
import org.carball.reducer.exception.MalformedOperandException;
import org.carball.reducer.exception.UnknownColumnException;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.filter.FilterLogic;
import org.carball.reducer.model.filter.FilterOperator;
import org.carball.reducer.model.filter.FilterRule;
import org.carball.reducer.model.filter.FilterValue;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compiles structured filter rules into a parameterized predicate. Every rule is validated
 * against the dataset's columns and the operator grammar before any clause text is built;
 * values only ever become positional parameters.
 *
 * <p>Filter payloads carry dates and often numbers as JSON strings. A string bound against a
 * temporal, numeric or boolean column gets a typed placeholder such as {@code CAST(? AS DATE)},
 * with the target type taken from a fixed table keyed by the column's engine type.
 */
@Slf4j
public class FilterCompiler {

    private static final Map<String, String> TEMPORAL_CAST_TARGETS = Map.of(
            "DATE", "DATE",
            "TIME", "TIME",
            "TIMESTAMP", "TIMESTAMP",
            "DATETIME", "TIMESTAMP",
            "TIMESTAMP WITH TIME ZONE", "TIMESTAMPTZ",
            "TIMESTAMPTZ", "TIMESTAMPTZ",
            "TIMESTAMP_S", "TIMESTAMP",
            "TIMESTAMP_MS", "TIMESTAMP",
            "TIMESTAMP_NS", "TIMESTAMP"
    );

    private final PredicateVerifier verifier;

    public FilterCompiler() {
        this(new PredicateVerifier());
    }

    public FilterCompiler(PredicateVerifier verifier) {
        this.verifier = verifier;
    }

    public CompiledPredicate compile(List<FilterRule> rules, String logic, Collection<ColumnDescriptor> knownColumns) {
        return compile(rules, FilterLogic.fromString(logic), knownColumns);
    }

    public CompiledPredicate compile(List<FilterRule> rules, FilterLogic logic, Collection<ColumnDescriptor> knownColumns) {
        if (rules == null || rules.isEmpty()) {
            return CompiledPredicate.unconditional();
        }

        Map<String, ColumnDescriptor> columnsByName = knownColumns == null ? Collections.emptyMap() : knownColumns.stream()
                .collect(Collectors.toMap(ColumnDescriptor::name, Function.identity(), (first, second) -> first,
                        LinkedHashMap::new));

        // Validate everything first so that a bad rule late in the list never leaves half-built output.
        List<FilterOperator> operators = new ArrayList<>(rules.size());
        for (FilterRule rule : rules) {
            operators.add(validate(rule, columnsByName));
        }

        List<String> clauses = new ArrayList<>(rules.size());
        List<Object> parameters = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            FilterRule rule = rules.get(i);
            clauses.add("(" + compileRule(rule, operators.get(i), castTarget(columnsByName.get(rule.column())), parameters) + ")");
        }

        FilterLogic effectiveLogic = logic == null ? FilterLogic.AND : logic;
        CompiledPredicate predicate = new CompiledPredicate(String.join(effectiveLogic.joiner(), clauses), parameters);
        verifier.verify(predicate);

        log.debug("Compiled {} filter rules with {}: {}", rules.size(), effectiveLogic, predicate.clauseTemplate());
        return predicate;
    }

    private FilterOperator validate(FilterRule rule, Map<String, ColumnDescriptor> columnsByName) {
        if (rule == null) {
            throw new MalformedOperandException(null, null, "filter rule is missing");
        }
        if (rule.column() == null || !columnsByName.containsKey(rule.column())) {
            throw new UnknownColumnException(rule.column());
        }

        FilterOperator operator = FilterOperator.fromString(rule.operator());
        FilterValue value = rule.value();
        if (value == null) {
            throw new MalformedOperandException(rule.column(), operator.getKey(), "value is missing");
        }

        switch (operator) {
            case BETWEEN:
                if (!value.isList() || value.size() != 2) {
                    throw new MalformedOperandException(rule.column(), operator.getKey(),
                            "between requires exactly [start, end]");
                }
                requireNonNullElements(rule, operator, value);
                break;
            case IN:
                if (!value.isList() || value.size() == 0) {
                    throw new MalformedOperandException(rule.column(), operator.getKey(),
                            "in requires a non-empty list");
                }
                requireNonNullElements(rule, operator, value);
                break;
            default:
                if (value.isList()) {
                    throw new MalformedOperandException(rule.column(), operator.getKey(),
                            operator.getKey() + " requires a single value, got a list");
                }
                if (value.scalar() == null) {
                    throw new MalformedOperandException(rule.column(), operator.getKey(), "value is null");
                }
                break;
        }
        return operator;
    }

    private static void requireNonNullElements(FilterRule rule, FilterOperator operator, FilterValue value) {
        if (value.elements().contains(null)) {
            throw new MalformedOperandException(rule.column(), operator.getKey(), "list contains a null value");
        }
    }

    private static String compileRule(FilterRule rule, FilterOperator operator, String castTarget, List<Object> parameters) {
        String column = SqlDialect.quoteIdentifier(rule.column());
        FilterValue value = rule.value();

        switch (operator) {
            case CONTAINS:
                parameters.add("%" + value.scalar() + "%");
                return "CAST(" + column + " AS VARCHAR) LIKE ?";
            case BETWEEN:
                return column + " BETWEEN " + bind(value.elements().get(0), castTarget, parameters)
                        + " AND " + bind(value.elements().get(1), castTarget, parameters);
            case IN:
                List<String> placeholders = new ArrayList<>(value.size());
                for (Object element : value.elements()) {
                    placeholders.add(bind(element, castTarget, parameters));
                }
                return column + " IN (" + String.join(", ", placeholders) + ")";
            default:
                return column + " " + operator.getSymbol() + " " + bind(value.scalar(), castTarget, parameters);
        }
    }

    private static String bind(Object value, String castTarget, List<Object> parameters) {
        parameters.add(value);
        return value instanceof String && castTarget != null ? "CAST(? AS " + castTarget + ")" : "?";
    }

    /**
     * SQL type a string parameter is cast to before it is compared with the column, or null
     * when the column compares with strings as they are.
     */
    static String castTarget(ColumnDescriptor column) {
        if (column == null || column.declaredType() == null) {
            return null;
        }
        switch (column.declaredType()) {
            case TIMESTAMP:
                String engineType = column.engineType() == null ? "" : column.engineType().trim().toUpperCase(Locale.ROOT);
                return TEMPORAL_CAST_TARGETS.getOrDefault(engineType, "TIMESTAMP");
            case INTEGER:
            case FLOAT:
                return "DOUBLE";
            case BOOLEAN:
                return "BOOLEAN";
            default:
                return null;
        }
    }
}
