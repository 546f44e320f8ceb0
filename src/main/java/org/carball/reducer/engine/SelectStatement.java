package org.carball.reducer.engine;

import lombok.Builder;
import lombok.Value;
import org.carball.reducer.model.filter.CompiledPredicate;

/**
 * A single-table SELECT against a dataset. The projection, grouping and ordering are fixed
 * server-side expressions; user values only enter through the predicate's parameters.
 */
@Value
@Builder
public class SelectStatement {

    @Builder.Default
    String projection = "*";

    @Builder.Default
    CompiledPredicate predicate = CompiledPredicate.unconditional();

    String groupBy;

    String orderBy;

    Integer limit;

    String render(String source) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(projection)
                .append(" FROM ")
                .append(source)
                .append(predicate.whereClause());
        if (groupBy != null) {
            sql.append(" GROUP BY ").append(groupBy);
        }
        if (orderBy != null) {
            sql.append(" ORDER BY ").append(orderBy);
        }
        if (limit != null) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must not be negative: " + limit);
            }
            sql.append(" LIMIT ").append(limit.intValue());
        }
        return sql.toString();
    }
}
