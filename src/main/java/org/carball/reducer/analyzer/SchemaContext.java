package org.carball.reducer.analyzer;

import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detected grains plus the schema, as seen by blacklist rules.
 */
public record SchemaContext(Set<Grain> grains, List<ColumnDescriptor> columns) {

    public SchemaContext {
        grains = grains == null ? Set.of() : Set.copyOf(grains);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public boolean hasGrain(Grain grain) {
        return grains.contains(grain);
    }

    public boolean hasColumn(String name) {
        return ColumnDescriptor.containsColumn(columns, name);
    }

    public boolean hasNullableColumn(String name) {
        ColumnDescriptor column = ColumnDescriptor.findColumn(columns, name);
        return column != null && column.nullable();
    }

    /**
     * The candidates that exist in the schema, in candidate order.
     */
    public List<String> presentColumns(Collection<String> candidates) {
        return candidates.stream()
                .filter(this::hasColumn)
                .collect(Collectors.toList());
    }
}
