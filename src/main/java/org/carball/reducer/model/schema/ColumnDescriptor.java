package org.carball.reducer.model.schema;

import java.util.Collection;

/**
 * One column of a dataset as discovered by the query engine.
 */
public record ColumnDescriptor(
        String name,
        TypeTag declaredType,
        boolean nullable,
        String engineType
) {

    public static ColumnDescriptor of(String name, TypeTag declaredType) {
        return new ColumnDescriptor(name, declaredType, true, declaredType.name());
    }

    public static boolean containsColumn(Collection<ColumnDescriptor> columns, String name) {
        return columns.stream().anyMatch(c -> c.name().equals(name));
    }

    public static ColumnDescriptor findColumn(Collection<ColumnDescriptor> columns, String name) {
        return columns.stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
