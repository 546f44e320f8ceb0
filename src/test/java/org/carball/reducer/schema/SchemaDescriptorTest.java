package org.carball.reducer.schema;

import org.carball.reducer.engine.DuckDbQueryEngine;
import org.carball.reducer.engine.EngineColumn;
import org.carball.reducer.engine.QueryEngine;
import org.carball.reducer.engine.RowConsumer;
import org.carball.reducer.engine.SelectStatement;
import org.carball.reducer.exception.DatasetNotFoundException;
import org.carball.reducer.exception.SchemaUnavailableException;
import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.DatasetHandle;
import org.carball.reducer.model.schema.TypeTag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SchemaDescriptorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDescribeColumnsWithTypeTags() throws Exception {
        // Given
        Path csv = tempDir.resolve("orders.csv");
        Files.writeString(csv, """
                order_id,product_name,order_total_amount,first_purchase_flag,purchase_time
                1,apple,12.5,true,2024-01-01 10:00:00
                2,banana,20.25,false,2024-01-02 11:30:00
                """);
        SchemaDescriptor descriptor = new SchemaDescriptor(new DuckDbQueryEngine());

        // When
        List<ColumnDescriptor> columns = descriptor.describe(new DatasetHandle("orders", csv));

        // Then
        assertThat(columns).extracting(ColumnDescriptor::name).containsExactly(
                "order_id", "product_name", "order_total_amount", "first_purchase_flag", "purchase_time");
        assertThat(columns).extracting(ColumnDescriptor::declaredType).containsExactly(
                TypeTag.INTEGER, TypeTag.STRING, TypeTag.FLOAT, TypeTag.BOOLEAN, TypeTag.TIMESTAMP);
        assertThat(columns.get(0).engineType()).isEqualTo("BIGINT");
    }

    @Test
    void shouldFailForMissingFile() {
        SchemaDescriptor descriptor = new SchemaDescriptor(new DuckDbQueryEngine());
        DatasetHandle handle = new DatasetHandle("gone", tempDir.resolve("gone.csv"));

        assertThatThrownBy(() -> descriptor.describe(handle))
                .isInstanceOf(DatasetNotFoundException.class)
                .hasMessageContaining("gone");
    }

    @Test
    void shouldReportEngineFailureAsSchemaUnavailable() throws Exception {
        // Given
        Path csv = tempDir.resolve("broken.csv");
        Files.writeString(csv, "a,b\n1,2\n");
        SchemaDescriptor descriptor = new SchemaDescriptor(new DescribeOnlyEngine(null));

        // When/Then
        assertThatThrownBy(() -> descriptor.describe(new DatasetHandle("broken", csv)))
                .isInstanceOf(SchemaUnavailableException.class)
                .hasMessageContaining("broken")
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void shouldReportEmptySchemaAsUnavailable() throws Exception {
        Path csv = tempDir.resolve("empty.csv");
        Files.writeString(csv, "");
        SchemaDescriptor descriptor = new SchemaDescriptor(new DescribeOnlyEngine(List.of()));

        assertThatThrownBy(() -> descriptor.describe(new DatasetHandle("empty", csv)))
                .isInstanceOf(SchemaUnavailableException.class)
                .hasMessageContaining("no columns");
    }

    @Test
    void shouldMapEngineTypeNames() {
        assertThat(TypeTag.fromEngineType("HUGEINT")).isEqualTo(TypeTag.INTEGER);
        assertThat(TypeTag.fromEngineType("DECIMAL(18,3)")).isEqualTo(TypeTag.FLOAT);
        assertThat(TypeTag.fromEngineType("TIMESTAMP WITH TIME ZONE")).isEqualTo(TypeTag.TIMESTAMP);
        assertThat(TypeTag.fromEngineType("DATE")).isEqualTo(TypeTag.TIMESTAMP);
        assertThat(TypeTag.fromEngineType("varchar")).isEqualTo(TypeTag.STRING);
        assertThat(TypeTag.fromEngineType("STRUCT(a INTEGER)")).isEqualTo(TypeTag.UNKNOWN);
        assertThat(TypeTag.fromEngineType(null)).isEqualTo(TypeTag.UNKNOWN);
    }

    /**
     * Describes with a fixed column list, or fails when the list is null.
     */
    private static final class DescribeOnlyEngine implements QueryEngine {

        private final List<EngineColumn> columns;

        private DescribeOnlyEngine(List<EngineColumn> columns) {
            this.columns = columns;
        }

        @Override
        public List<EngineColumn> describe(DatasetHandle handle) throws SQLException {
            if (columns == null) {
                throw new SQLException("Invalid Input Error: could not sniff " + handle.path());
            }
            return columns;
        }

        @Override
        public long count(DatasetHandle handle, CompiledPredicate predicate) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> T select(DatasetHandle handle, SelectStatement statement, RowConsumer<T> consumer) {
            throw new UnsupportedOperationException();
        }
    }
}
