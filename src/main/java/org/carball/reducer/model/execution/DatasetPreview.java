package org.carball.reducer.model.execution;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.List;
import java.util.Map;

/**
 * First rows of a dataset plus its schema and total row count.
 */
public record DatasetPreview(
        List<ColumnDescriptor> columns,
        List<Map<String, Object>> rows,
        @JsonProperty("total_rows") long totalRows
) {}
