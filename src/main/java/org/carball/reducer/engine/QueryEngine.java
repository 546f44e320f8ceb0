package org.carball.reducer.engine;

import org.carball.reducer.model.filter.CompiledPredicate;
import org.carball.reducer.model.schema.DatasetHandle;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

/**
 * The tabular query engine the reducer drives. Implementations hold no state across calls:
 * every call acquires its own session and releases it before returning.
 */
public interface QueryEngine {

    List<EngineColumn> describe(DatasetHandle handle) throws SQLException;

    long count(DatasetHandle handle, CompiledPredicate predicate) throws SQLException;

    <T> T select(DatasetHandle handle, SelectStatement statement, RowConsumer<T> consumer)
            throws SQLException, IOException;
}
