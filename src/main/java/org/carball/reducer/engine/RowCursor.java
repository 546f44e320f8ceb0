package org.carball.reducer.engine;

import java.sql.SQLException;
import java.util.List;

/**
 * Forward-only view over an open result. Only valid inside the {@link RowConsumer} it was
 * handed to; the engine closes it when the consumer returns or fails.
 */
public interface RowCursor {

    List<String> columnNames();

    boolean next() throws SQLException;

    Object get(int index) throws SQLException;

    List<Object> currentRow() throws SQLException;
}
