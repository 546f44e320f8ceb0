package org.carball.reducer.engine;

import java.io.IOException;
import java.sql.SQLException;

@FunctionalInterface
public interface RowConsumer<T> {

    T consume(RowCursor cursor) throws SQLException, IOException;
}
