package org.carball.reducer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Infers which granularities a dataset is consistent with from the presence of marker columns.
 * Heuristic only: names must match a marker exactly, {@code order_number} is not {@code order_id}.
 */
@Slf4j
public class GrainDetector {

    public Set<Grain> detect(Collection<ColumnDescriptor> columns) {
        EnumSet<Grain> grains = EnumSet.noneOf(Grain.class);
        if (columns == null) {
            return Collections.unmodifiableSet(grains);
        }

        for (Grain grain : Grain.values()) {
            if (ColumnDescriptor.containsColumn(columns, grain.getMarkerColumn())) {
                grains.add(grain);
            }
        }

        log.debug("Detected grains {} from {} columns", grains, columns.size());
        return Collections.unmodifiableSet(grains);
    }
}
