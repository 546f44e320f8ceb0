package org.carball.reducer.analyzer;

import org.carball.reducer.model.analysis.AvailableAnalysis;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the analysis families a dataset's columns can support.
 */
public class AvailableAnalysisDetector {

    public List<AvailableAnalysis> availableAnalyses(Collection<ColumnDescriptor> columns) {
        return Stream.of(AvailableAnalysis.values())
                .filter(a -> ColumnDescriptor.containsColumn(columns, a.getRequiredColumn()))
                .collect(Collectors.toList());
    }
}
