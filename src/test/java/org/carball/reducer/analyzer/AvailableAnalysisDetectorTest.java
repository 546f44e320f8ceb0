package org.carball.reducer.analyzer;

import org.carball.reducer.model.analysis.AvailableAnalysis;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.TypeTag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class AvailableAnalysisDetectorTest {

    private final AvailableAnalysisDetector detector = new AvailableAnalysisDetector();

    @Test
    void shouldOfferAnalysesForPresentColumns() {
        List<ColumnDescriptor> columns = List.of(
                ColumnDescriptor.of("purchase_time", TypeTag.TIMESTAMP),
                ColumnDescriptor.of("member_id", TypeTag.STRING),
                ColumnDescriptor.of("order_total_amount", TypeTag.FLOAT));

        assertThat(detector.availableAnalyses(columns)).containsExactly(
                AvailableAnalysis.TOTAL_AMOUNT_BY_DIMENSION,
                AvailableAnalysis.TIME_SERIES_TREND,
                AvailableAnalysis.MEMBER_RANKING);
    }

    @Test
    void shouldOfferNothingWithoutKnownColumns() {
        assertThat(detector.availableAnalyses(List.of(ColumnDescriptor.of("amount", TypeTag.FLOAT)))).isEmpty();
    }
}
