package org.carball.reducer.analyzer;

import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;
import org.carball.reducer.model.schema.TypeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class GrainDetectorTest {

    private GrainDetector detector;

    @BeforeEach
    void setUp() {
        detector = new GrainDetector();
    }

    @Test
    void shouldDetectOrderGrainOnly() {
        // Given - no product_id, so no item grain
        List<ColumnDescriptor> columns = columns("order_id", "item_subtotal", "order_total_amount");

        // When
        Set<Grain> grains = detector.detect(columns);

        // Then
        assertThat(grains).containsExactly(Grain.ORDER);
    }

    @Test
    void shouldDetectEveryMarkedGrain() {
        Set<Grain> grains = detector.detect(columns("member_id", "product_id", "order_id"));

        assertThat(grains).containsExactlyInAnyOrder(Grain.ORDER, Grain.ITEM, Grain.MEMBER);
    }

    @Test
    void shouldReturnEmptySetWithoutMarkers() {
        assertThat(detector.detect(columns("amount", "status"))).isEmpty();
        assertThat(detector.detect(List.of())).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
    }

    @Test
    void shouldRequireExactCaseSensitiveMarkerNames() {
        Set<Grain> grains = detector.detect(columns("Order_ID", "order_number", "product_id_old", " member_id"));

        assertThat(grains).isEmpty();
    }

    @Test
    void shouldBeMonotonicInColumns() {
        // Given
        List<ColumnDescriptor> columns = new ArrayList<>(columns("order_id"));
        Set<Grain> before = detector.detect(columns);

        // When
        for (String extra : new String[]{"amount", "product_id", "member_id", "order_total_amount"}) {
            columns.add(ColumnDescriptor.of(extra, TypeTag.STRING));
            Set<Grain> after = detector.detect(columns);

            // Then
            assertThat(after).containsAll(before);
            before = after;
        }
        assertThat(before).containsExactlyInAnyOrder(Grain.ORDER, Grain.ITEM, Grain.MEMBER);
    }

    private static List<ColumnDescriptor> columns(String... names) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        for (String name : names) {
            columns.add(ColumnDescriptor.of(name, TypeTag.STRING));
        }
        return columns;
    }
}
