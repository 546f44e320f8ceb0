package org.carball.reducer.analyzer;

import org.carball.reducer.model.analysis.GateDecision;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.grain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class AnalysisGateTest {

    private static final BlacklistFinding ORDER_AMOUNT_AT_ITEM = BlacklistFinding.of(
            Grain.ITEM, List.of("order_total_amount"), "double-counted", Severity.BLOCK);
    private static final BlacklistFinding RAW_AMOUNTS_AT_MEMBER = BlacklistFinding.of(
            Grain.MEMBER, List.of("order_total_amount", "item_subtotal"), "pre-aggregate", Severity.WARNING);
    private static final BlacklistFinding NULLABLE_PAID_AT = BlacklistFinding.of(
            null, List.of("paid_at"), "pair with status", Severity.WARNING);

    private AnalysisGate gate;

    @BeforeEach
    void setUp() {
        gate = new AnalysisGate();
    }

    @Test
    void shouldRejectBlockedCombination() {
        GateDecision decision = gate.evaluate(List.of(ORDER_AMOUNT_AT_ITEM), Grain.ITEM, "order_total_amount");

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.blocking()).containsExactly(ORDER_AMOUNT_AT_ITEM);
    }

    @Test
    void shouldAllowSameMetricAtAnotherGrain() {
        GateDecision decision = gate.evaluate(List.of(ORDER_AMOUNT_AT_ITEM), Grain.ORDER, "order_total_amount");

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.warnings()).isEmpty();
    }

    @Test
    void shouldAllowWithWarnings() {
        GateDecision decision = gate.evaluate(
                List.of(ORDER_AMOUNT_AT_ITEM, RAW_AMOUNTS_AT_MEMBER), Grain.MEMBER, "item_subtotal");

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.warnings()).containsExactly(RAW_AMOUNTS_AT_MEMBER);
    }

    @Test
    void shouldApplyAllGrainFindingsEverywhere() {
        for (Grain grain : Grain.values()) {
            GateDecision decision = gate.evaluate(List.of(NULLABLE_PAID_AT), grain, "paid_at");

            assertThat(decision.warnings()).containsExactly(NULLABLE_PAID_AT);
        }
    }

    @Test
    void shouldIgnoreFindingsForOtherMetrics() {
        GateDecision decision = gate.evaluate(
                List.of(ORDER_AMOUNT_AT_ITEM, NULLABLE_PAID_AT), Grain.ITEM, "item_subtotal");

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.blocking()).isEmpty();
        assertThat(decision.warnings()).isEmpty();
    }
}
