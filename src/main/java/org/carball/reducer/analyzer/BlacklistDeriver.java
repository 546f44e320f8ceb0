package org.carball.reducer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.grain.Severity;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the metric/grain combinations that are known to be wrong or risky for a dataset.
 * Rules are evaluated in declaration order and findings keep that order.
 */
@Slf4j
public class BlacklistDeriver {

    public static final String ORDER_TOTAL_AMOUNT = "order_total_amount";
    public static final String ITEM_SUBTOTAL = "item_subtotal";
    public static final String PAID_AT = "paid_at";

    static final List<String> RAW_AMOUNT_COLUMNS = List.of(ORDER_TOTAL_AMOUNT, ITEM_SUBTOTAL);

    public static final List<BlacklistRule> DEFAULT_RULES = List.of(
            BlacklistRule.of("order-amount-at-item-grain",
                    ctx -> ctx.hasGrain(Grain.ITEM) && ctx.hasColumn(ORDER_TOTAL_AMOUNT),
                    Grain.ITEM, ORDER_TOTAL_AMOUNT,
                    "Order-level amounts are counted once per item row and get double-counted at item grain",
                    Severity.BLOCK),
            BlacklistRule.of("item-subtotal-at-order-grain",
                    ctx -> ctx.hasGrain(Grain.ORDER) && ctx.hasColumn(ITEM_SUBTOTAL),
                    Grain.ORDER, ITEM_SUBTOTAL,
                    "Item-level amounts lose their meaning at order grain",
                    Severity.BLOCK),
            new BlacklistRule("raw-amount-at-member-grain",
                    ctx -> ctx.hasGrain(Grain.MEMBER) && !ctx.presentColumns(RAW_AMOUNT_COLUMNS).isEmpty(),
                    Grain.MEMBER, ctx -> ctx.presentColumns(RAW_AMOUNT_COLUMNS),
                    "Member-level analysis needs amounts aggregated first; raw amount columns are easily misread",
                    Severity.WARNING),
            BlacklistRule.of("nullable-payment-time",
                    ctx -> ctx.hasNullableColumn(PAID_AT),
                    null, PAID_AT,
                    "Payment time has missing values and must be paired with order status filtering",
                    Severity.WARNING)
    );

    private final List<BlacklistRule> rules;

    public BlacklistDeriver() {
        this(DEFAULT_RULES);
    }

    public BlacklistDeriver(List<BlacklistRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<BlacklistFinding> derive(Set<Grain> grains, List<ColumnDescriptor> columns) {
        SchemaContext context = new SchemaContext(grains, columns);
        List<BlacklistFinding> findings = new ArrayList<>();

        for (BlacklistRule rule : rules) {
            Optional<BlacklistFinding> finding = rule.evaluate(context);
            if (finding.isPresent()) {
                log.debug("Blacklist rule {} fired: {}", rule.name(), finding.get());
                findings.add(finding.get());
            }
        }

        log.info("Derived {} blacklist findings for grains {}", findings.size(), grains);
        return List.copyOf(findings);
    }

    public List<BlacklistRule> getRules() {
        return rules;
    }
}
