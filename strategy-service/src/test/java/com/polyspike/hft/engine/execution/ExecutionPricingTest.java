package com.polyspike.hft.engine.execution;

import com.polyspike.hft.engine.venue.DepthLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionPricingTest {

    @Test
    void topLevelCoversTargetAtItsOwnPrice() {
        ExecutionPricing.Fill fill = ExecutionPricing.sweep(List.of(level("0.50", "100"), level("0.40", "100")),
                new BigDecimal("30"));

        assertThat(fill.shares()).isEqualByComparingTo("30");
        assertThat(fill.avgPrice()).isEqualByComparingTo("0.50");
        assertThat(fill.worstPrice()).isEqualByComparingTo("0.50");
        assertThat(fill.partial()).isFalse();
    }

    @Test
    void thinTopSweepsDeeperLevelsAtWeightedAverage() {
        ExecutionPricing.Fill fill = ExecutionPricing.sweep(List.of(level("0.50", "10"), level("0.40", "30")),
                new BigDecimal("20"));

        assertThat(fill.shares()).isEqualByComparingTo("20");
        assertThat(fill.avgPrice()).isEqualByComparingTo("0.450000");
        assertThat(fill.worstPrice()).isEqualByComparingTo("0.40");
        assertThat(fill.partial()).isFalse();
    }

    @Test
    void shallowBookGivesPartialFill() {
        ExecutionPricing.Fill fill = ExecutionPricing.sweep(List.of(level("0.50", "20"), level("0.49", "10")),
                new BigDecimal("50"));

        assertThat(fill.shares()).isEqualByComparingTo("30");
        assertThat(fill.avgPrice()).isEqualByComparingTo("0.496667");
        assertThat(fill.partial()).isTrue();
    }

    @Test
    void levelsWithoutSizeAddNoDepth() {
        ExecutionPricing.Fill fill = ExecutionPricing.sweep(List.of(level("0.50", "0"), level("0.45", "5")),
                new BigDecimal("10"));

        assertThat(fill.shares()).isEqualByComparingTo("5");
        assertThat(fill.avgPrice()).isEqualByComparingTo("0.45");

        assertThat(ExecutionPricing.sweep(List.of(level("0.50", "0")), BigDecimal.TEN).isEmpty()).isTrue();
    }

    @Test
    void nothingToFillIsEmpty() {
        assertThat(ExecutionPricing.sweep(List.of(), BigDecimal.TEN).isEmpty()).isTrue();
        assertThat(ExecutionPricing.sweep(List.of(level("0.5", "10")), BigDecimal.ZERO).isEmpty()).isTrue();
    }

    private static DepthLevel level(String price, String size) {
        return new DepthLevel(new BigDecimal(price), new BigDecimal(size));
    }
}
