package com.polyspike.hft.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class HftPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "hft.mode=LIVE",
        "hft.executor.base-url=http://executor:8080",
        "hft.risk.kill-switch=true",
        "hft.engine.max-concurrent-trades=5",
        "hft.engine.trading.trade-unit-usd=25",
        "hft.engine.spike.threshold=0.03",
        "hft.engine.spike.threshold-down=0.05",
        "hft.engine.spike.lookback-mode=TIME_SPAN",
        "hft.engine.watchlist.source=SLUGS",
        "hft.engine.watchlist.event-slugs[0]=btc-updown",
        "hft.engine.watchlist.event-slugs[1]= eth-updown ",
        "hft.engine.watchlist.asset-pairs[0]=111:222"
    ).run(context -> {
      HftProperties properties = context.getBean(HftProperties.class);

      assertThat(properties.mode()).isEqualTo(HftProperties.TradingMode.LIVE);
      assertThat(properties.simulation()).isFalse();
      assertThat(properties.executor().baseUrl()).isEqualTo("http://executor:8080");
      assertThat(properties.risk().killSwitch()).isTrue();

      HftProperties.Engine engine = properties.engine();
      assertThat(engine.maxConcurrentTrades()).isEqualTo(5);
      assertThat(engine.trading().tradeUnitUsd()).isEqualByComparingTo("25");
      assertThat(engine.spike().thresholdUp()).isEqualTo(0.03);
      assertThat(engine.spike().thresholdDown()).isEqualTo(0.05);
      assertThat(engine.spike().lookbackMode()).isEqualTo(HftProperties.LookbackMode.TIME_SPAN);
      assertThat(engine.watchlist().source()).isEqualTo(HftProperties.WatchlistSource.SLUGS);
      assertThat(engine.watchlist().eventSlugs()).containsExactly("btc-updown", "eth-updown");
      assertThat(engine.watchlist().assetPairs()).containsExactly("111:222");
    });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    runner.run(context -> {
      HftProperties properties = context.getBean(HftProperties.class);

      assertThat(properties.mode()).isEqualTo(HftProperties.TradingMode.PAPER);
      assertThat(properties.simulation()).isTrue();
      assertThat(properties.risk().maxOrderNotionalUsd()).isEqualByComparingTo(BigDecimal.ZERO);

      HftProperties.Engine engine = properties.engine();
      assertThat(engine.priceHistorySize()).isEqualTo(100);
      assertThat(engine.maxConcurrentTrades()).isEqualTo(3);
      assertThat(engine.spike().threshold()).isEqualTo(0.02);
      assertThat(engine.spike().thresholdUp()).isEqualTo(0.02);
      assertThat(engine.spike().priceLowerBound()).isEqualByComparingTo("0.20");
      assertThat(engine.spike().priceUpperBound()).isEqualByComparingTo("0.80");
      assertThat(engine.pairArbitrage().entrySumThreshold()).isEqualByComparingTo("0.995");
      assertThat(engine.supervisor().maxConsecutiveFailures()).isEqualTo(5);
      assertThat(engine.simulation().startingBalanceUsd()).isEqualByComparingTo("10000");
      assertThat(engine.watchlist().eventSlugs()).isEmpty();
    });
  }

  @Test
  void rejectsInvalidValues() {
    runner.withPropertyValues("hft.engine.max-concurrent-trades=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(HftProperties.class)
  static class TestConfig {
  }
}
