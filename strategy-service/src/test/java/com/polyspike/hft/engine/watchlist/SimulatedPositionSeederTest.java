package com.polyspike.hft.engine.watchlist;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.TestProperties;
import com.polyspike.hft.engine.state.TradingState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedPositionSeederTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void inlinePositionsAreSeededAndPairedByEvent() {
        HftProperties.Simulation config = TestProperties.of(
                "hft.engine.simulation.initial-positions[0].asset=yes-1",
                "hft.engine.simulation.initial-positions[0].shares=10",
                "hft.engine.simulation.initial-positions[0].avg-price=0.40",
                "hft.engine.simulation.initial-positions[0].event-slug=election",
                "hft.engine.simulation.initial-positions[0].outcome=Yes",
                "hft.engine.simulation.initial-positions[1].asset=no-1",
                "hft.engine.simulation.initial-positions[1].shares=5",
                "hft.engine.simulation.initial-positions[1].avg-price=0.60",
                "hft.engine.simulation.initial-positions[1].event-slug=election",
                "hft.engine.simulation.initial-positions[1].outcome=No",
                "hft.engine.simulation.initial-positions[2].asset=lonely",
                "hft.engine.simulation.initial-positions[2].shares=1",
                "hft.engine.simulation.initial-positions[2].avg-price=0.10").engine().simulation();
        TradingState state = new TradingState(10, 3, BigDecimal.ZERO);

        Watchlist watchlist = new SimulatedPositionSeeder(config, objectMapper).seed(state);

        assertThat(watchlist.pairs()).singleElement().satisfies(pair -> {
            assertThat(pair.first()).isEqualTo("yes-1");
            assertThat(pair.second()).isEqualTo("no-1");
            assertThat(pair.secondMeta().outcome()).isEqualTo("No");
        });
        assertThat(watchlist.singles()).extracting(Watchlist.Single::instrument).containsExactly("lonely");
        assertThat(state.findPosition("yes-1").orElseThrow().shares()).isEqualByComparingTo("10");
        assertThat(state.getPositions()).containsOnlyKeys("election", "lonely");
    }

    @Test
    void invalidEntriesAreIgnored() {
        HftProperties.Simulation config = TestProperties.of(
                "hft.engine.simulation.initial-positions[0].asset=ok",
                "hft.engine.simulation.initial-positions[0].shares=1",
                "hft.engine.simulation.initial-positions[0].avg-price=0.5",
                "hft.engine.simulation.initial-positions[1].asset=zero",
                "hft.engine.simulation.initial-positions[1].shares=0",
                "hft.engine.simulation.initial-positions[1].avg-price=0.5",
                "hft.engine.simulation.initial-positions[2].shares=3",
                "hft.engine.simulation.initial-positions[2].avg-price=0.5").engine().simulation();
        TradingState state = new TradingState(10, 3, BigDecimal.ZERO);

        Watchlist watchlist = new SimulatedPositionSeeder(config, objectMapper).seed(state);

        assertThat(watchlist.instrumentCount()).isEqualTo(1);
        assertThat(state.findPosition("zero")).isEmpty();
    }

    @Test
    void positionsFileIsReadWhenNothingIsInline(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("positions.json");
        Files.writeString(file, """
                {"positions": [
                  {"asset": "a", "shares": 2, "avgPrice": 0.3, "eventSlug": "ev", "outcome": "Yes"},
                  {"asset": "b", "shares": 4, "avgPrice": 0.7, "eventSlug": "ev", "outcome": "No"}
                ]}
                """);
        HftProperties.Simulation config = TestProperties.of(
                "hft.engine.simulation.initial-positions-file=" + file,
                "hft.engine.simulation.auto-pair=false").engine().simulation();
        TradingState state = new TradingState(10, 3, BigDecimal.ZERO);

        Watchlist watchlist = new SimulatedPositionSeeder(config, objectMapper).seed(state);

        assertThat(watchlist.pairs()).isEmpty();
        assertThat(watchlist.singles()).extracting(Watchlist.Single::instrument).containsExactly("a", "b");
        assertThat(state.findPosition("b").orElseThrow().avgPrice()).isEqualByComparingTo("0.7");
    }

    @Test
    void unreadableFileSeedsNothing(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");
        HftProperties.Simulation config = TestProperties.of(
                "hft.engine.simulation.initial-positions-file=" + file).engine().simulation();

        Watchlist watchlist = new SimulatedPositionSeeder(config, objectMapper).seed(new TradingState(10, 3, BigDecimal.ZERO));

        assertThat(watchlist.isEmpty()).isTrue();
    }
}
