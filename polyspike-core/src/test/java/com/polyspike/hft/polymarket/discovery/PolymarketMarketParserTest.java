package com.polyspike.hft.polymarket.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PolymarketMarketParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void outcomeTokens_supportsUpDownOutcomesFromGammaStrings() throws Exception {
    JsonNode market = objectMapper.readTree("""
        {
          "active": true,
          "outcomes": "[\\"Up\\", \\"Down\\"]",
          "clobTokenIds": "[\\"111\\", \\"222\\"]"
        }
        """);

    Optional<OutcomeTokens> tokens = PolymarketMarketParser.outcomeTokens(market, objectMapper);
    assertThat(tokens).isPresent();
    assertThat(tokens.get().primaryTokenId()).isEqualTo("111");
    assertThat(tokens.get().primaryOutcome()).isEqualTo("Up");
    assertThat(tokens.get().pairedTokenId()).isEqualTo("222");
    assertThat(tokens.get().pairedOutcome()).isEqualTo("Down");
  }

  @Test
  void outcomeTokens_readsTokensArray() throws Exception {
    JsonNode market = objectMapper.readTree("""
        {"tokens": [{"token_id": "a1", "outcome": "Yes"}, {"token_id": "b2", "outcome": "No"}]}
        """);

    Optional<OutcomeTokens> tokens = PolymarketMarketParser.outcomeTokens(market, objectMapper);
    assertThat(tokens).contains(new OutcomeTokens("a1", "Yes", "b2", "No"));
  }

  @Test
  void outcomeTokens_rejectsNonBinaryOrDuplicateTokens() throws Exception {
    JsonNode threeWay = objectMapper.readTree("""
        {"clobTokenIds": ["1", "2", "3"], "outcomes": ["A", "B", "C"]}
        """);
    JsonNode duplicate = objectMapper.readTree("""
        {"clobTokenIds": ["7", "7"]}
        """);

    assertThat(PolymarketMarketParser.outcomeTokens(threeWay, objectMapper)).isEmpty();
    assertThat(PolymarketMarketParser.outcomeTokens(duplicate, objectMapper)).isEmpty();
  }

  @Test
  void isLive_falseForClosedOrResolvedMarkets() throws Exception {
    assertThat(PolymarketMarketParser.isLive(objectMapper.readTree("{\"active\": true, \"closed\": false}"))).isTrue();
    assertThat(PolymarketMarketParser.isLive(objectMapper.readTree("{\"closed\": true}"))).isFalse();
    assertThat(PolymarketMarketParser.isLive(objectMapper.readTree("{\"status\": \"RESOLVED\"}"))).isFalse();
  }

  @Test
  void extractMarkets_readsEventPayload() throws Exception {
    JsonNode event = objectMapper.readTree("""
        {"slug": "btc-updown", "markets": [{"id": "10"}, {"id": "11"}]}
        """);

    List<JsonNode> markets = PolymarketMarketParser.extractMarkets(event);
    assertThat(markets).extracting(PolymarketMarketParser::id).containsExactly("10", "11");
    assertThat(PolymarketMarketParser.slug(event)).isEqualTo("btc-updown");
  }
}
