package com.polyspike.hft.polymarket.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient readers for Gamma market/event payloads, whose field names and encodings vary between endpoints.
 */
@UtilityClass
public class PolymarketMarketParser {

  public static String question(JsonNode market) {
    String q = text(market, "question");
    if (q == null || q.isBlank()) {
      q = text(market, "title");
    }
    return q == null ? null : q.trim();
  }

  public static String id(JsonNode market) {
    String id = text(market, "id");
    if (id == null || id.isBlank()) {
      id = text(market, "marketId");
    }
    if (id == null || id.isBlank()) {
      id = text(market, "conditionId");
    }
    return id == null ? null : id.trim();
  }

  public static String slug(JsonNode node) {
    String slug = text(node, "slug");
    return slug == null ? null : slug.trim();
  }

  public static boolean isLive(JsonNode market) {
    if (market == null || market.isNull()) {
      return false;
    }
    if (market.hasNonNull("active") && !market.get("active").asBoolean(true)) {
      return false;
    }
    if (market.hasNonNull("closed") && market.get("closed").asBoolean(false)) {
      return false;
    }
    if (market.hasNonNull("archived") && market.get("archived").asBoolean(false)) {
      return false;
    }
    String status = text(market, "status");
    if (status != null) {
      String s = status.trim().toLowerCase(Locale.ROOT);
      return !(s.contains("resolved") || s.contains("closed") || s.contains("final"));
    }
    return true;
  }

  /**
   * Markets of an event payload ({@code {"markets": [...]}}), or the payload itself when it is a market list.
   */
  public static List<JsonNode> extractMarkets(JsonNode root) {
    if (root == null || root.isNull()) {
      return List.of();
    }
    if (root.isArray()) {
      return asList(root);
    }
    if (root.has("markets") && root.get("markets").isArray()) {
      return asList(root.get("markets"));
    }
    if (root.has("data") && root.get("data").isArray()) {
      return asList(root.get("data"));
    }
    return List.of();
  }

  /**
   * The market's two outcome tokens, from {@code outcomes}/{@code clobTokenIds} (arrays or JSON-encoded strings),
   * from a {@code tokens} array, or from flat yes/no fields.
   */
  public static Optional<OutcomeTokens> outcomeTokens(JsonNode market, ObjectMapper objectMapper) {
    if (market == null || market.isNull()) {
      return Optional.empty();
    }
    Optional<OutcomeTokens> fromGammaFields = fromOutcomesAndClobTokenIds(market, objectMapper);
    if (fromGammaFields.isPresent()) {
      return fromGammaFields;
    }
    Optional<OutcomeTokens> fromTokensArray = fromTokensArray(market);
    if (fromTokensArray.isPresent()) {
      return fromTokensArray;
    }
    return fromFlatFields(market);
  }

  private static Optional<OutcomeTokens> fromOutcomesAndClobTokenIds(JsonNode market, ObjectMapper objectMapper) {
    JsonNode tokenIdsNode = market.get("clobTokenIds");
    if (tokenIdsNode == null) {
      tokenIdsNode = market.get("clob_token_ids");
    }
    if (tokenIdsNode == null) {
      return Optional.empty();
    }
    List<String> tokenIds = parseStringArray(tokenIdsNode, objectMapper);
    if (tokenIds.size() != 2) {
      return Optional.empty();
    }
    JsonNode outcomesNode = market.has("outcomes") ? market.get("outcomes") : market.get("outcome");
    List<String> outcomes = parseStringArray(outcomesNode, objectMapper);
    String first = outcomes.size() == 2 ? outcomes.get(0).trim() : "Yes";
    String second = outcomes.size() == 2 ? outcomes.get(1).trim() : "No";
    return build(tokenIds.get(0), first, tokenIds.get(1), second);
  }

  private static Optional<OutcomeTokens> fromTokensArray(JsonNode market) {
    JsonNode tokens = market.get("tokens");
    if (tokens == null || !tokens.isArray() || tokens.size() != 2) {
      return Optional.empty();
    }
    List<String> ids = new ArrayList<>(2);
    List<String> labels = new ArrayList<>(2);
    for (JsonNode t : tokens) {
      String tokenId = firstText(t, List.of("token_id", "tokenId", "asset_id"));
      if (tokenId == null || tokenId.isBlank()) {
        return Optional.empty();
      }
      String outcome = firstText(t, List.of("outcome", "name"));
      ids.add(tokenId);
      labels.add(outcome == null ? "" : outcome.trim());
    }
    return build(ids.get(0), labels.get(0), ids.get(1), labels.get(1));
  }

  private static Optional<OutcomeTokens> fromFlatFields(JsonNode market) {
    String yes = firstText(market, List.of("yesTokenId", "yes_token_id", "yes_token"));
    String no = firstText(market, List.of("noTokenId", "no_token_id", "no_token"));
    return build(yes, "Yes", no, "No");
  }

  private static Optional<OutcomeTokens> build(String a, String outcomeA, String b, String outcomeB) {
    if (a == null || a.isBlank() || b == null || b.isBlank() || a.trim().equals(b.trim())) {
      return Optional.empty();
    }
    return Optional.of(new OutcomeTokens(a.trim(), outcomeA, b.trim(), outcomeB));
  }

  private static List<JsonNode> asList(JsonNode arrayNode) {
    List<JsonNode> list = new ArrayList<>(arrayNode.size());
    for (JsonNode n : arrayNode) {
      list.add(n);
    }
    return list;
  }

  private static List<String> parseStringArray(JsonNode node, ObjectMapper objectMapper) {
    if (node == null || node.isNull()) {
      return List.of();
    }
    if (node.isArray()) {
      List<String> out = new ArrayList<>(node.size());
      for (JsonNode n : node) {
        if (n != null && !n.isNull()) {
          out.add(n.asText());
        }
      }
      return out;
    }
    if (node.isTextual()) {
      String raw = node.asText();
      if (raw == null || raw.isBlank()) {
        return List.of();
      }
      try {
        return parseStringArray(objectMapper.readTree(raw), objectMapper);
      } catch (Exception e) {
        return List.of();
      }
    }
    return List.of();
  }

  private static String firstText(JsonNode node, List<String> keys) {
    for (String k : keys) {
      String v = text(node, k);
      if (v != null && !v.isBlank()) {
        return v;
      }
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    if (node == null || node.isNull() || field == null) {
      return null;
    }
    JsonNode v = node.get(field);
    if (v == null || v.isNull()) {
      return null;
    }
    return v.asText(null);
  }
}
