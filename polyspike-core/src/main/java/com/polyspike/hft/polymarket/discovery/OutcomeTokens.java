package com.polyspike.hft.polymarket.discovery;

/**
 * The two complementary outcome tokens of a binary market, in the venue's outcome order.
 */
public record OutcomeTokens(
    String primaryTokenId,
    String primaryOutcome,
    String pairedTokenId,
    String pairedOutcome
) {
}
