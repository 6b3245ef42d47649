package com.polyspike.hft.polymarket.api;

import java.math.BigDecimal;

public record ExecutorAccountResponse(
    String mode,
    String makerAddress,
    BigDecimal usdcBalance
) {
}
