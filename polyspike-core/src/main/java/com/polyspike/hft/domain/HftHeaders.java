package com.polyspike.hft.domain;

import lombok.experimental.UtilityClass;

@UtilityClass
public class HftHeaders {

  /**
   * The executor service refuses LIVE order requests unless this header is {@code true}.
   */
  public static final String LIVE_ACK = "X-Hft-Live-Ack";
}
