package com.polyspike.hft.polymarket.clob;

public final class PolymarketClobPaths {

  public static final String BOOK = "/book";
  public static final String BOOKS = "/books";
  public static final String PRICE = "/price";

  private PolymarketClobPaths() {
  }
}
