package com.ospicorp.meterseries.meter.model;

import java.util.Locale;

public enum MeterUnit {
  KWH("kWh"),
  CUBIC_METRE("m³"),
  LITRE("L");

  private final String symbol;

  MeterUnit(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /**
   * Parses the symbols used in meter definitions. {@code m3} is accepted as an ASCII spelling of
   * {@code m³}.
   */
  public static MeterUnit fromSymbol(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("unit must be provided");
    }
    String normalized = symbol.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "kwh" -> KWH;
      case "m³", "m3" -> CUBIC_METRE;
      case "l" -> LITRE;
      default -> throw new IllegalArgumentException("Unsupported unit: " + symbol);
    };
  }

  @Override
  public String toString() {
    return symbol;
  }
}
