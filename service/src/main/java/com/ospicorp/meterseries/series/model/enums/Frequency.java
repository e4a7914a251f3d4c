package com.ospicorp.meterseries.series.model.enums;

import java.util.Locale;

public enum Frequency {
  D,
  W,
  M,
  Q,
  A;

  public static Frequency fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("freq must be provided");
    }
    try {
      return Frequency.valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported frequency: " + code, ex);
    }
  }
}
