package com.ospicorp.meterseries.meter.model;

import java.time.Month;
import java.util.Arrays;
import java.util.List;

/**
 * Twelve monthly multipliers relative to a uniform 1/12 share of the annual consumption.
 */
public final class SeasonalPattern {
  private static final double MIN_PERCENT_SUM = 95.0;
  private static final double MAX_PERCENT_SUM = 105.0;

  private final double[] multipliers;

  private SeasonalPattern(double[] multipliers) {
    this.multipliers = multipliers;
  }

  public static SeasonalPattern ofMultipliers(double[] multipliers) {
    if (multipliers == null || multipliers.length != 12) {
      throw new IllegalArgumentException("a seasonal pattern needs exactly 12 monthly multipliers");
    }
    for (double multiplier : multipliers) {
      if (!Double.isFinite(multiplier) || multiplier < 0) {
        throw new IllegalArgumentException("seasonal multipliers must be finite and non-negative");
      }
    }
    return new SeasonalPattern(multipliers.clone());
  }

  /**
   * Builds a pattern from the share of annual consumption per month, January first. The shares
   * must add up to roughly 100 and are normalized to exactly 100 before conversion.
   */
  public static SeasonalPattern fromMonthlyPercentages(List<Double> percentages) {
    if (percentages == null || percentages.size() != 12) {
      int size = percentages == null ? 0 : percentages.size();
      throw new IllegalArgumentException(
          "seasonal pattern must have exactly 12 monthly values, got " + size);
    }
    double total = 0d;
    for (Double percent : percentages) {
      if (percent == null || percent < 0) {
        throw new IllegalArgumentException("seasonal percentages must be non-negative numbers");
      }
      total += percent;
    }
    if (total < MIN_PERCENT_SUM || total > MAX_PERCENT_SUM) {
      throw new IllegalArgumentException(
          String.format("seasonal percentages sum to %.1f%%, expected ~100%%", total));
    }
    double uniformShare = 100d / 12d;
    double[] multipliers = new double[12];
    for (int i = 0; i < 12; i++) {
      double normalized = percentages.get(i) * 100d / total;
      multipliers[i] = normalized / uniformShare;
    }
    return new SeasonalPattern(multipliers);
  }

  public double multiplier(Month month) {
    return multipliers[month.getValue() - 1];
  }

  public double[] multipliers() {
    return multipliers.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SeasonalPattern other && Arrays.equals(multipliers, other.multipliers);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(multipliers);
  }

  @Override
  public String toString() {
    return "SeasonalPattern" + Arrays.toString(multipliers);
  }
}
