package com.ospicorp.meterseries.series.model;

/**
 * Consumption rate in units per day together with the coefficient of determination of the fit
 * that produced it (0 for the non-regression methods) and a label naming that method.
 */
public record RateEstimate(double ratePerDay, double confidence, String method) {

  public static final String INSUFFICIENT_DATA = "insufficient_data";

  public static RateEstimate insufficientData() {
    return new RateEstimate(0d, 0d, INSUFFICIENT_DATA);
  }
}
