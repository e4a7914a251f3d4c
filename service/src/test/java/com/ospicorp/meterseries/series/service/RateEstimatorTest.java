package com.ospicorp.meterseries.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.meterseries.series.model.MeterReading;
import com.ospicorp.meterseries.series.model.RateEstimate;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RateEstimatorTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static MeterReading at(int day, double value) {
    return new MeterReading(T0.plus(day, ChronoUnit.DAYS), value);
  }

  @Test
  void fewerThanTwoReadingsIsInsufficientData() {
    RateEstimate estimate = RateEstimator.estimate(List.of(at(0, 10d)));
    assertEquals(0d, estimate.ratePerDay());
    assertEquals(0d, estimate.confidence());
    assertEquals(RateEstimate.INSUFFICIENT_DATA, estimate.method());
    assertEquals(RateEstimate.INSUFFICIENT_DATA, RateEstimator.estimate(List.of()).method());
  }

  @Test
  void twoReadingsUseFirstLastSlope() {
    RateEstimate estimate = RateEstimator.estimate(List.of(at(10, 150d), at(20, 200d)));
    assertEquals(5d, estimate.ratePerDay(), 1e-9);
    assertEquals("simple_first_last", estimate.method());
  }

  @Test
  void wellFittingTrendUsesPrimaryRegression() {
    List<MeterReading> readings = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      readings.add(at(i * 7, 1000d + 14d * i + (i % 2 == 0 ? 0.5 : -0.5)));
    }
    RateEstimate estimate = RateEstimator.estimate(readings);
    assertTrue(estimate.method().startsWith("regression_r2_"), estimate.method());
    assertEquals(2d, estimate.ratePerDay(), 0.01);
    assertTrue(estimate.confidence() > 0.99);
  }

  @Test
  void weakFitFallsBackToCrossCheck() {
    // R² = 0.691: below the primary gate, above the cross-check gate
    RateEstimate estimate = RateEstimator.estimate(
        List.of(at(0, 0d), at(1, 2d), at(2, 1d), at(3, 4d)));
    assertEquals("cross_check_regression_r2_0.691", estimate.method());
    assertEquals(1.1d, estimate.ratePerDay(), 1e-9);
    assertEquals(0.691d, estimate.confidence(), 1e-3);
  }

  @Test
  void threeReadingsUseMedianPairwiseRate() {
    RateEstimate estimate = RateEstimator.estimate(List.of(at(0, 0d), at(1, 10d), at(2, 12d)));
    assertEquals("median_pairwise", estimate.method());
    assertEquals(6d, estimate.ratePerDay(), 1e-9);
    assertEquals(0d, estimate.confidence());
  }

  @Test
  void decreasingReadingsNeverYieldNegativeRate() {
    RateEstimate estimate = RateEstimator.estimate(List.of(at(0, 100d), at(10, 50d)));
    assertEquals(0d, estimate.ratePerDay());
  }

  @Test
  void medianIgnoresPairsWithoutElapsedTime() {
    double rate = RateEstimator.medianPairwiseRate(new double[]{0d, 0d, 2d},
        new double[]{0d, 5d, 4d});
    // pairs: (0,2) -> 2, (1,2) -> -0.5
    assertEquals(0.75d, rate, 1e-9);
  }
}
