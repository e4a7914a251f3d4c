package com.ospicorp.meterseries.meter.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Month;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeasonalPatternTest {

  @Test
  void percentagesAreNormalizedBeforeConversion() {
    // sums to 102, normalized to a uniform 100/12 per month
    SeasonalPattern pattern = SeasonalPattern.fromMonthlyPercentages(
        Collections.nCopies(12, 8.5));
    for (Month month : Month.values()) {
      assertEquals(1d, pattern.multiplier(month), 1e-12);
    }
  }

  @Test
  void winterHeavyPercentagesGiveWinterHeavyMultipliers() {
    List<Double> percentages = List.of(16d, 14d, 12d, 8d, 5d, 3d, 2d, 2d, 4d, 8d, 12d, 14d);
    SeasonalPattern pattern = SeasonalPattern.fromMonthlyPercentages(percentages);

    assertEquals(16d / (100d / 12d), pattern.multiplier(Month.JANUARY), 1e-12);
    assertEquals(2d / (100d / 12d), pattern.multiplier(Month.JULY), 1e-12);
    double sum = 0d;
    for (double m : pattern.multipliers()) {
      sum += m;
    }
    assertEquals(12d, sum, 1e-9);
  }

  @Test
  void rejectsWrongMonthCount() {
    assertThrows(IllegalArgumentException.class,
        () -> SeasonalPattern.fromMonthlyPercentages(Collections.nCopies(11, 9.0)));
    assertThrows(IllegalArgumentException.class,
        () -> SeasonalPattern.fromMonthlyPercentages(null));
  }

  @Test
  void rejectsSumOutsideTolerance() {
    assertThrows(IllegalArgumentException.class,
        () -> SeasonalPattern.fromMonthlyPercentages(Collections.nCopies(12, 7.0)));
    assertThrows(IllegalArgumentException.class,
        () -> SeasonalPattern.fromMonthlyPercentages(Collections.nCopies(12, 9.0)));
  }

  @Test
  void rejectsNegativeShares() {
    List<Double> percentages = new ArrayList<>(Collections.nCopies(12, 100d / 11d));
    percentages.set(3, -1d);
    assertThrows(IllegalArgumentException.class,
        () -> SeasonalPattern.fromMonthlyPercentages(percentages));
  }
}
