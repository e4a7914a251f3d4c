package com.ospicorp.meterseries.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsumptionCalculatorTest {

  private final ConsumptionCalculator calculator =
      new ConsumptionCalculator(EngineProperties.defaults());

  private static List<Double> values(List<ConsumptionPoint> points) {
    return points.stream().map(ConsumptionPoint::value).toList();
  }

  @Test
  void dailyConsumptionIsClippedDifference() {
    LocalDate d = LocalDate.of(2024, 1, 1);
    List<DataPoint> cumulative = List.of(new DataPoint(d, 10d), new DataPoint(d.plusDays(1), 12d),
        new DataPoint(d.plusDays(2), 11d), new DataPoint(d.plusDays(3), 15d));

    var out = calculator.consumption(cumulative, Frequency.D, MeterUnit.KWH);

    assertEquals(List.of(0d, 2d, 0d, 4d), values(out));
    assertEquals(MeterUnit.KWH, out.get(0).unit());
  }

  @Test
  void monthlyResetIsMeasuredFromMonthStart() {
    List<DataPoint> monthEnds = List.of(
        new DataPoint(LocalDate.of(2024, 1, 31), 100d),
        new DataPoint(LocalDate.of(2024, 2, 29), 150d),
        new DataPoint(LocalDate.of(2024, 3, 31), 20d),
        new DataPoint(LocalDate.of(2024, 4, 30), 70d));

    var out = calculator.consumption(monthEnds, Frequency.M, MeterUnit.CUBIC_METRE);

    assertEquals(List.of(0d, 50d, 0d, 50d), values(out));
    assertEquals(LocalDate.of(2024, 3, 31), out.get(2).date());
  }

  @Test
  void monthlyConsumptionReconcilesWithAnnual() {
    List<DataPoint> daily = new ArrayList<>();
    double value = 1234d;
    for (LocalDate d = LocalDate.of(2023, 1, 1); !d.isAfter(LocalDate.of(2023, 12, 31));
        d = d.plusDays(1)) {
      daily.add(new DataPoint(d, value));
      value += 3d + (d.getMonthValue() % 4) + (d.getDayOfMonth() % 3) * 0.25;
    }

    var monthly = calculator.consumption(daily, Frequency.M, MeterUnit.KWH);
    double sum = monthly.stream().mapToDouble(ConsumptionPoint::value).sum();

    assertEquals(12, monthly.size());
    assertEquals(calculator.annualConsumption(daily, 2023), sum, 1e-6);
    assertTrue(sum > 0);
  }

  @Test
  void missingBoundaryYieldsZeroMonth() {
    List<DataPoint> sparse = List.of(
        new DataPoint(LocalDate.of(2024, 1, 31), 100d),
        new DataPoint(LocalDate.of(2024, 6, 30), 200d));

    var out = calculator.consumption(sparse, Frequency.M, MeterUnit.KWH);

    assertEquals(6, out.size());
    assertEquals(0d, out.get(2).value());
    assertEquals(0d, out.get(3).value());
    out.forEach(p -> assertTrue(p.value() >= 0));
  }

  @Test
  void annualConsumptionOfEmptySeriesIsZero() {
    assertEquals(0d, calculator.annualConsumption(List.of(), 2024));
    assertTrue(calculator.consumption(List.of(), Frequency.M, MeterUnit.KWH).isEmpty());
  }
}
