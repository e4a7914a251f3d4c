package com.ospicorp.meterseries.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.model.CompositionMode;
import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.MeterKind;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.meter.model.Period;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.MasterComposition;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MasterMeterComposerTest {
  private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);

  private final EngineProperties properties = EngineProperties.defaults();
  private final MasterMeterComposer composer =
      new MasterMeterComposer(properties, new UnitConverter(properties));

  private static List<DataPoint> linear(LocalDate from, int days, double start, double step) {
    List<DataPoint> out = new ArrayList<>(days);
    for (int i = 0; i < days; i++) {
      out.add(new DataPoint(from.plusDays(i), start + i * step));
    }
    return out;
  }

  private static Meter master(MeterUnit unit, Period... periods) {
    return new Meter("gas_total", "Gas total", null, unit, null, null,
        new MeterKind.Master(List.of(periods)), null);
  }

  private static Period period(int fromDay, int toDay, CompositionMode mode, MeterUnit unit,
      boolean offset, String... sources) {
    return new Period(JAN_1.plusDays(fromDay), JAN_1.plusDays(toDay), mode, List.of(sources), unit,
        offset);
  }

  private static double valueOn(List<DataPoint> series, LocalDate date) {
    return series.stream().filter(p -> p.date().equals(date)).findFirst().orElseThrow().value();
  }

  @Test
  void replacementMeterContinuesFromPreviousPeriod() {
    Meter master = master(MeterUnit.CUBIC_METRE,
        period(0, 9, CompositionMode.SINGLE, MeterUnit.CUBIC_METRE, false, "old"),
        period(10, 19, CompositionMode.SINGLE, MeterUnit.CUBIC_METRE, true, "new"));
    List<DataPoint> old = linear(JAN_1, 10, 100d, 10d);
    List<DataPoint> replacement = linear(JAN_1.plusDays(10), 10, 0d, 10d);
    Map<String, List<DataPoint>> daily = Map.of("old", old, "new", replacement);
    Map<String, List<DataPoint>> monthly = Map.of(
        "old", Resampler.aggregate(old, Frequency.M),
        "new", Resampler.aggregate(replacement, Frequency.M));

    MasterComposition composition = composer.compose(master, daily, monthly);

    List<DataPoint> series = composition.daily();
    assertEquals(20, series.size());
    double lastOfFirst = valueOn(series, JAN_1.plusDays(9));
    double firstOfSecond = valueOn(series, JAN_1.plusDays(10));
    assertTrue(Math.abs(lastOfFirst - firstOfSecond) < 1e-6);
    assertEquals(280d, valueOn(series, JAN_1.plusDays(19)), 1e-9);
    assertEquals(List.of(new DataPoint(LocalDate.of(2024, 1, 31), 280d)), composition.monthly());
    assertEquals(2, composition.monthlySegments().size());
  }

  @Test
  void sumModeTreatsMissingDatesAsZero() {
    Meter master = master(MeterUnit.KWH,
        period(0, 4, CompositionMode.SUM, MeterUnit.KWH, false, "a", "b"));
    Map<String, List<DataPoint>> daily = Map.of(
        "a", linear(JAN_1, 5, 10d, 1d),
        "b", linear(JAN_1.plusDays(3), 2, 100d, 1d));

    List<DataPoint> series = composer.compose(master, daily, Map.of()).daily();

    assertEquals(List.of(10d, 11d, 12d, 113d, 115d),
        series.stream().map(DataPoint::value).toList());
  }

  @Test
  void sourceUnitIsConvertedToMasterUnit() {
    Meter master = master(MeterUnit.KWH,
        period(0, 1, CompositionMode.SINGLE, MeterUnit.CUBIC_METRE, false, "gas_m3"));

    List<DataPoint> series = composer.compose(master,
        Map.of("gas_m3", linear(JAN_1, 2, 1d, 1d)), Map.of()).daily();

    double factor = properties.gasConversion().kwhPerCubicMetre();
    assertEquals(factor, series.get(0).value(), 1e-9);
    assertEquals(2 * factor, series.get(1).value(), 1e-9);
  }

  @Test
  void offsetIsSkippedWhenBoundaryValueIsTooFarAway() {
    Meter master = master(MeterUnit.KWH,
        period(0, 9, CompositionMode.SINGLE, MeterUnit.KWH, false, "old"),
        period(10, 29, CompositionMode.SINGLE, MeterUnit.KWH, true, "new"));
    Map<String, List<DataPoint>> daily = Map.of(
        "old", linear(JAN_1, 10, 100d, 1d),
        "new", linear(JAN_1.plusDays(20), 10, 5d, 1d));

    List<DataPoint> series = composer.compose(master, daily, Map.of()).daily();

    assertEquals(5d, valueOn(series, JAN_1.plusDays(20)), 1e-9);
  }

  @Test
  void offsetOnFirstPeriodHasNothingToContinueFrom() {
    Meter master = master(MeterUnit.KWH,
        period(0, 4, CompositionMode.SINGLE, MeterUnit.KWH, true, "only"));

    List<DataPoint> series = composer.compose(master,
        Map.of("only", linear(JAN_1, 5, 7d, 1d)), Map.of()).daily();

    assertEquals(7d, series.get(0).value());
  }

  @Test
  void rejectsNonMasterMeter() {
    assertThrows(IllegalArgumentException.class,
        () -> composer.compose(Meter.physical("x", MeterUnit.KWH), Map.of(), Map.of()));
  }
}
