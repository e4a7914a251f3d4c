package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates a daily cumulative series to a coarser frequency. Each period keeps the last value
 * observed in it and is labelled with the period's last calendar day.
 */
public final class Resampler {
  private Resampler() {
  }

  public static List<DataPoint> aggregate(List<DataPoint> daily, Frequency to) {
    if (to == Frequency.D) return daily;
    Map<LocalDate, Double> buckets = new TreeMap<>();
    for (DataPoint p : daily) {
      buckets.put(periodEnd(p.date(), to), p.value());
    }
    List<DataPoint> out = new ArrayList<>(buckets.size());
    buckets.forEach((date, value) -> out.add(new DataPoint(date, value)));
    return out;
  }

  public static LocalDate periodEnd(LocalDate date, Frequency frequency) {
    return switch (frequency) {
      case D -> date;
      case W -> date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
      case M -> date.with(TemporalAdjusters.lastDayOfMonth());
      case Q -> endOfQuarter(date);
      case A -> date.with(TemporalAdjusters.lastDayOfYear());
    };
  }

  private static LocalDate endOfQuarter(LocalDate date) {
    int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
    return LocalDate.of(date.getYear(), quarterEndMonth, 1)
        .with(TemporalAdjusters.lastDayOfMonth());
  }
}
