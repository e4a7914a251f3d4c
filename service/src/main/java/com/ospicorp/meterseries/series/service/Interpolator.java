package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.meter.model.SeasonalPattern;
import com.ospicorp.meterseries.series.model.DataPoint;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Fills a daily grid from irregularly spaced known values. Days between two known values are
 * interpolated, days outside the known range take the nearest known value.
 */
public final class Interpolator {
  private Interpolator() {
  }

  public static List<DataPoint> interpolate(NavigableMap<Instant, Double> known,
      List<LocalDate> days) {
    return interpolate(known, days, null);
  }

  /**
   * With a pattern, each step between consecutive timeline points is weighted by the multiplier of
   * the month it starts in, so a gap's delta lands mostly in the heavy months. Without one the
   * weight is elapsed time alone.
   */
  public static List<DataPoint> interpolate(NavigableMap<Instant, Double> known,
      List<LocalDate> days, SeasonalPattern pattern) {
    if (days.isEmpty()) {
      return List.of();
    }
    if (known.isEmpty()) {
      throw new IllegalArgumentException("at least one known value is required");
    }
    TreeMap<Instant, Double> timeline = new TreeMap<>(known);
    for (LocalDate day : days) {
      timeline.putIfAbsent(startOfDay(day), null);
    }

    Double[] values = new Double[timeline.size()];
    Instant[] instants = timeline.keySet().toArray(new Instant[0]);
    int i = 0;
    for (Map.Entry<Instant, Double> e : timeline.entrySet()) {
      values[i++] = e.getValue();
    }
    fillGaps(instants, values, pattern);
    values = backFill(forwardFill(values));

    Map<Instant, Double> filled = new TreeMap<>();
    for (int k = 0; k < instants.length; k++) {
      filled.put(instants[k], values[k]);
    }
    List<DataPoint> out = new ArrayList<>(days.size());
    for (LocalDate day : days) {
      out.add(new DataPoint(day, filled.get(startOfDay(day))));
    }
    return out;
  }

  private static void fillGaps(Instant[] instants, Double[] values, SeasonalPattern pattern) {
    int left = -1;
    for (int k = 0; k < values.length; k++) {
      if (values[k] == null) {
        continue;
      }
      if (left >= 0 && k - left > 1) {
        fillGap(instants, values, left, k, pattern);
      }
      left = k;
    }
  }

  private static void fillGap(Instant[] instants, Double[] values, int left, int right,
      SeasonalPattern pattern) {
    double[] cumulative = new double[right - left + 1];
    for (int k = left; k < right; k++) {
      double seconds = instants[k + 1].getEpochSecond() - instants[k].getEpochSecond()
          + (instants[k + 1].getNano() - instants[k].getNano()) / 1_000_000_000d;
      double weight = pattern == null ? seconds : seconds * pattern.multiplier(
          instants[k].atZone(ZoneOffset.UTC).getMonth());
      cumulative[k - left + 1] = cumulative[k - left] + weight;
    }
    double total = cumulative[cumulative.length - 1];
    if (pattern != null && total <= 0) {
      fillGap(instants, values, left, right, null);
      return;
    }
    double delta = values[right] - values[left];
    for (int k = left + 1; k < right; k++) {
      double fraction = total > 0 ? cumulative[k - left] / total : 0d;
      values[k] = values[left] + delta * fraction;
    }
  }

  private static Double[] forwardFill(Double[] in) {
    Double[] out = new Double[in.length];
    Double last = null;
    for (int k = 0; k < in.length; k++) {
      last = (in[k] != null) ? in[k] : last;
      out[k] = last;
    }
    return out;
  }

  private static Double[] backFill(Double[] in) {
    Double[] out = new Double[in.length];
    Double next = null;
    for (int k = in.length - 1; k >= 0; --k) {
      next = (in[k] != null) ? in[k] : next;
      out[k] = next;
    }
    return out;
  }

  static Instant startOfDay(LocalDate day) {
    return day.atStartOfDay(ZoneOffset.UTC).toInstant();
  }
}
