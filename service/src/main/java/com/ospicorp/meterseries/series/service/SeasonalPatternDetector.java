package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.meter.model.SeasonalPattern;
import com.ospicorp.meterseries.series.model.MeterReading;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives monthly multipliers from reading history: the per-month median daily rate relative to
 * the median over all months that have data.
 */
public final class SeasonalPatternDetector {
  private static final Logger log = LoggerFactory.getLogger(SeasonalPatternDetector.class);

  public static final int MIN_READINGS = 24;

  private SeasonalPatternDetector() {
  }

  public static Optional<SeasonalPattern> detect(List<MeterReading> readings) {
    if (readings.size() < MIN_READINGS) {
      return Optional.empty();
    }
    List<List<Double>> ratesByMonth = new ArrayList<>(12);
    for (int m = 0; m < 12; m++) {
      ratesByMonth.add(new ArrayList<>());
    }
    for (int i = 1; i < readings.size(); i++) {
      MeterReading prev = readings.get(i - 1);
      MeterReading curr = readings.get(i);
      double days = RateEstimator.daysBetween(prev.timestamp(), curr.timestamp());
      if (days <= 0) {
        continue;
      }
      double rate = Math.max(0d, (curr.value() - prev.value()) / days);
      Instant midpoint = prev.timestamp().plus(
          Duration.between(prev.timestamp(), curr.timestamp()).dividedBy(2));
      int month = midpoint.atZone(ZoneOffset.UTC).getMonthValue();
      ratesByMonth.get(month - 1).add(rate);
    }

    Median median = new Median();
    double[] monthly = new double[12];
    boolean[] present = new boolean[12];
    List<Double> observed = new ArrayList<>();
    for (int m = 0; m < 12; m++) {
      List<Double> rates = ratesByMonth.get(m);
      if (rates.isEmpty()) {
        continue;
      }
      monthly[m] = median.evaluate(rates.stream().mapToDouble(Double::doubleValue).toArray());
      present[m] = true;
      observed.add(monthly[m]);
    }
    if (observed.isEmpty()) {
      return Optional.empty();
    }
    double overall = median.evaluate(observed.stream().mapToDouble(Double::doubleValue).toArray());
    if (overall <= 0) {
      log.debug("No seasonal pattern: median monthly rate is {}", overall);
      return Optional.empty();
    }
    double[] multipliers = new double[12];
    for (int m = 0; m < 12; m++) {
      multipliers[m] = present[m] ? monthly[m] / overall : 1d;
    }
    return Optional.of(SeasonalPattern.ofMultipliers(multipliers));
  }
}
