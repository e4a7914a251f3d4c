package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns cumulative series into non-negative consumption.
 *
 * <p>Monthly consumption is measured between the values nearest to each month's first and last
 * instant. A month-end value at or above the previous month-end continues from it; a drop below
 * it, beyond the reset tolerance, marks a reset and the month is measured from its own start.
 */
@Component
public class ConsumptionCalculator {
  private static final Logger log = LoggerFactory.getLogger(ConsumptionCalculator.class);

  private final Duration boundaryTolerance;
  private final double resetTolerance;

  public ConsumptionCalculator(EngineProperties properties) {
    this.boundaryTolerance = properties.boundaries().consumptionTolerance();
    this.resetTolerance = properties.resetTolerance();
  }

  public List<ConsumptionPoint> consumption(List<DataPoint> cumulative, Frequency frequency,
      MeterUnit unit) {
    if (cumulative.isEmpty()) {
      return List.of();
    }
    if (frequency == Frequency.M) {
      return monthly(cumulative, unit);
    }
    return differences(cumulative, unit);
  }

  List<ConsumptionPoint> differences(List<DataPoint> cumulative, MeterUnit unit) {
    List<ConsumptionPoint> out = new ArrayList<>(cumulative.size());
    Double prev = null;
    for (DataPoint p : cumulative) {
      double v = prev == null ? 0d : Math.max(0d, p.value() - prev);
      out.add(ConsumptionPoint.of(p.date(), v, unit));
      prev = p.value();
    }
    return out;
  }

  List<ConsumptionPoint> monthly(List<DataPoint> cumulative, MeterUnit unit) {
    YearMonth first = YearMonth.from(cumulative.get(0).date());
    YearMonth last = YearMonth.from(cumulative.get(cumulative.size() - 1).date());
    List<ConsumptionPoint> out = new ArrayList<>();
    Double previousEnd = null;
    for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
      LocalDate monthEnd = month.atEndOfMonth();
      Optional<DataPoint> start = SeriesLookup.nearest(cumulative, startOf(month.atDay(1)),
          boundaryTolerance);
      Optional<DataPoint> end = SeriesLookup.nearest(cumulative, endOf(monthEnd),
          boundaryTolerance);
      if (start.isEmpty() || end.isEmpty()) {
        log.warn("No boundary value within {} for {}, consumption set to 0", boundaryTolerance,
            month);
        out.add(ConsumptionPoint.of(monthEnd, 0d, unit));
        if (end.isPresent()) {
          previousEnd = end.get().value();
        }
        continue;
      }
      double s = start.get().value();
      double e = end.get().value();
      double c;
      if (previousEnd != null && e >= previousEnd - resetTolerance) {
        c = e - previousEnd;
      } else {
        if (previousEnd != null) {
          log.debug("Reset detected in {}: {} -> {}", month, previousEnd, e);
        }
        c = e - s;
      }
      out.add(ConsumptionPoint.of(monthEnd, Math.max(0d, c), unit));
      previousEnd = e;
    }
    return out;
  }

  /**
   * Consumption of one calendar year: value nearest the end of Dec 31 minus value nearest the
   * start of Jan 1, never negative.
   */
  public double annualConsumption(List<DataPoint> cumulative, int year) {
    Optional<DataPoint> start = SeriesLookup.nearest(cumulative,
        startOf(LocalDate.of(year, 1, 1)), boundaryTolerance);
    Optional<DataPoint> end = SeriesLookup.nearest(cumulative,
        endOf(LocalDate.of(year, 12, 31)), boundaryTolerance);
    if (start.isEmpty() || end.isEmpty()) {
      return 0d;
    }
    return Math.max(0d, end.get().value() - start.get().value());
  }

  private static Instant startOf(LocalDate day) {
    return day.atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  private static Instant endOf(LocalDate day) {
    return day.atTime(LocalTime.MAX).toInstant(ZoneOffset.UTC);
  }
}
