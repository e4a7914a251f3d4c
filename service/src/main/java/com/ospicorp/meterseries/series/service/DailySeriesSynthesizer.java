package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.SeasonalPattern;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.MeterReading;
import com.ospicorp.meterseries.series.model.RateEstimate;
import com.ospicorp.meterseries.series.model.SeriesWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds one cumulative value per calendar day for a physical meter.
 *
 * <p>The requested window is clipped to the meter's installation period and to today. Readings
 * are thinned, a consumption rate is estimated once and used to extrapolate towards both window
 * edges, and the daily grid is filled by interpolation. A backward projection that would turn
 * negative is replaced by a zero reading on the day the meter would have started counting.
 */
@Component
public class DailySeriesSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(DailySeriesSynthesizer.class);

  private static final double SECONDS_PER_DAY = 86_400d;

  private final HighFrequencyReducer reducer;
  private final Clock clock;
  private final boolean seasonalAutoDetect;

  public DailySeriesSynthesizer(EngineProperties properties, HighFrequencyReducer reducer,
      Clock clock) {
    this.reducer = reducer;
    this.clock = clock;
    this.seasonalAutoDetect = properties.seasonalAutoDetect();
  }

  public SeriesWindow effectiveWindow(Meter meter, SeriesWindow requested) {
    LocalDate start = requested.start();
    LocalDate end = requested.end();
    if (meter.installationDate() != null && meter.installationDate().isAfter(start)) {
      start = meter.installationDate();
    }
    if (meter.deinstallationDate() != null && meter.deinstallationDate().isBefore(end)) {
      end = meter.deinstallationDate();
    }
    LocalDate today = LocalDate.now(clock);
    if (today.isBefore(end)) {
      end = today;
    }
    return new SeriesWindow(start, end);
  }

  public Optional<List<DataPoint>> synthesize(Meter meter, SeriesWindow requested,
      List<MeterReading> rawReadings) {
    SeriesWindow window = effectiveWindow(meter, requested);
    if (window.isEmpty()) {
      log.warn("No daily series for {}: effective window {}..{} is empty", meter.id(),
          window.start(), window.end());
      return Optional.empty();
    }
    if (rawReadings.isEmpty()) {
      log.warn("No daily series for {}: no raw readings", meter.id());
      return Optional.empty();
    }

    List<MeterReading> sorted = new ArrayList<>(rawReadings);
    sorted.sort(Comparator.comparing(MeterReading::timestamp));
    List<MeterReading> readings = reducer.reduce(sorted);
    RateEstimate rate = RateEstimator.estimate(readings);

    TreeMap<Instant, Double> known = new TreeMap<>();
    for (MeterReading reading : readings) {
      known.put(reading.timestamp(), reading.value());
    }
    Instant start = Interpolator.startOfDay(window.start());
    Instant end = Interpolator.startOfDay(window.end());
    extrapolateBackward(meter.id(), known, start, rate.ratePerDay());
    extrapolateForward(meter.id(), known, end, rate.ratePerDay());

    SeasonalPattern pattern = resolvePattern(meter, sorted);
    List<LocalDate> days = new ArrayList<>((int) window.days());
    for (LocalDate d = window.start(); !d.isAfter(window.end()); d = d.plusDays(1)) {
      days.add(d);
    }
    List<DataPoint> daily = Interpolator.interpolate(known, days, pattern);
    log.info("Synthesized {} daily points for {} ({}..{}), rate {} units/day via {}{}",
        daily.size(), meter.id(), window.start(), window.end(), rate.ratePerDay(), rate.method(),
        pattern == null ? "" : ", seasonal weighting");
    return Optional.of(daily);
  }

  private void extrapolateBackward(String meterId, TreeMap<Instant, Double> known, Instant start,
      double rate) {
    Map.Entry<Instant, Double> first = known.firstEntry();
    if (!first.getKey().isAfter(start)) {
      return;
    }
    if (rate <= 0) {
      known.put(start, 0d);
      return;
    }
    double daysBack = RateEstimator.daysBetween(start, first.getKey());
    double projected = first.getValue() - rate * daysBack;
    if (projected >= 0) {
      known.put(start, projected);
      return;
    }
    long secondsToZero = Math.round(first.getValue() / rate * SECONDS_PER_DAY);
    Instant zeroCrossing = first.getKey().minus(Duration.ofSeconds(secondsToZero));
    if (zeroCrossing.isBefore(start)) {
      zeroCrossing = start;
    }
    log.debug("{}: backward projection crosses zero at {}", meterId, zeroCrossing);
    known.put(zeroCrossing, 0d);
    if (zeroCrossing.isAfter(start)) {
      known.put(start, 0d);
    }
  }

  private void extrapolateForward(String meterId, TreeMap<Instant, Double> known, Instant end,
      double rate) {
    Map.Entry<Instant, Double> last = known.lastEntry();
    if (!last.getKey().isBefore(end)) {
      return;
    }
    if (rate <= 0) {
      known.put(end, last.getValue());
      return;
    }
    double daysForward = RateEstimator.daysBetween(last.getKey(), end);
    log.debug("{}: projecting {} days forward", meterId, daysForward);
    known.put(end, last.getValue() + rate * daysForward);
  }

  private SeasonalPattern resolvePattern(Meter meter, List<MeterReading> readings) {
    if (meter.seasonalPattern() != null) {
      return meter.seasonalPattern();
    }
    if (!seasonalAutoDetect) {
      return null;
    }
    return SeasonalPatternDetector.detect(readings).orElse(null);
  }
}
