package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.series.model.MeterReading;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Thins out dense reading histories before rate estimation and interpolation. The first and last
 * reading always survive.
 */
@Component
public class HighFrequencyReducer {
  private static final Logger log = LoggerFactory.getLogger(HighFrequencyReducer.class);

  private final EngineProperties.Reduction settings;

  public HighFrequencyReducer(EngineProperties properties) {
    this.settings = properties.reduction();
  }

  public List<MeterReading> reduce(List<MeterReading> readings) {
    int n = readings.size();
    if (n <= settings.mediumThreshold()) {
      return readings;
    }
    List<MeterReading> reduced;
    if (n > settings.veryDenseThreshold()) {
      reduced = sampleEvenly(readings);
    } else {
      reduced = lastPerDay(readings);
    }

    TreeMap<Instant, MeterReading> merged = new TreeMap<>();
    for (MeterReading reading : reduced) {
      merged.put(reading.timestamp(), reading);
    }
    MeterReading first = readings.get(0);
    MeterReading last = readings.get(n - 1);
    merged.put(first.timestamp(), first);
    merged.put(last.timestamp(), last);

    List<MeterReading> out = new ArrayList<>(merged.values());
    log.info("Reduced {} readings to {}", n, out.size());
    return out;
  }

  private List<MeterReading> sampleEvenly(List<MeterReading> readings) {
    int n = readings.size();
    List<MeterReading> middle = readings.subList(1, n - 1);
    int step = Math.max(1, middle.size() / (settings.targetPoints() - 2));
    List<MeterReading> out = new ArrayList<>(settings.targetPoints() + 2);
    out.add(readings.get(0));
    for (int i = 0; i < middle.size(); i += step) {
      out.add(middle.get(i));
    }
    out.add(readings.get(n - 1));
    return out;
  }

  // keeps the actual timestamp of each day's last reading
  private List<MeterReading> lastPerDay(List<MeterReading> readings) {
    TreeMap<LocalDate, MeterReading> byDay = new TreeMap<>();
    for (MeterReading reading : readings) {
      byDay.put(reading.date(), reading);
    }
    return new ArrayList<>(byDay.values());
  }
}
