package com.ospicorp.meterseries.series.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

// Raw cumulative reading as delivered by the reading source, UTC
public record MeterReading(Instant timestamp, double value) {

  public LocalDate date() {
    return timestamp.atZone(ZoneOffset.UTC).toLocalDate();
  }
}
