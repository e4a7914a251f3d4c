package com.ospicorp.meterseries.series.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

// One value per calendar day or per period, stamped at the start of that day (UTC)
public record DataPoint(LocalDate date, double value) {

  public Instant instant() {
    return date.atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  public DataPoint withValue(double newValue) {
    return new DataPoint(date, newValue);
  }
}
