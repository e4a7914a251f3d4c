package com.ospicorp.meterseries.series.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public record SeriesWindow(LocalDate start, LocalDate end) {

  public SeriesWindow {
    if (start == null || end == null) {
      throw new IllegalArgumentException("window start and end must be provided");
    }
  }

  public boolean isEmpty() {
    return start.isAfter(end);
  }

  public long days() {
    return isEmpty() ? 0 : ChronoUnit.DAYS.between(start, end) + 1;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }
}
