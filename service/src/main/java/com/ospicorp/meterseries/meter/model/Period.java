package com.ospicorp.meterseries.meter.model;

import java.time.LocalDate;
import java.util.List;

/**
 * One composition period of a master meter, inclusive on both ends.
 */
public record Period(
    LocalDate start,
    LocalDate end,
    CompositionMode mode,
    List<String> sourceMeterIds,
    MeterUnit sourceUnit,
    boolean offsetFromPrevious
) {
  public Period {
    sourceMeterIds = List.copyOf(sourceMeterIds);
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }
}
