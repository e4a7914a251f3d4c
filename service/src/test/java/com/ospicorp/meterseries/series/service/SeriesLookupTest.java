package com.ospicorp.meterseries.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.meterseries.series.model.DataPoint;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesLookupTest {
  private final List<DataPoint> series = List.of(
      new DataPoint(LocalDate.of(2024, 1, 1), 1d),
      new DataPoint(LocalDate.of(2024, 1, 3), 3d),
      new DataPoint(LocalDate.of(2024, 1, 10), 10d));

  @Test
  void findsNearestPointWithinTolerance() {
    var found = SeriesLookup.nearest(series, Instant.parse("2024-01-08T00:00:00Z"),
        Duration.ofDays(3));
    assertEquals(10d, found.orElseThrow().value());
  }

  @Test
  void tiesResolveToEarlierPoint() {
    var found = SeriesLookup.nearest(series, Instant.parse("2024-01-02T00:00:00Z"),
        Duration.ofDays(1));
    assertEquals(1d, found.orElseThrow().value());
  }

  @Test
  void nothingOutsideTolerance() {
    assertTrue(SeriesLookup.nearest(series, Instant.parse("2024-01-06T12:00:00Z"),
        Duration.ofDays(3)).isEmpty());
    assertTrue(SeriesLookup.nearest(List.of(), Instant.parse("2024-01-06T12:00:00Z"),
        Duration.ofDays(3)).isEmpty());
  }
}
