package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.series.model.DataPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-point lookups on date-ordered series. Points are located at the start of their day
 * (UTC); ties resolve to the earlier point.
 */
public final class SeriesLookup {
  private SeriesLookup() {
  }

  public static Optional<DataPoint> nearest(List<DataPoint> series, Instant target,
      Duration tolerance) {
    if (series.isEmpty()) {
      return Optional.empty();
    }
    int idx = lowerBound(series, target);
    DataPoint best = null;
    long bestDistance = Long.MAX_VALUE;
    for (int k = Math.max(0, idx - 1); k <= Math.min(series.size() - 1, idx); k++) {
      DataPoint candidate = series.get(k);
      long distance = Math.abs(Duration.between(candidate.instant(), target).toMillis());
      if (distance < bestDistance) {
        best = candidate;
        bestDistance = distance;
      }
    }
    if (best == null || bestDistance > tolerance.toMillis()) {
      return Optional.empty();
    }
    return Optional.of(best);
  }

  // first index whose instant is not before target
  private static int lowerBound(List<DataPoint> series, Instant target) {
    int lo = 0;
    int hi = series.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (series.get(mid).instant().isBefore(target)) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
