package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.series.model.DataPoint;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Derived series of one pipeline run. Entries never expire; a new run starts with a new cache.
 * Concurrent population of the same key may compute twice, the results are equal.
 */
public final class SeriesCache {
  private final Map<SeriesCacheKey, List<DataPoint>> entries = new ConcurrentHashMap<>();
  private final AtomicInteger misses = new AtomicInteger();

  public Optional<List<DataPoint>> get(SeriesCacheKey key) {
    return Optional.ofNullable(entries.get(key));
  }

  public void put(SeriesCacheKey key, List<DataPoint> series) {
    entries.put(key, List.copyOf(series));
  }

  /**
   * Returns the cached series or computes it. An empty computation is not cached.
   */
  public Optional<List<DataPoint>> computeIfAbsent(SeriesCacheKey key,
      Supplier<Optional<List<DataPoint>>> loader) {
    List<DataPoint> cached = entries.get(key);
    if (cached != null) {
      return Optional.of(cached);
    }
    misses.incrementAndGet();
    Optional<List<DataPoint>> computed = loader.get();
    computed.ifPresent(series -> put(key, series));
    return computed.map(series -> entries.get(key));
  }

  public int misses() {
    return misses.get();
  }

  public int size() {
    return entries.size();
  }
}
