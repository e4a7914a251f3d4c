package com.ospicorp.meterseries.series.model;

import java.util.List;

/**
 * Composed series of a master meter. {@code monthlySegments} holds the per-period monthly
 * compositions and is kept for diagnostics only; {@code monthly} is always aggregated from
 * {@code daily}.
 */
public record MasterComposition(
    List<DataPoint> daily,
    List<DataPoint> monthly,
    List<List<DataPoint>> monthlySegments
) {
  public MasterComposition {
    daily = List.copyOf(daily);
    monthly = List.copyOf(monthly);
    monthlySegments = monthlySegments.stream().map(List::copyOf).toList();
  }

  public static MasterComposition empty() {
    return new MasterComposition(List.of(), List.of(), List.of());
  }
}
