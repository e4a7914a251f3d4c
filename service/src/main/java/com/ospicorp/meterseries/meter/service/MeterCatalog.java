package com.ospicorp.meterseries.meter.service;

import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.MeterCategory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated meters in configuration order.
 */
public final class MeterCatalog {
  private final Map<String, Meter> meters;

  public MeterCatalog(Collection<Meter> meters) {
    Map<String, Meter> byId = new LinkedHashMap<>();
    for (Meter meter : meters) {
      if (byId.putIfAbsent(meter.id(), meter) != null) {
        throw new IllegalArgumentException("Duplicate meter id: " + meter.id());
      }
    }
    this.meters = byId;
  }

  public static MeterCatalog of(Meter... meters) {
    return new MeterCatalog(List.of(meters));
  }

  public Optional<Meter> find(String id) {
    return Optional.ofNullable(meters.get(id));
  }

  public List<Meter> all() {
    return List.copyOf(meters.values());
  }

  public List<Meter> byCategory(MeterCategory category) {
    List<Meter> out = new ArrayList<>();
    for (Meter meter : meters.values()) {
      if (meter.category() == category) {
        out.add(meter);
      }
    }
    return out;
  }

  public int size() {
    return meters.size();
  }
}
