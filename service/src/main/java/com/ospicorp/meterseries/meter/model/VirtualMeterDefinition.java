package com.ospicorp.meterseries.meter.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record VirtualMeterDefinition(
    String baseMeterId,
    List<String> subtractMeterIds,
    Map<String, UnitConversion> conversions,
    CalculationMode mode
) {
  public VirtualMeterDefinition {
    subtractMeterIds = List.copyOf(subtractMeterIds);
    conversions = Map.copyOf(conversions);
  }

  public Optional<UnitConversion> conversionFor(String meterId) {
    return Optional.ofNullable(conversions.get(meterId));
  }
}
