package com.ospicorp.meterseries.series.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.MeterKind;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeterDto(
    String id,
    String name,
    String category,
    String utility,
    String unit,
    @JsonProperty("installation_date") LocalDate installationDate,
    @JsonProperty("deinstallation_date") LocalDate deinstallationDate,
    @JsonProperty("source_meters") List<String> sourceMeters,
    @JsonProperty("base_meter") String baseMeter,
    @JsonProperty("subtract_meters") List<String> subtractMeters,
    @JsonProperty("seasonal_pattern") boolean seasonalPattern
) {

  static MeterDto from(Meter meter) {
    List<String> sources = null;
    String base = null;
    List<String> subtract = null;
    if (meter.kind() instanceof MeterKind.Master master) {
      sources = master.periods().stream()
          .flatMap(p -> p.sourceMeterIds().stream())
          .distinct()
          .toList();
    } else if (meter.kind() instanceof MeterKind.Virtual virtual) {
      base = virtual.definition().baseMeterId();
      subtract = virtual.definition().subtractMeterIds();
    }
    return new MeterDto(meter.id(), meter.name(), meter.category().name().toLowerCase(Locale.ROOT),
        meter.utility() == null ? null : meter.utility().name().toLowerCase(Locale.ROOT),
        meter.unit().symbol(), meter.installationDate(), meter.deinstallationDate(), sources, base,
        subtract, meter.seasonalPattern() != null);
  }
}
