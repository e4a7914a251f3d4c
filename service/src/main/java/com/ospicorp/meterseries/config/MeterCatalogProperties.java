package com.ospicorp.meterseries.config;

import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Meter definitions exactly as written in the configuration. Nothing here is trusted yet; the
 * catalog factory validates each entry and drops the malformed ones.
 */
@ConfigurationProperties(prefix = "meterseries")
public record MeterCatalogProperties(@DefaultValue List<MeterDefinition> meters) {

  public record MeterDefinition(
      String id,
      String name,
      String utility,
      String category,
      String unit,
      String installationDate,
      String deinstallationDate,
      List<PeriodDefinition> periods,
      String baseMeter,
      List<String> subtractMeters,
      Map<String, ConversionDefinition> subtractConversions,
      String calculation,
      List<Double> seasonalPercentages
  ) {}

  public record PeriodDefinition(
      String startDate,
      String endDate,
      String composition,
      List<String> sourceMeters,
      String sourceUnit,
      boolean applyOffsetFromPrevious
  ) {}

  public record ConversionDefinition(String fromUnit, String toUnit) {}
}
