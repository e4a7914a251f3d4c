package com.ospicorp.meterseries.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsumptionPoint(
    LocalDate date,
    double value,
    MeterUnit unit,
    @JsonProperty("secondary_value") Double secondaryValue,
    @JsonProperty("secondary_unit") MeterUnit secondaryUnit
) {

  public ConsumptionPoint {
    if (value < 0) {
      throw new IllegalArgumentException("consumption must not be negative: " + value);
    }
  }

  public static ConsumptionPoint of(LocalDate date, double value, MeterUnit unit) {
    return new ConsumptionPoint(date, value, unit, null, null);
  }

  public ConsumptionPoint withSecondary(double secondary, MeterUnit secondaryUnitOfValue) {
    return new ConsumptionPoint(date, value, unit, secondary, secondaryUnitOfValue);
  }
}
