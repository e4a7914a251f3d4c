package com.ospicorp.meterseries.series.model;

import java.util.List;

/**
 * Virtual meter consumption and the cumulative series obtained by summing it.
 */
public record VirtualMeterResult(List<ConsumptionPoint> consumption, List<DataPoint> cumulative) {
  public VirtualMeterResult {
    consumption = List.copyOf(consumption);
    cumulative = List.copyOf(cumulative);
  }

  public double total() {
    return consumption.stream().mapToDouble(ConsumptionPoint::value).sum();
  }
}
