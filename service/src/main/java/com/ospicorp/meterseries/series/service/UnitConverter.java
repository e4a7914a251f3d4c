package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.series.model.DataPoint;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gas volume to energy conversion and back. Any other pair of distinct units is unsupported.
 */
@Component
public class UnitConverter {
  private static final Logger log = LoggerFactory.getLogger(UnitConverter.class);

  private final double kwhPerCubicMetre;

  public UnitConverter(EngineProperties properties) {
    this.kwhPerCubicMetre = properties.gasConversion().kwhPerCubicMetre();
  }

  public OptionalDouble factor(MeterUnit from, MeterUnit to) {
    if (from == to) {
      return OptionalDouble.of(1d);
    }
    if (from == MeterUnit.CUBIC_METRE && to == MeterUnit.KWH) {
      return OptionalDouble.of(kwhPerCubicMetre);
    }
    if (from == MeterUnit.KWH && to == MeterUnit.CUBIC_METRE) {
      return OptionalDouble.of(1d / kwhPerCubicMetre);
    }
    log.warn("Unsupported unit conversion {} -> {}", from, to);
    return OptionalDouble.empty();
  }

  /**
   * Converts a cumulative series, or returns it unchanged when the pair is unsupported.
   */
  public List<DataPoint> convertSeries(List<DataPoint> series, MeterUnit from, MeterUnit to) {
    OptionalDouble factor = factor(from, to);
    if (factor.isEmpty() || factor.getAsDouble() == 1d) {
      return series;
    }
    double f = factor.getAsDouble();
    return series.stream().map(p -> p.withValue(p.value() * f)).toList();
  }
}
