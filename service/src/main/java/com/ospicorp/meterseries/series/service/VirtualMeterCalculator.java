package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.meter.model.UnitConversion;
import com.ospicorp.meterseries.meter.model.VirtualMeterDefinition;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.VirtualMeterResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Base consumption minus the consumption of each subtract meter, clipped at zero after every
 * subtraction. Periods where the base itself did not consume stay at zero.
 */
@Component
public class VirtualMeterCalculator {
  private static final Logger log = LoggerFactory.getLogger(VirtualMeterCalculator.class);

  static final double ZERO_TOTAL_EPSILON = 1e-9;

  private final UnitConverter unitConverter;

  public VirtualMeterCalculator(UnitConverter unitConverter) {
    this.unitConverter = unitConverter;
  }

  public Optional<VirtualMeterResult> calculate(String virtualId,
      VirtualMeterDefinition definition, MeterUnit unit,
      Map<String, List<ConsumptionPoint>> consumptionByMeter) {
    List<ConsumptionPoint> base = consumptionByMeter.get(definition.baseMeterId());
    if (base == null || base.isEmpty()) {
      log.warn("Virtual meter {}: base meter {} has no consumption", virtualId,
          definition.baseMeterId());
      return Optional.empty();
    }

    TreeMap<LocalDate, Double> baseValues = new TreeMap<>();
    for (ConsumptionPoint p : base) {
      baseValues.put(p.date(), p.value());
    }
    TreeMap<LocalDate, Double> result = new TreeMap<>(baseValues);

    for (String subtractId : definition.subtractMeterIds()) {
      List<ConsumptionPoint> subtract = consumptionByMeter.get(subtractId);
      if (subtract == null) {
        log.warn("Virtual meter {}: subtract meter {} has no consumption, skipped", virtualId,
            subtractId);
        continue;
      }
      double factor = 1d;
      Optional<UnitConversion> conversion = definition.conversionFor(subtractId);
      if (conversion.isPresent()) {
        OptionalDouble f = unitConverter.factor(conversion.get().from(), conversion.get().to());
        if (f.isEmpty()) {
          log.warn("Virtual meter {}: cannot convert {} from {} to {}, subtract meter skipped",
              virtualId, subtractId, conversion.get().from(), conversion.get().to());
          continue;
        }
        factor = f.getAsDouble();
      }
      Map<LocalDate, Double> subtractValues = new TreeMap<>();
      for (ConsumptionPoint p : subtract) {
        subtractValues.put(p.date(), p.value() * factor);
      }
      for (Map.Entry<LocalDate, Double> e : result.entrySet()) {
        double remaining = e.getValue() - subtractValues.getOrDefault(e.getKey(), 0d);
        e.setValue(Math.max(0d, remaining));
      }
    }
    baseValues.forEach((date, value) -> {
      if (value <= 0) {
        result.put(date, 0d);
      }
    });

    List<ConsumptionPoint> consumption = new ArrayList<>(result.size());
    result.forEach((date, value) -> consumption.add(ConsumptionPoint.of(date, value, unit)));
    double total = consumption.stream().mapToDouble(ConsumptionPoint::value).sum();
    List<DataPoint> cumulative = new ArrayList<>(consumption.size());
    double running = 0d;
    for (ConsumptionPoint p : consumption) {
      running += p.value();
      cumulative.add(new DataPoint(p.date(), Math.abs(total) < ZERO_TOTAL_EPSILON ? 0d : running));
    }
    log.info("Virtual meter {}: {} periods, total {} {}", virtualId, consumption.size(), total,
        unit);
    return Optional.of(new VirtualMeterResult(consumption, cumulative));
  }
}
