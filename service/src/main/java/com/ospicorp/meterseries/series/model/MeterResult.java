package com.ospicorp.meterseries.series.model;

import com.ospicorp.meterseries.meter.model.MeterCategory;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import java.util.List;

/**
 * Everything one pipeline run produced for a single meter, as handed to the result sink.
 */
public record MeterResult(
    String meterId,
    MeterCategory category,
    MeterUnit unit,
    List<DataPoint> daily,
    List<DataPoint> monthly,
    List<ConsumptionPoint> dailyConsumption,
    List<ConsumptionPoint> monthlyConsumption,
    List<AnomalyRecord> anomalies
) {
  public MeterResult {
    daily = List.copyOf(daily);
    monthly = List.copyOf(monthly);
    dailyConsumption = List.copyOf(dailyConsumption);
    monthlyConsumption = List.copyOf(monthlyConsumption);
    anomalies = List.copyOf(anomalies);
  }

  public boolean isEmpty() {
    return daily.isEmpty() && monthly.isEmpty() && dailyConsumption.isEmpty()
        && monthlyConsumption.isEmpty();
  }
}
