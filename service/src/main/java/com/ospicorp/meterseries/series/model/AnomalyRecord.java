package com.ospicorp.meterseries.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyRecord(
    @JsonProperty("meter_id") String meterId,
    LocalDate date,
    double value,
    @JsonProperty("z_score") double zScore,
    @JsonProperty("iqr_lower") double iqrLower,
    @JsonProperty("iqr_upper") double iqrUpper,
    @JsonProperty("rolling_z_score") Double rollingZScore,
    Set<Detector> detectors
) {

  public enum Detector {
    GLOBAL_Z_SCORE,
    INTERQUARTILE_FENCE,
    ROLLING_Z_SCORE
  }

  public AnomalyRecord {
    detectors = Set.copyOf(detectors);
  }

  @JsonProperty("anomaly_count")
  public int anomalyCount() {
    return detectors.size();
  }
}
