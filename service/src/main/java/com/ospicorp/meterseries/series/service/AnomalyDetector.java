package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.series.model.AnomalyRecord;
import com.ospicorp.meterseries.series.model.AnomalyRecord.Detector;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags consumption days that at least a quorum of three detectors agree on: a global z-score,
 * an interquartile fence and a centered rolling z-score. Global statistics ignore zero days.
 */
@Component
public class AnomalyDetector {
  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  private final EngineProperties.Anomaly settings;

  public AnomalyDetector(EngineProperties properties) {
    this.settings = properties.anomaly();
  }

  public List<AnomalyRecord> detect(String meterId, List<ConsumptionPoint> consumption) {
    int n = consumption.size();
    if (n < settings.minPoints()) {
      log.debug("Skipping anomaly detection for {}: {} points", meterId, n);
      return List.of();
    }
    double[] values = new double[n];
    DescriptiveStatistics nonZero = new DescriptiveStatistics();
    for (int i = 0; i < n; i++) {
      values[i] = consumption.get(i).value();
      if (values[i] > 0) {
        nonZero.addValue(values[i]);
      }
    }
    if (nonZero.getN() < settings.minNonZeroPoints()) {
      log.debug("Skipping anomaly detection for {}: {} non-zero days", meterId, nonZero.getN());
      return List.of();
    }

    double mean = nonZero.getMean();
    double std = nonZero.getStandardDeviation();
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    double[] observed = nonZero.getValues();
    double q1 = percentile.evaluate(observed, 25d);
    double q3 = percentile.evaluate(observed, 75d);
    double iqr = q3 - q1;
    double lower = q1 - settings.iqrMultiplier() * iqr;
    double upper = q3 + settings.iqrMultiplier() * iqr;
    log.debug("{}: mean {}, std {}, fence [{}, {}]", meterId, mean, std, lower, upper);

    Double[] rollingZ = rollingZScores(values);
    List<AnomalyRecord> anomalies = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double v = values[i];
      Set<Detector> votes = EnumSet.noneOf(Detector.class);
      double z = std > 0 ? (v - mean) / std : 0d;
      if (std > 0 && Math.abs(z) > settings.zScoreThreshold()) {
        votes.add(Detector.GLOBAL_Z_SCORE);
      }
      if (v < lower || v > upper) {
        votes.add(Detector.INTERQUARTILE_FENCE);
      }
      if (rollingZ[i] != null && Math.abs(rollingZ[i]) > settings.rollingZScoreThreshold()) {
        votes.add(Detector.ROLLING_Z_SCORE);
      }
      if (votes.size() >= settings.quorum()) {
        ConsumptionPoint p = consumption.get(i);
        anomalies.add(new AnomalyRecord(meterId, p.date(), v, z, lower, upper, rollingZ[i], votes));
      }
    }
    if (!anomalies.isEmpty()) {
      log.info("Found {} anomalies for {} ({} days)", anomalies.size(), meterId, n);
    }
    return anomalies;
  }

  // centered window; an even window extends one further to the left
  private Double[] rollingZScores(double[] values) {
    int n = values.length;
    int window = settings.rollingWindow();
    int before = window / 2;
    int after = (window - 1) / 2;
    Double[] out = new Double[n];
    for (int i = 0; i < n; i++) {
      int from = Math.max(0, i - before);
      int to = Math.min(n - 1, i + after);
      int count = to - from + 1;
      if (count < settings.rollingMinPeriods()) {
        continue;
      }
      DescriptiveStatistics stats = new DescriptiveStatistics();
      for (int k = from; k <= to; k++) {
        stats.addValue(values[k]);
      }
      double std = stats.getStandardDeviation();
      if (std > 0) {
        out[i] = (values[i] - stats.getMean()) / std;
      }
    }
    return out;
  }
}
