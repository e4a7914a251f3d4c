package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.series.model.MeterReading;
import com.ospicorp.meterseries.series.model.RateEstimate;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the long-run consumption rate of a cumulative meter in units per day.
 *
 * <p>Four candidates are computed and the first one whose quality gate passes wins: a least
 * squares fit with a significance test, an independent least squares fit as cross-check, the
 * median of all pairwise slopes and finally the slope between first and last reading. The chosen
 * rate is never negative.
 */
public final class RateEstimator {
  private static final Logger log = LoggerFactory.getLogger(RateEstimator.class);

  static final double PRIMARY_MIN_R_SQUARED = 0.7;
  static final double PRIMARY_MAX_P_VALUE = 0.05;
  static final double CROSS_CHECK_MIN_R_SQUARED = 0.6;
  private static final int MIN_REGRESSION_POINTS = 4;
  private static final int MIN_MEDIAN_POINTS = 3;
  private static final double SECONDS_PER_DAY = 86_400d;

  private RateEstimator() {
  }

  public static RateEstimate estimate(List<MeterReading> readings) {
    if (readings == null || readings.size() < 2) {
      return RateEstimate.insufficientData();
    }
    int n = readings.size();
    Instant origin = readings.get(0).timestamp();
    double[] days = new double[n];
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      days[i] = daysBetween(origin, readings.get(i).timestamp());
      values[i] = readings.get(i).value();
    }

    double primaryRate = 0d;
    double primaryR2 = 0d;
    double pValue = 1d;
    double crossRate = 0d;
    double crossR2 = 0d;
    if (n >= MIN_REGRESSION_POINTS) {
      try {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
          regression.addData(days[i], values[i]);
        }
        primaryRate = finiteOr(regression.getSlope(), 0d);
        primaryR2 = finiteOr(regression.getRSquare(), 0d);
        pValue = finiteOr(regression.getSignificance(), 1d);
        log.debug("Primary regression: {} units/day (R²={}, p={})", primaryRate, primaryR2, pValue);
      } catch (MathIllegalArgumentException | MathIllegalStateException ex) {
        log.warn("Primary regression failed: {}", ex.getMessage());
        primaryRate = 0d;
        primaryR2 = 0d;
        pValue = 1d;
      }
      try {
        double[][] x = new double[n][1];
        for (int i = 0; i < n; i++) {
          x[i][0] = days[i];
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(values, x);
        crossRate = finiteOr(ols.estimateRegressionParameters()[1], 0d);
        crossR2 = finiteOr(ols.calculateRSquared(), 0d);
        log.debug("Cross-check regression: {} units/day (R²={})", crossRate, crossR2);
      } catch (MathIllegalArgumentException | MathIllegalStateException ex) {
        log.warn("Cross-check regression failed: {}", ex.getMessage());
        crossRate = 0d;
        crossR2 = 0d;
      }
    }

    double medianRate = medianPairwiseRate(days, values);
    double span = days[n - 1] - days[0];
    double simpleRate = span > 0 ? (values[n - 1] - values[0]) / span : 0d;

    RateEstimate chosen;
    if (n >= MIN_REGRESSION_POINTS && primaryR2 > PRIMARY_MIN_R_SQUARED
        && pValue < PRIMARY_MAX_P_VALUE) {
      chosen = new RateEstimate(primaryRate, primaryR2, label("regression", primaryR2));
    } else if (n >= MIN_REGRESSION_POINTS && crossR2 > CROSS_CHECK_MIN_R_SQUARED) {
      chosen = new RateEstimate(crossRate, crossR2, label("cross_check_regression", crossR2));
    } else if (n >= MIN_MEDIAN_POINTS && medianRate > 0) {
      chosen = new RateEstimate(medianRate, 0d, "median_pairwise");
    } else {
      chosen = new RateEstimate(simpleRate, 0d, "simple_first_last");
    }
    RateEstimate result = new RateEstimate(Math.max(0d, chosen.ratePerDay()),
        chosen.confidence(), chosen.method());
    log.debug("Estimated rate {} units/day from {} readings using {}", result.ratePerDay(), n,
        result.method());
    return result;
  }

  static double medianPairwiseRate(double[] days, double[] values) {
    int n = days.length;
    double[] rates = new double[n * (n - 1) / 2];
    int count = 0;
    for (int i = 0; i < n - 1; i++) {
      for (int j = i + 1; j < n; j++) {
        double dt = days[j] - days[i];
        if (dt > 0) {
          rates[count++] = (values[j] - values[i]) / dt;
        }
      }
    }
    if (count == 0) {
      return 0d;
    }
    return new Median().evaluate(rates, 0, count);
  }

  static double daysBetween(Instant from, Instant to) {
    Duration d = Duration.between(from, to);
    return (d.getSeconds() + d.getNano() / 1_000_000_000d) / SECONDS_PER_DAY;
  }

  private static String label(String method, double rSquared) {
    return String.format(Locale.ROOT, "%s_r2_%.3f", method, rSquared);
  }

  private static double finiteOr(double value, double fallback) {
    return Double.isFinite(value) ? value : fallback;
  }
}
