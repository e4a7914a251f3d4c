package com.ospicorp.meterseries.series.repository;

import com.ospicorp.meterseries.series.model.AnomalyRecord;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.MeterResult;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.sql.Date;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcResultSink implements ResultSink {
  private static final Logger log = LoggerFactory.getLogger(JdbcResultSink.class);

  private final JdbcTemplate jdbc;

  public JdbcResultSink(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  @Transactional
  public void accept(MeterResult result) {
    String meterId = result.meterId();
    jdbc.update("DELETE FROM processed_series WHERE meter_id = ?", meterId);
    jdbc.update("DELETE FROM consumption WHERE meter_id = ?", meterId);
    jdbc.update("DELETE FROM anomalies WHERE meter_id = ?", meterId);

    insertSeries(meterId, Frequency.D, result.daily());
    insertSeries(meterId, Frequency.M, result.monthly());
    insertConsumption(meterId, Frequency.D, result.dailyConsumption());
    insertConsumption(meterId, Frequency.M, result.monthlyConsumption());
    insertAnomalies(result.anomalies());
    log.debug("Stored {} series, {} consumption and {} anomaly rows for {}",
        result.daily().size() + result.monthly().size(),
        result.dailyConsumption().size() + result.monthlyConsumption().size(),
        result.anomalies().size(), meterId);
  }

  private void insertSeries(String meterId, Frequency frequency, List<DataPoint> points) {
    final String sql = """
      INSERT INTO processed_series(meter_id, frequency, ts_date, value) VALUES (?, ?, ?, ?)
    """;
    List<Object[]> batchArgs = new ArrayList<>(points.size());
    for (DataPoint p : points) {
      batchArgs.add(new Object[]{meterId, frequency.name(), Date.valueOf(p.date()), p.value()});
    }
    jdbc.batchUpdate(sql, batchArgs);
  }

  private void insertConsumption(String meterId, Frequency frequency,
      List<ConsumptionPoint> points) {
    final String sql = """
      INSERT INTO consumption(meter_id, frequency, ts_date, value, unit, secondary_value,
                              secondary_unit)
      VALUES (?, ?, ?, ?, ?, ?, ?)
    """;
    List<Object[]> batchArgs = new ArrayList<>(points.size());
    for (ConsumptionPoint p : points) {
      batchArgs.add(new Object[]{
          meterId,
          frequency.name(),
          Date.valueOf(p.date()),
          p.value(),
          p.unit() == null ? null : p.unit().symbol(),
          p.secondaryValue(),
          p.secondaryUnit() == null ? null : p.secondaryUnit().symbol()
      });
    }
    jdbc.batchUpdate(sql, batchArgs);
  }

  private void insertAnomalies(List<AnomalyRecord> anomalies) {
    final String sql = """
      INSERT INTO anomalies(meter_id, ts_date, value, z_score, iqr_lower, iqr_upper,
                            rolling_z_score, detectors)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?)
    """;
    List<Object[]> batchArgs = new ArrayList<>(anomalies.size());
    for (AnomalyRecord a : anomalies) {
      batchArgs.add(new Object[]{
          a.meterId(),
          Date.valueOf(a.date()),
          a.value(),
          a.zScore(),
          a.iqrLower(),
          a.iqrUpper(),
          a.rollingZScore(),
          a.detectors().stream().map(Enum::name).sorted().collect(Collectors.joining(","))
      });
    }
    jdbc.batchUpdate(sql, batchArgs);
  }
}
