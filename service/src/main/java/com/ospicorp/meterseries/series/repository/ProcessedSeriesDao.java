package com.ospicorp.meterseries.series.repository;

import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.series.model.AnomalyRecord;
import com.ospicorp.meterseries.series.model.AnomalyRecord.Detector;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read side of {@link JdbcResultSink}.
 */
@Repository
public class ProcessedSeriesDao {
  private final JdbcTemplate jdbc;

  public ProcessedSeriesDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public List<DataPoint> fetchSeries(String meterId, Frequency frequency) {
    String sql = """
      SELECT ts_date, value
      FROM processed_series
      WHERE meter_id = ? AND frequency = ?
      ORDER BY ts_date
    """;
    return jdbc.query(sql, (rs, i) -> new DataPoint(rs.getDate(1).toLocalDate(), rs.getDouble(2)),
                      meterId, frequency.name());
  }

  public List<ConsumptionPoint> fetchConsumption(String meterId, Frequency frequency) {
    String sql = """
      SELECT ts_date, value, unit, secondary_value, secondary_unit
      FROM consumption
      WHERE meter_id = ? AND frequency = ?
      ORDER BY ts_date
    """;
    return jdbc.query(sql, (rs, i) -> new ConsumptionPoint(
        rs.getDate(1).toLocalDate(),
        rs.getDouble(2),
        unitOrNull(rs.getString(3)),
        (Double) rs.getObject(4),
        unitOrNull(rs.getString(5))), meterId, frequency.name());
  }

  public List<AnomalyRecord> fetchAnomalies(String meterId) {
    String sql = """
      SELECT meter_id, ts_date, value, z_score, iqr_lower, iqr_upper, rolling_z_score, detectors
      FROM anomalies
      WHERE meter_id = ?
      ORDER BY ts_date
    """;
    return jdbc.query(sql, (rs, i) -> new AnomalyRecord(
        rs.getString(1),
        rs.getDate(2).toLocalDate(),
        rs.getDouble(3),
        rs.getDouble(4),
        rs.getDouble(5),
        rs.getDouble(6),
        (Double) rs.getObject(7),
        detectors(rs.getString(8))), meterId);
  }

  private static MeterUnit unitOrNull(String symbol) {
    return symbol == null ? null : MeterUnit.fromSymbol(symbol);
  }

  private static Set<Detector> detectors(String joined) {
    Set<Detector> out = EnumSet.noneOf(Detector.class);
    if (joined == null || joined.isBlank()) {
      return out;
    }
    Arrays.stream(joined.split(",")).map(String::trim).map(Detector::valueOf).forEach(out::add);
    return out;
  }
}
