package com.ospicorp.meterseries.series.repository;

import com.ospicorp.meterseries.series.model.MeterReading;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcRawReadingSource implements RawReadingSource {
  private final JdbcTemplate jdbc;

  public JdbcRawReadingSource(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public List<MeterReading> fetch(String meterId, Optional<Instant> start) {
    if (start.isPresent()) {
      String sql = """
        SELECT ts, value
        FROM meter_readings
        WHERE meter_id = ? AND ts >= ?
        ORDER BY ts
      """;
      return jdbc.query(sql, (rs, i) -> new MeterReading(rs.getTimestamp(1).toInstant(),
                                                         rs.getDouble(2)),
                        meterId, Timestamp.from(start.get()));
    }
    String sql = """
      SELECT ts, value
      FROM meter_readings
      WHERE meter_id = ?
      ORDER BY ts
    """;
    return jdbc.query(sql, (rs, i) -> new MeterReading(rs.getTimestamp(1).toInstant(),
                                                       rs.getDouble(2)),
                      meterId);
  }

  /**
   * Upserts readings; a second reading for the same timestamp replaces the first.
   */
  public int store(String meterId, List<MeterReading> readings) {
    String sql = """
      INSERT INTO meter_readings(meter_id, ts, value) VALUES (?, ?, ?)
      ON CONFLICT (meter_id, ts) DO UPDATE SET value = EXCLUDED.value
    """;
    int[] counts = jdbc.batchUpdate(sql, readings.stream()
        .map(r -> new Object[]{meterId, Timestamp.from(r.timestamp()), r.value()})
        .toList());
    return counts.length;
  }
}
