package com.ospicorp.meterseries.series.repository;

import com.ospicorp.meterseries.series.model.MeterReading;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cumulative readings of one meter, ordered by timestamp, one reading per timestamp (UTC).
 */
public interface RawReadingSource {

  List<MeterReading> fetch(String meterId, Optional<Instant> start);
}
