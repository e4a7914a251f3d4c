package com.ospicorp.meterseries.series.repository;

import com.ospicorp.meterseries.series.model.MeterResult;

/**
 * Receives the processed series of one meter. Implementations replace whatever an earlier run
 * stored for the same meter.
 */
public interface ResultSink {

  void accept(MeterResult result);
}
