package com.ospicorp.meterseries.pipeline;

import com.ospicorp.meterseries.series.model.MeterResult;
import com.ospicorp.meterseries.series.model.SeriesWindow;
import java.util.List;

/**
 * In-memory outcome of one pipeline run, before anything is handed to the result sink.
 */
public record PipelineRun(SeriesWindow window, List<MeterResult> results,
    List<String> failedMeters) {
  public PipelineRun {
    results = List.copyOf(results);
    failedMeters = List.copyOf(failedMeters);
  }
}
