package com.ospicorp.meterseries.pipeline;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.service.MeterCatalog;
import com.ospicorp.meterseries.series.model.MeterResult;
import com.ospicorp.meterseries.series.model.SeriesWindow;
import com.ospicorp.meterseries.series.repository.ResultSink;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Full-history batch run: every configured meter from January 1 of the configured start year up
 * to today, results handed to the sink meter by meter.
 */
@Service
public class PipelineService {
  private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

  static final String MDC_RUN = "run";

  private final MeterCatalog catalog;
  private final MeterPipeline pipeline;
  private final ResultSink sink;
  private final EngineProperties properties;
  private final Clock clock;

  public PipelineService(MeterCatalog catalog, MeterPipeline pipeline, ResultSink sink,
      EngineProperties properties, Clock clock) {
    this.catalog = catalog;
    this.pipeline = pipeline;
    this.sink = sink;
    this.properties = properties;
    this.clock = clock;
  }

  public SeriesWindow fullHistoryWindow() {
    return new SeriesWindow(LocalDate.of(properties.startYear(), 1, 1), LocalDate.now(clock));
  }

  public PipelineRunSummary runFullHistory() {
    String runId = UUID.randomUUID().toString();
    Instant startedAt = clock.instant();
    long started = System.currentTimeMillis();
    SeriesWindow window = fullHistoryWindow();
    MDC.put(MDC_RUN, runId);
    try {
      log.info("Starting pipeline run {} for {} meters over {}..{}", runId, catalog.size(),
          window.start(), window.end());
      PipelineRun run = pipeline.run(catalog, window);
      List<String> failed = new ArrayList<>(run.failedMeters());
      long daily = 0;
      long monthly = 0;
      long consumption = 0;
      long anomalies = 0;
      int stored = 0;
      for (MeterResult result : run.results()) {
        try {
          sink.accept(result);
          stored++;
        } catch (RuntimeException ex) {
          log.error("Storing results of {} failed: {}", result.meterId(), ex.getMessage(), ex);
          failed.add(result.meterId());
          continue;
        }
        daily += result.daily().size();
        monthly += result.monthly().size();
        consumption += result.dailyConsumption().size() + result.monthlyConsumption().size();
        anomalies += result.anomalies().size();
      }
      long duration = System.currentTimeMillis() - started;
      log.info("Pipeline run {} finished in {} ms: {} meters stored, {} failed, {} anomalies",
          runId, duration, stored, failed.size(), anomalies);
      return new PipelineRunSummary(runId, startedAt, window.start(), window.end(), stored,
          failed, daily, monthly, consumption, anomalies, duration);
    } finally {
      MDC.remove(MDC_RUN);
    }
  }
}
