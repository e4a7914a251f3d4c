package com.ospicorp.meterseries.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class PipelineStartupRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(PipelineStartupRunner.class);

  private final PipelineService pipelineService;
  private final boolean runOnStartup;

  public PipelineStartupRunner(PipelineService pipelineService,
      @Value("${meterseries.pipeline.run-on-startup:false}") boolean runOnStartup) {
    this.pipelineService = pipelineService;
    this.runOnStartup = runOnStartup;
  }

  @Override
  public void run(String... args) {
    if (!runOnStartup) {
      log.info("Startup pipeline run disabled via property meterseries.pipeline.run-on-startup");
      return;
    }
    PipelineRunSummary summary = pipelineService.runFullHistory();
    log.info("Startup pipeline run {} processed {} meters", summary.runId(),
        summary.processedMeters());
  }
}
