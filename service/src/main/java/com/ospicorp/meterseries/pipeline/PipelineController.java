package com.ospicorp.meterseries.pipeline;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pipeline")
@Tag(name = "Pipeline")
public class PipelineController {
  private final PipelineService pipelineService;

  public PipelineController(PipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @PostMapping("/runs")
  @Operation(summary = "Run the pipeline",
      description = "Processes the full history of every configured meter and stores the results.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Run summary",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = PipelineRunSummary.class))),
      @ApiResponse(responseCode = "500", description = "Run aborted",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public PipelineRunSummary run() {
    return pipelineService.runFullHistory();
  }
}
