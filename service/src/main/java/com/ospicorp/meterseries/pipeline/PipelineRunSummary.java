package com.ospicorp.meterseries.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record PipelineRunSummary(
    @JsonProperty("run_id") String runId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    @JsonProperty("processed_meters") int processedMeters,
    @JsonProperty("failed_meters") List<String> failedMeters,
    @JsonProperty("daily_points") long dailyPoints,
    @JsonProperty("monthly_points") long monthlyPoints,
    @JsonProperty("consumption_points") long consumptionPoints,
    @JsonProperty("anomalies") long anomalies,
    @JsonProperty("duration_ms") long durationMs
) {}
