package com.ospicorp.meterseries.series.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesDataResponse(
    @JsonProperty("meter_id") String meterId,
    @JsonProperty("freq") String frequency,
    String unit,
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    @JsonProperty("point_count") int pointCount,
    List<List<Object>> points
) {}
