package com.ospicorp.meterseries.series.controller;

import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.service.MeterCatalog;
import com.ospicorp.meterseries.series.model.AnomalyRecord;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import com.ospicorp.meterseries.series.repository.ProcessedSeriesDao;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.NoSuchElementException;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/meters")
@Validated
@Tag(name = "Meters")
public class MeterController {
  private static final String METER_ID_REGEX = "^[A-Za-z0-9_.-]{1,64}$";

  private final MeterCatalog catalog;
  private final ProcessedSeriesDao dao;

  public MeterController(MeterCatalog catalog, ProcessedSeriesDao dao) {
    this.catalog = catalog;
    this.dao = dao;
  }

  @GetMapping
  @Operation(summary = "List meters", description = "All meters loaded from the configuration.")
  public List<MeterDto> list() {
    return catalog.all().stream().map(MeterDto::from).toList();
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get meter", description = "Fetch a single configured meter.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Meter",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = MeterDto.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public MeterDto get(@PathVariable @Pattern(regexp = METER_ID_REGEX)
      @Parameter(description = "Meter identifier", example = "gas_main") String id) {
    return MeterDto.from(meter(id));
  }

  @GetMapping("/{id}/series")
  @Operation(summary = "Get cumulative series",
      description = "Processed cumulative meter values at daily (D) or monthly (M) frequency.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Series",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SeriesDataResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "404", description = "Not found",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public SeriesDataResponse series(@PathVariable @Pattern(regexp = METER_ID_REGEX) String id,
      @RequestParam(defaultValue = "D") @Parameter(description = "D or M") String freq) {
    Meter meter = meter(id);
    Frequency frequency = storedFrequency(freq);
    List<DataPoint> points = dao.fetchSeries(meter.id(), frequency);
    List<List<Object>> rows = points.stream()
        .map(p -> List.<Object>of(p.date().toString(), p.value()))
        .toList();
    return new SeriesDataResponse(meter.id(), frequency.name(), meter.unit().symbol(),
        points.isEmpty() ? null : points.get(0).date(),
        points.isEmpty() ? null : points.get(points.size() - 1).date(), rows.size(), rows);
  }

  @GetMapping("/{id}/consumption")
  @Operation(summary = "Get consumption",
      description = "Non-negative consumption per day (D) or calendar month (M).")
  public List<ConsumptionPoint> consumption(
      @PathVariable @Pattern(regexp = METER_ID_REGEX) String id,
      @RequestParam(defaultValue = "M") @Parameter(description = "D or M") String freq) {
    Meter meter = meter(id);
    return dao.fetchConsumption(meter.id(), storedFrequency(freq));
  }

  @GetMapping("/{id}/anomalies")
  @Operation(summary = "Get anomalies",
      description = "Consumption days flagged by at least two anomaly detectors.")
  public List<AnomalyRecord> anomalies(@PathVariable @Pattern(regexp = METER_ID_REGEX) String id) {
    return dao.fetchAnomalies(meter(id).id());
  }

  private Meter meter(String id) {
    return catalog.find(id).orElseThrow(() -> new NoSuchElementException("Unknown meter: " + id));
  }

  private static Frequency storedFrequency(String freq) {
    Frequency frequency = Frequency.fromCode(freq);
    if (frequency != Frequency.D && frequency != Frequency.M) {
      throw new IllegalArgumentException("Invalid frequency code. Supported values: D,M.");
    }
    return frequency;
  }
}
