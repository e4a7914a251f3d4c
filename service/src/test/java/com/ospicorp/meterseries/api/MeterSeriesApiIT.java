package com.ospicorp.meterseries.api;

import static org.assertj.core.api.Assertions.assertThat;
import static java.util.Objects.requireNonNull;

import com.ospicorp.meterseries.series.model.MeterReading;
import com.ospicorp.meterseries.series.repository.JdbcRawReadingSource;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers
class MeterSeriesApiIT {

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    POSTGRES.start();
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private TestRestTemplate rest;

  @Autowired
  private JdbcRawReadingSource readings;

  private static List<MeterReading> linear(double start, double perDay) {
    LocalDate from = LocalDate.of(2024, 1, 1);
    List<MeterReading> out = new ArrayList<>();
    for (int d = 0; d <= 180; d += 10) {
      out.add(new MeterReading(from.plusDays(d).atStartOfDay().toInstant(ZoneOffset.UTC),
          start + perDay * d));
    }
    return out;
  }

  @Test
  void pipelineRunStoresVirtualConsumption() {
    readings.store("electricity_main", linear(5000d, 12d));
    readings.store("electricity_heat_pump", linear(800d, 5d));

    ResponseEntity<Map<String, Object>> run = rest.exchange("/v1/pipeline/runs",
        HttpMethod.POST, null, new ParameterizedTypeReference<>() {});
    assertThat(run.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> summary = requireNonNull(run.getBody());
    assertThat(summary).containsKeys("run_id", "processed_meters", "failed_meters");
    assertThat((List<?>) summary.get("failed_meters")).isEmpty();
    assertThat((Integer) summary.get("processed_meters")).isGreaterThanOrEqualTo(3);

    ResponseEntity<List<Map<String, Object>>> consumption = rest.exchange(
        "/v1/meters/electricity_household/consumption?freq=M", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});
    assertThat(consumption.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> points = requireNonNull(consumption.getBody());
    assertThat(points).isNotEmpty();
    assertThat(points).allSatisfy(
        p -> assertThat(((Number) p.get("value")).doubleValue()).isGreaterThanOrEqualTo(0d));

    ResponseEntity<Map<String, Object>> series = rest.exchange(
        "/v1/meters/electricity_main/series?freq=D", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});
    assertThat(series.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(requireNonNull(series.getBody()).get("start_date")).isEqualTo("2020-01-01");
  }

  @Test
  void unknownMeterReturnsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/meters/no_such_meter/anomalies", HttpMethod.GET, null,
        new ParameterizedTypeReference<Map<String, Object>>() {});
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    MediaType contentType = Objects.requireNonNull(response.getHeaders().getContentType());
    assertThat(contentType.toString()).contains("application/problem+json");
    assertThat(response.getBody()).containsKeys("type", "title", "status", "detail", "instance");
  }

  @Test
  void openapiDocumentIsValid() {
    String yaml = rest.getForObject("/v3/api-docs.yaml", String.class);
    ParseOptions options = new ParseOptions();
    options.setResolve(true);
    SwaggerParseResult result = new OpenAPIV3Parser().readContents(yaml, null, options);
    assertThat(result.getMessages()).as("validation messages").isEmpty();
    assertThat(result.getOpenAPI()).isNotNull();
    assertThat(result.getOpenAPI().getPaths()).containsKeys("/v1/meters/{id}/consumption",
        "/v1/pipeline/runs");
  }
}
