package com.ospicorp.meterseries.series.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.meterseries.meter.model.MeterCategory;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.series.model.AnomalyRecord;
import com.ospicorp.meterseries.series.model.AnomalyRecord.Detector;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.MeterReading;
import com.ospicorp.meterseries.series.model.MeterResult;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@SpringBootTest
@Testcontainers
class JdbcRepositoriesIT {

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
  private JdbcRawReadingSource readings;

  @Autowired
  private JdbcResultSink sink;

  @Autowired
  private ProcessedSeriesDao dao;

  @Test
  void readingsComeBackOrderedAndFilteredByStart() {
    Instant t1 = Instant.parse("2024-01-01T06:00:00Z");
    Instant t2 = Instant.parse("2024-01-02T06:00:00Z");
    Instant t3 = Instant.parse("2024-01-03T06:00:00Z");
    readings.store("it_water", List.of(new MeterReading(t3, 30d), new MeterReading(t1, 10d),
        new MeterReading(t2, 20d)));

    assertThat(readings.fetch("it_water", Optional.empty()))
        .extracting(MeterReading::timestamp)
        .containsExactly(t1, t2, t3);
    assertThat(readings.fetch("it_water", Optional.of(t2)))
        .extracting(MeterReading::value)
        .containsExactly(20d, 30d);
    assertThat(readings.fetch("unknown_meter", Optional.empty())).isEmpty();
  }

  @Test
  void storingTheSameTimestampReplacesTheValue() {
    Instant t = Instant.parse("2024-02-01T00:00:00Z");
    readings.store("it_upsert", List.of(new MeterReading(t, 1d)));
    readings.store("it_upsert", List.of(new MeterReading(t, 2d)));

    assertThat(readings.fetch("it_upsert", Optional.empty()))
        .containsExactly(new MeterReading(t, 2d));
  }

  @Test
  void sinkReplacesEarlierResultsOfTheSameMeter() {
    LocalDate day = LocalDate.of(2024, 1, 30);
    MeterResult first = new MeterResult("it_gas", MeterCategory.PHYSICAL, MeterUnit.CUBIC_METRE,
        List.of(new DataPoint(day, 100d), new DataPoint(day.plusDays(1), 103d)),
        List.of(new DataPoint(day.plusDays(1), 103d)),
        List.of(ConsumptionPoint.of(day, 0d, MeterUnit.CUBIC_METRE),
            ConsumptionPoint.of(day.plusDays(1), 3d, MeterUnit.CUBIC_METRE)
                .withSecondary(30.66, MeterUnit.KWH)),
        List.of(ConsumptionPoint.of(day.plusDays(1), 3d, MeterUnit.CUBIC_METRE)),
        List.of(new AnomalyRecord("it_gas", day.plusDays(1), 3d, 3.4, 0.5, 2.5, null,
            EnumSet.of(Detector.GLOBAL_Z_SCORE, Detector.INTERQUARTILE_FENCE))));
    sink.accept(first);

    assertThat(dao.fetchSeries("it_gas", Frequency.D)).hasSize(2);
    assertThat(dao.fetchSeries("it_gas", Frequency.M))
        .containsExactly(new DataPoint(day.plusDays(1), 103d));
    ConsumptionPoint stored = dao.fetchConsumption("it_gas", Frequency.D).get(1);
    assertThat(stored.secondaryUnit()).isEqualTo(MeterUnit.KWH);
    assertThat(stored.secondaryValue()).isEqualTo(30.66);
    AnomalyRecord anomaly = dao.fetchAnomalies("it_gas").get(0);
    assertThat(anomaly.detectors())
        .containsExactlyInAnyOrder(Detector.GLOBAL_Z_SCORE, Detector.INTERQUARTILE_FENCE);
    assertThat(anomaly.rollingZScore()).isNull();

    sink.accept(new MeterResult("it_gas", MeterCategory.PHYSICAL, MeterUnit.CUBIC_METRE,
        List.of(new DataPoint(day, 100d)), List.of(), List.of(), List.of(), List.of()));

    assertThat(dao.fetchSeries("it_gas", Frequency.D))
        .containsExactly(new DataPoint(day, 100d));
    assertThat(dao.fetchConsumption("it_gas", Frequency.M)).isEmpty();
    assertThat(dao.fetchAnomalies("it_gas")).isEmpty();
  }
}
