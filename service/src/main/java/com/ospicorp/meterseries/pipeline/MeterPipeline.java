package com.ospicorp.meterseries.pipeline;

import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.MeterKind;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.meter.model.Period;
import com.ospicorp.meterseries.meter.model.UtilityType;
import com.ospicorp.meterseries.meter.service.MeterCatalog;
import com.ospicorp.meterseries.series.model.AnomalyRecord;
import com.ospicorp.meterseries.series.model.ConsumptionPoint;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.MasterComposition;
import com.ospicorp.meterseries.series.model.MeterReading;
import com.ospicorp.meterseries.series.model.MeterResult;
import com.ospicorp.meterseries.series.model.SeriesWindow;
import com.ospicorp.meterseries.series.model.VirtualMeterResult;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import com.ospicorp.meterseries.series.repository.RawReadingSource;
import com.ospicorp.meterseries.series.service.AnomalyDetector;
import com.ospicorp.meterseries.series.service.ConsumptionCalculator;
import com.ospicorp.meterseries.series.service.DailySeriesSynthesizer;
import com.ospicorp.meterseries.series.service.MasterMeterComposer;
import com.ospicorp.meterseries.series.service.Resampler;
import com.ospicorp.meterseries.series.service.SeriesCache;
import com.ospicorp.meterseries.series.service.SeriesCacheKey;
import com.ospicorp.meterseries.series.service.UnitConverter;
import com.ospicorp.meterseries.series.service.VirtualMeterCalculator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Runs every configured meter through the engine for one window.
 *
 * <p>Stages run in dependency order: physical meters, master meters (configuration order, so a
 * master may use an earlier master), consumption, virtual meters (configuration order) and finally
 * anomaly detection on daily consumption. A failure is confined to the meter that raised it.
 */
@Component
public class MeterPipeline {
  private static final Logger log = LoggerFactory.getLogger(MeterPipeline.class);

  static final String MDC_METER = "meter";

  private final RawReadingSource readingSource;
  private final DailySeriesSynthesizer synthesizer;
  private final MasterMeterComposer masterComposer;
  private final ConsumptionCalculator consumptionCalculator;
  private final VirtualMeterCalculator virtualCalculator;
  private final AnomalyDetector anomalyDetector;
  private final UnitConverter unitConverter;

  public MeterPipeline(RawReadingSource readingSource, DailySeriesSynthesizer synthesizer,
      MasterMeterComposer masterComposer, ConsumptionCalculator consumptionCalculator,
      VirtualMeterCalculator virtualCalculator, AnomalyDetector anomalyDetector,
      UnitConverter unitConverter) {
    this.readingSource = readingSource;
    this.synthesizer = synthesizer;
    this.masterComposer = masterComposer;
    this.consumptionCalculator = consumptionCalculator;
    this.virtualCalculator = virtualCalculator;
    this.anomalyDetector = anomalyDetector;
    this.unitConverter = unitConverter;
  }

  public PipelineRun run(MeterCatalog catalog, SeriesWindow window) {
    Run run = new Run(catalog, window);
    for (Meter meter : catalog.all()) {
      if (meter.kind() instanceof MeterKind.Physical) {
        isolated(run, meter, () -> run.series(meter));
      }
    }
    for (Meter meter : catalog.all()) {
      if (meter.kind() instanceof MeterKind.Master master) {
        isolated(run, meter, () -> composeMaster(run, meter, master));
      }
    }
    for (Meter meter : catalog.all()) {
      if (!(meter.kind() instanceof MeterKind.Virtual)) {
        isolated(run, meter, () -> consumption(run, meter));
      }
    }
    for (Meter meter : catalog.all()) {
      if (meter.kind() instanceof MeterKind.Virtual virtual) {
        isolated(run, meter, () -> computeVirtual(run, meter, virtual));
      }
    }
    for (Meter meter : catalog.all()) {
      isolated(run, meter, () -> detectAnomalies(run, meter));
    }

    List<MeterResult> results = new ArrayList<>();
    for (Meter meter : catalog.all()) {
      if (run.failed.contains(meter.id())) {
        continue;
      }
      MeterResult result = run.result(meter);
      if (!result.isEmpty()) {
        results.add(result);
      }
    }
    log.info("Pipeline run over {}..{}: {} meters with results, {} failed", window.start(),
        window.end(), results.size(), run.failed.size());
    return new PipelineRun(window, results, new ArrayList<>(run.failed));
  }

  private void isolated(Run run, Meter meter, Runnable stage) {
    if (run.failed.contains(meter.id())) {
      return;
    }
    MDC.put(MDC_METER, meter.id());
    try {
      stage.run();
    } catch (RuntimeException ex) {
      log.error("Processing meter {} failed: {}", meter.id(), ex.getMessage(), ex);
      run.failed.add(meter.id());
    } finally {
      MDC.remove(MDC_METER);
    }
  }

  private void composeMaster(Run run, Meter meter, MeterKind.Master master) {
    Map<String, List<DataPoint>> daily = new HashMap<>();
    Map<String, List<DataPoint>> monthly = new HashMap<>();
    for (Period period : master.periods()) {
      for (String sourceId : period.sourceMeterIds()) {
        if (daily.containsKey(sourceId) || run.failed.contains(sourceId)) {
          continue;
        }
        Meter source = run.catalog.find(sourceId)
            .orElseGet(() -> Meter.physical(sourceId, period.sourceUnit()));
        Optional<List<DataPoint>> series = source.kind() instanceof MeterKind.Physical
            ? run.series(source) : run.cache.get(run.key(sourceId, Frequency.D));
        series.ifPresent(s -> {
          daily.put(sourceId, s);
          monthly.put(sourceId, run.monthly(sourceId).orElse(List.of()));
        });
      }
    }
    MasterComposition composition = masterComposer.compose(meter, daily, monthly);
    if (composition.daily().isEmpty()) {
      log.warn("Master {} has no data in {}..{}", meter.id(), run.window.start(),
          run.window.end());
      return;
    }
    run.cache.put(run.key(meter.id(), Frequency.D), composition.daily());
    run.cache.put(run.key(meter.id(), Frequency.M), composition.monthly());
  }

  private void consumption(Run run, Meter meter) {
    Optional<List<DataPoint>> daily = run.cache.get(run.key(meter.id(), Frequency.D));
    if (daily.isEmpty()) {
      return;
    }
    run.dailyConsumption.put(meter.id(), withSecondaryUnit(meter,
        consumptionCalculator.consumption(daily.get(), Frequency.D, meter.unit())));
    run.monthlyConsumption.put(meter.id(), withSecondaryUnit(meter,
        consumptionCalculator.consumption(daily.get(), Frequency.M, meter.unit())));
  }

  private void computeVirtual(Run run, Meter meter, MeterKind.Virtual virtual) {
    Optional<VirtualMeterResult> monthly = virtualCalculator.calculate(meter.id(),
        virtual.definition(), meter.unit(), run.monthlyConsumption);
    Optional<VirtualMeterResult> daily = virtualCalculator.calculate(meter.id(),
        virtual.definition(), meter.unit(), run.dailyConsumption);
    monthly.ifPresent(result -> {
      run.monthlyConsumption.put(meter.id(), withSecondaryUnit(meter, result.consumption()));
      run.cache.put(run.key(meter.id(), Frequency.M), result.cumulative());
    });
    daily.ifPresent(result -> {
      run.dailyConsumption.put(meter.id(), withSecondaryUnit(meter, result.consumption()));
      run.cache.put(run.key(meter.id(), Frequency.D), result.cumulative());
    });
  }

  private void detectAnomalies(Run run, Meter meter) {
    List<ConsumptionPoint> daily = run.dailyConsumption.get(meter.id());
    if (daily != null) {
      run.anomalies.put(meter.id(), anomalyDetector.detect(meter.id(), daily));
    }
  }

  private List<ConsumptionPoint> withSecondaryUnit(Meter meter, List<ConsumptionPoint> points) {
    if (meter.utility() != UtilityType.GAS) {
      return points;
    }
    MeterUnit secondary = switch (meter.unit()) {
      case CUBIC_METRE -> MeterUnit.KWH;
      case KWH -> MeterUnit.CUBIC_METRE;
      default -> null;
    };
    if (secondary == null) {
      return points;
    }
    OptionalDouble factor = unitConverter.factor(meter.unit(), secondary);
    if (factor.isEmpty()) {
      return points;
    }
    double f = factor.getAsDouble();
    return points.stream().map(p -> p.withSecondary(p.value() * f, secondary)).toList();
  }

  /**
   * Per-run state. Raw readings are fetched at most once per meter; derived series live in the
   * run's cache.
   */
  private final class Run {
    private final MeterCatalog catalog;
    private final SeriesWindow window;
    private final SeriesCache cache = new SeriesCache();
    private final Map<String, List<MeterReading>> readings = new ConcurrentHashMap<>();
    private final Map<String, List<ConsumptionPoint>> dailyConsumption = new LinkedHashMap<>();
    private final Map<String, List<ConsumptionPoint>> monthlyConsumption = new LinkedHashMap<>();
    private final Map<String, List<AnomalyRecord>> anomalies = new HashMap<>();
    private final Set<String> failed = new LinkedHashSet<>();

    private Run(MeterCatalog catalog, SeriesWindow window) {
      this.catalog = catalog;
      this.window = window;
    }

    SeriesCacheKey key(String meterId, Frequency frequency) {
      return new SeriesCacheKey(meterId, window, frequency);
    }

    List<MeterReading> readings(String meterId) {
      return readings.computeIfAbsent(meterId,
          id -> readingSource.fetch(id, Optional.empty()));
    }

    Optional<List<DataPoint>> series(Meter meter) {
      Optional<List<DataPoint>> daily = cache.computeIfAbsent(key(meter.id(), Frequency.D),
          () -> synthesizer.synthesize(meter, window, readings(meter.id())));
      daily.ifPresent(d -> cache.computeIfAbsent(key(meter.id(), Frequency.M),
          () -> Optional.of(Resampler.aggregate(d, Frequency.M))));
      return daily;
    }

    Optional<List<DataPoint>> monthly(String meterId) {
      return cache.get(key(meterId, Frequency.M));
    }

    MeterResult result(Meter meter) {
      return new MeterResult(meter.id(), meter.category(), meter.unit(),
          cache.get(key(meter.id(), Frequency.D)).orElse(List.of()),
          cache.get(key(meter.id(), Frequency.M)).orElse(List.of()),
          dailyConsumption.getOrDefault(meter.id(), List.of()),
          monthlyConsumption.getOrDefault(meter.id(), List.of()),
          anomalies.getOrDefault(meter.id(), List.of()));
    }
  }
}
