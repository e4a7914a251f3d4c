package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.config.EngineProperties;
import com.ospicorp.meterseries.meter.model.CompositionMode;
import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.MeterKind;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.meter.model.Period;
import com.ospicorp.meterseries.series.model.DataPoint;
import com.ospicorp.meterseries.series.model.MasterComposition;
import com.ospicorp.meterseries.series.model.enums.Frequency;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stitches the periods of a master meter into one continuous series.
 *
 * <p>Each period contributes the (converted, optionally summed) series of its source meters,
 * restricted to the period. A period flagged to continue from its predecessor is shifted so that
 * its value at the boundary equals the predecessor's last value. The monthly series is always
 * aggregated from the stitched daily series.
 */
@Component
public class MasterMeterComposer {
  private static final Logger log = LoggerFactory.getLogger(MasterMeterComposer.class);

  static final double LARGE_OFFSET_RATIO = 0.2;

  private final UnitConverter unitConverter;
  private final EngineProperties.Boundaries boundaries;

  public MasterMeterComposer(EngineProperties properties, UnitConverter unitConverter) {
    this.unitConverter = unitConverter;
    this.boundaries = properties.boundaries();
  }

  /**
   * @param dailySources daily cumulative series per source meter id
   * @param monthlySources monthly cumulative series per source meter id
   */
  public MasterComposition compose(Meter master, Map<String, List<DataPoint>> dailySources,
      Map<String, List<DataPoint>> monthlySources) {
    if (!(master.kind() instanceof MeterKind.Master kind)) {
      throw new IllegalArgumentException(master.id() + " is not a master meter");
    }
    List<List<DataPoint>> dailySegments = composeSegments(master, kind.periods(), dailySources,
        boundaries.dailyOffsetTolerance(), Frequency.D);
    List<List<DataPoint>> monthlySegments = composeSegments(master, kind.periods(),
        monthlySources, boundaries.monthlyOffsetTolerance(), Frequency.M);

    TreeMap<LocalDate, Double> merged = new TreeMap<>();
    for (List<DataPoint> segment : dailySegments) {
      for (DataPoint p : segment) {
        merged.putIfAbsent(p.date(), p.value());
      }
    }
    List<DataPoint> daily = new ArrayList<>(merged.size());
    merged.forEach((date, value) -> daily.add(new DataPoint(date, value)));
    List<DataPoint> monthly = Resampler.aggregate(daily, Frequency.M);
    log.info("Composed master {} from {} periods: {} daily, {} monthly points", master.id(),
        kind.periods().size(), daily.size(), monthly.size());
    return new MasterComposition(daily, monthly, monthlySegments);
  }

  private List<List<DataPoint>> composeSegments(Meter master, List<Period> periods,
      Map<String, List<DataPoint>> sources, Duration tolerance, Frequency frequency) {
    List<List<DataPoint>> segments = new ArrayList<>(periods.size());
    Double anchor = null;
    for (Period period : periods) {
      List<DataPoint> segment = composePeriod(master, period, sources);
      if (period.offsetFromPrevious()) {
        segment = applyOffset(master.id(), period, segment, anchor, tolerance, frequency);
      }
      if (segment.isEmpty()) {
        log.warn("Master {} period {}..{} ({}) has no data", master.id(), period.start(),
            period.end(), frequency);
      } else {
        anchor = segment.get(segment.size() - 1).value();
      }
      segments.add(segment);
    }
    return segments;
  }

  private List<DataPoint> composePeriod(Meter master, Period period,
      Map<String, List<DataPoint>> sources) {
    List<String> ids = period.mode() == CompositionMode.SINGLE
        ? period.sourceMeterIds().subList(0, 1) : period.sourceMeterIds();
    TreeMap<LocalDate, Double> sum = new TreeMap<>();
    for (String sourceId : ids) {
      List<DataPoint> series = sources.get(sourceId);
      if (series == null || series.isEmpty()) {
        log.warn("Master {}: source {} has no series for {}..{}", master.id(), sourceId,
            period.start(), period.end());
        continue;
      }
      List<DataPoint> restricted = series.stream().filter(p -> period.contains(p.date())).toList();
      List<DataPoint> converted = convert(restricted, period.sourceUnit(), master.unit());
      for (DataPoint p : converted) {
        sum.merge(p.date(), p.value(), Double::sum);
      }
    }
    List<DataPoint> out = new ArrayList<>(sum.size());
    sum.forEach((date, value) -> out.add(new DataPoint(date, value)));
    return out;
  }

  private List<DataPoint> convert(List<DataPoint> series, MeterUnit from, MeterUnit to) {
    if (from == null || from == to) {
      return series;
    }
    return unitConverter.convertSeries(series, from, to);
  }

  private List<DataPoint> applyOffset(String masterId, Period period, List<DataPoint> segment,
      Double anchor, Duration tolerance, Frequency frequency) {
    if (segment.isEmpty()) {
      return segment;
    }
    if (anchor == null) {
      log.warn("Master {}: no previous period value to continue from at {} ({}), offset skipped",
          masterId, period.start(), frequency);
      return segment;
    }
    Optional<DataPoint> first = SeriesLookup.nearest(segment,
        Interpolator.startOfDay(period.start()), tolerance);
    if (first.isEmpty()) {
      log.warn("Master {}: no value within {} of period start {} ({}), offset skipped", masterId,
          tolerance, period.start(), frequency);
      return segment;
    }
    double offset = anchor - first.get().value();
    if (Math.abs(offset) > LARGE_OFFSET_RATIO * Math.abs(anchor)) {
      log.warn("Master {}: large offset {} at {} (anchor {}), check the period configuration",
          masterId, offset, period.start(), anchor);
    } else {
      log.debug("Master {}: offset {} at {} ({})", masterId, offset, period.start(), frequency);
    }
    return segment.stream().map(p -> p.withValue(p.value() + offset)).toList();
  }
}
