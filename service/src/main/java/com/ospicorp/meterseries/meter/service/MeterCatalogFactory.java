package com.ospicorp.meterseries.meter.service;

import com.ospicorp.meterseries.config.MeterCatalogProperties;
import com.ospicorp.meterseries.config.MeterCatalogProperties.ConversionDefinition;
import com.ospicorp.meterseries.config.MeterCatalogProperties.MeterDefinition;
import com.ospicorp.meterseries.config.MeterCatalogProperties.PeriodDefinition;
import com.ospicorp.meterseries.meter.model.CalculationMode;
import com.ospicorp.meterseries.meter.model.CompositionMode;
import com.ospicorp.meterseries.meter.model.Meter;
import com.ospicorp.meterseries.meter.model.MeterKind;
import com.ospicorp.meterseries.meter.model.MeterUnit;
import com.ospicorp.meterseries.meter.model.Period;
import com.ospicorp.meterseries.meter.model.SeasonalPattern;
import com.ospicorp.meterseries.meter.model.UnitConversion;
import com.ospicorp.meterseries.meter.model.UtilityType;
import com.ospicorp.meterseries.meter.model.VirtualMeterDefinition;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns raw meter definitions into a {@link MeterCatalog}. A malformed definition is logged and
 * skipped; it never prevents the remaining meters from loading.
 */
public class MeterCatalogFactory {
  private static final Logger log = LoggerFactory.getLogger(MeterCatalogFactory.class);

  public MeterCatalog create(MeterCatalogProperties properties) {
    List<MeterDefinition> definitions = properties.meters() == null
        ? List.of() : properties.meters();
    List<Meter> meters = new ArrayList<>(definitions.size());
    Set<String> seen = new HashSet<>();
    for (MeterDefinition definition : definitions) {
      try {
        Meter meter = toMeter(definition);
        if (!seen.add(meter.id())) {
          throw new MeterConfigurationException(meter.id(), "duplicate meter id");
        }
        meters.add(meter);
      } catch (MeterConfigurationException ex) {
        log.warn("Skipping meter {}: {}", ex.meterId(), ex.getMessage());
      }
    }
    log.info("Loaded {} of {} configured meters", meters.size(), definitions.size());
    return new MeterCatalog(meters);
  }

  Meter toMeter(MeterDefinition definition) {
    String id = definition.id();
    if (!StringUtils.hasText(id)) {
      throw new MeterConfigurationException("<unnamed>", "meter id must be provided");
    }
    MeterUnit unit = parseUnit(id, definition.unit(), "unit");
    LocalDate installation = parseDate(id, definition.installationDate(), "installation_date");
    LocalDate deinstallation = parseDate(id, definition.deinstallationDate(),
        "deinstallation_date");
    if (installation != null && deinstallation != null && deinstallation.isBefore(installation)) {
      throw new MeterConfigurationException(id, "deinstallation date precedes installation date");
    }
    MeterKind kind = parseKind(definition, unit);
    String name = StringUtils.hasText(definition.name()) ? definition.name() : id;
    return new Meter(id, name, parseUtility(id, definition.utility()), unit, installation,
        deinstallation, kind, parseSeasonalPattern(id, definition.seasonalPercentages()));
  }

  private MeterKind parseKind(MeterDefinition definition, MeterUnit unit) {
    String id = definition.id();
    String category = StringUtils.hasText(definition.category())
        ? definition.category().trim().toLowerCase(Locale.ROOT) : "physical";
    return switch (category) {
      case "physical" -> new MeterKind.Physical();
      case "master" -> new MeterKind.Master(parsePeriods(id, definition.periods(), unit));
      case "virtual" -> new MeterKind.Virtual(parseVirtual(definition));
      default -> throw new MeterConfigurationException(id, "unknown category " + category);
    };
  }

  private List<Period> parsePeriods(String id, List<PeriodDefinition> definitions,
      MeterUnit outputUnit) {
    if (definitions == null || definitions.isEmpty()) {
      throw new MeterConfigurationException(id, "master meter needs at least one period");
    }
    List<Period> periods = new ArrayList<>(definitions.size());
    Period previous = null;
    for (int i = 0; i < definitions.size(); i++) {
      PeriodDefinition definition = definitions.get(i);
      String label = "period " + (i + 1);
      LocalDate start = parseDate(id, definition.startDate(), label + " start_date");
      LocalDate end = parseDate(id, definition.endDate(), label + " end_date");
      if (start == null || end == null) {
        throw new MeterConfigurationException(id, label + " needs a start and end date");
      }
      if (end.isBefore(start)) {
        throw new MeterConfigurationException(id, label + " ends before it starts");
      }
      // adjacent periods may share their boundary day
      if (previous != null && start.isBefore(previous.end())) {
        throw new MeterConfigurationException(id, label + " overlaps the previous period");
      }
      List<String> sources = definition.sourceMeters() == null
          ? List.of() : definition.sourceMeters();
      if (sources.isEmpty()) {
        throw new MeterConfigurationException(id, label + " has no source meters");
      }
      CompositionMode mode = parseComposition(id, definition.composition());
      MeterUnit sourceUnit = StringUtils.hasText(definition.sourceUnit())
          ? parseUnit(id, definition.sourceUnit(), label + " source_unit") : outputUnit;
      Period period = new Period(start, end, mode, sources, sourceUnit,
          definition.applyOffsetFromPrevious());
      periods.add(period);
      previous = period;
    }
    return periods;
  }

  private VirtualMeterDefinition parseVirtual(MeterDefinition definition) {
    String id = definition.id();
    if (!StringUtils.hasText(definition.baseMeter())) {
      throw new MeterConfigurationException(id, "virtual meter needs a base meter");
    }
    List<String> subtract = definition.subtractMeters() == null
        ? List.of() : definition.subtractMeters();
    if (subtract.contains(definition.baseMeter()) || subtract.contains(id)) {
      throw new MeterConfigurationException(id, "virtual meter subtracts its own base");
    }
    Map<String, UnitConversion> conversions = new LinkedHashMap<>();
    if (definition.subtractConversions() != null) {
      for (Map.Entry<String, ConversionDefinition> e : definition.subtractConversions().entrySet()) {
        ConversionDefinition conversion = e.getValue();
        if (conversion == null) {
          continue;
        }
        conversions.put(e.getKey(), new UnitConversion(
            parseUnit(id, conversion.fromUnit(), "conversion from_unit of " + e.getKey()),
            parseUnit(id, conversion.toUnit(), "conversion to_unit of " + e.getKey())));
      }
    }
    String calculation = StringUtils.hasText(definition.calculation())
        ? definition.calculation().trim().toUpperCase(Locale.ROOT) : "SUBTRACTION";
    CalculationMode mode;
    try {
      mode = CalculationMode.valueOf(calculation);
    } catch (IllegalArgumentException ex) {
      throw new MeterConfigurationException(id, "unsupported calculation " + calculation, ex);
    }
    return new VirtualMeterDefinition(definition.baseMeter(), subtract, conversions, mode);
  }

  private SeasonalPattern parseSeasonalPattern(String id, List<Double> percentages) {
    if (percentages == null || percentages.isEmpty()) {
      return null;
    }
    try {
      SeasonalPattern pattern = SeasonalPattern.fromMonthlyPercentages(percentages);
      log.info("Loaded seasonal pattern for {}", id);
      return pattern;
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring seasonal pattern for {}: {}", id, ex.getMessage());
      return null;
    }
  }

  private CompositionMode parseComposition(String id, String composition) {
    if (!StringUtils.hasText(composition)) {
      return CompositionMode.SINGLE;
    }
    try {
      return CompositionMode.valueOf(composition.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new MeterConfigurationException(id, "unknown composition type " + composition, ex);
    }
  }

  private UtilityType parseUtility(String id, String utility) {
    if (!StringUtils.hasText(utility)) {
      return null;
    }
    try {
      return UtilityType.valueOf(utility.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new MeterConfigurationException(id, "unknown utility type " + utility, ex);
    }
  }

  private MeterUnit parseUnit(String id, String unit, String field) {
    try {
      return MeterUnit.fromSymbol(unit);
    } catch (IllegalArgumentException ex) {
      throw new MeterConfigurationException(id, field + ": " + ex.getMessage(), ex);
    }
  }

  private LocalDate parseDate(String id, String value, String field) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException ex) {
      throw new MeterConfigurationException(id, field + " is not an ISO date: " + value, ex);
    }
  }
}
