package com.ospicorp.meterseries.meter.model;

import java.time.LocalDate;
import java.util.Optional;

public record Meter(
    String id,
    String name,
    UtilityType utility,
    MeterUnit unit,
    LocalDate installationDate,
    LocalDate deinstallationDate,
    MeterKind kind,
    SeasonalPattern seasonalPattern
) {

  public static Meter physical(String id, MeterUnit unit) {
    return new Meter(id, id, null, unit, null, null, new MeterKind.Physical(), null);
  }

  public MeterCategory category() {
    return kind.category();
  }

  public Optional<SeasonalPattern> seasonal() {
    return Optional.ofNullable(seasonalPattern);
  }

  public Meter withInstallation(LocalDate installation, LocalDate deinstallation) {
    return new Meter(id, name, utility, unit, installation, deinstallation, kind, seasonalPattern);
  }

  public Meter withSeasonalPattern(SeasonalPattern pattern) {
    return new Meter(id, name, utility, unit, installationDate, deinstallationDate, kind, pattern);
  }
}
