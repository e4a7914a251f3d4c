package com.ospicorp.meterseries.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning constants of the interpolation and detection engine. Bound once at startup and handed to
 * each engine component.
 */
@Validated
@ConfigurationProperties(prefix = "meterseries.engine")
public record EngineProperties(
    @DefaultValue("2020") @Min(1970) int startYear,
    @DefaultValue("true") boolean seasonalAutoDetect,
    @DefaultValue("0.0") @PositiveOrZero double resetTolerance,
    @Valid @DefaultValue Reduction reduction,
    @Valid @DefaultValue Boundaries boundaries,
    @Valid @DefaultValue GasConversion gasConversion,
    @Valid @DefaultValue Anomaly anomaly
) {

  public static EngineProperties defaults() {
    return new EngineProperties(2020, true, 0d, Reduction.defaults(), Boundaries.defaults(),
        GasConversion.defaults(), Anomaly.defaults());
  }

  /**
   * Point counts that switch the high-frequency reducer between pass-through, one reading per
   * day and even sampling.
   */
  public record Reduction(
      @DefaultValue("100") @Positive int mediumThreshold,
      @DefaultValue("1000") @Positive int veryDenseThreshold,
      @DefaultValue("50") @Min(3) int targetPoints
  ) {
    public static Reduction defaults() {
      return new Reduction(100, 1000, 50);
    }
  }

  /**
   * How far a nearest-match lookup may reach around a period or month boundary.
   */
  public record Boundaries(
      @DefaultValue("3d") @NotNull Duration dailyOffsetTolerance,
      @DefaultValue("31d") @NotNull Duration monthlyOffsetTolerance,
      @DefaultValue("45d") @NotNull Duration consumptionTolerance
  ) {
    public static Boundaries defaults() {
      return new Boundaries(Duration.ofDays(3), Duration.ofDays(31), Duration.ofDays(45));
    }
  }

  /**
   * Gas energy content in kWh per m³ and the volume correction factor.
   */
  public record GasConversion(
      @DefaultValue("11.504") @DecimalMin(value = "0.0", inclusive = false) double energyContent,
      @DefaultValue("0.8885") @DecimalMin(value = "0.0", inclusive = false) double correctionFactor
  ) {
    public static GasConversion defaults() {
      return new GasConversion(11.504, 0.8885);
    }

    public double kwhPerCubicMetre() {
      return energyContent * correctionFactor;
    }
  }

  public record Anomaly(
      @DefaultValue("60") @Positive int minPoints,
      @DefaultValue("30") @Positive int minNonZeroPoints,
      @DefaultValue("3.0") @Positive double zScoreThreshold,
      @DefaultValue("1.5") @Positive double iqrMultiplier,
      @DefaultValue("30") @Min(2) int rollingWindow,
      @DefaultValue("10") @Min(2) int rollingMinPeriods,
      @DefaultValue("2.5") @Positive double rollingZScoreThreshold,
      @DefaultValue("2") @Min(1) int quorum
  ) {
    public static Anomaly defaults() {
      return new Anomaly(60, 30, 3.0, 1.5, 30, 10, 2.5, 2);
    }
  }
}
