package com.ospicorp.meterseries.meter.model;

public enum CompositionMode {
  /** The period's series is the single source meter's series. */
  SINGLE,
  /** Source series are aligned on date and summed, missing dates count as zero. */
  SUM
}
