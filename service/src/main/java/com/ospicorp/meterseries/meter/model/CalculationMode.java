package com.ospicorp.meterseries.meter.model;

public enum CalculationMode {
  SUBTRACTION
}
