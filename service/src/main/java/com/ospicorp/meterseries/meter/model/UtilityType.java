package com.ospicorp.meterseries.meter.model;

public enum UtilityType {
  ELECTRICITY,
  GAS,
  WATER,
  HEAT,
  SOLAR
}
