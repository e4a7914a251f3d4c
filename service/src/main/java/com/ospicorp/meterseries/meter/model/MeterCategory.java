package com.ospicorp.meterseries.meter.model;

public enum MeterCategory {
  PHYSICAL,
  MASTER,
  VIRTUAL
}
