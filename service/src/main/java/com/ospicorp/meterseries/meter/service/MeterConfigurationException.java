package com.ospicorp.meterseries.meter.service;

public class MeterConfigurationException extends RuntimeException {
  private final String meterId;

  public MeterConfigurationException(String meterId, String message) {
    super(message);
    this.meterId = meterId;
  }

  public MeterConfigurationException(String meterId, String message, Throwable cause) {
    super(message, cause);
    this.meterId = meterId;
  }

  public String meterId() {
    return meterId;
  }
}
