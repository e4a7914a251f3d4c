package com.ospicorp.meterseries.meter.model;

public record UnitConversion(MeterUnit from, MeterUnit to) {}
