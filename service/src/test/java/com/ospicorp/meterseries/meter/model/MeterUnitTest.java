package com.ospicorp.meterseries.meter.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MeterUnitTest {

  @Test
  void parsesConfiguredSymbols() {
    assertEquals(MeterUnit.KWH, MeterUnit.fromSymbol("kWh"));
    assertEquals(MeterUnit.CUBIC_METRE, MeterUnit.fromSymbol("m³"));
    assertEquals(MeterUnit.CUBIC_METRE, MeterUnit.fromSymbol(" m3 "));
    assertEquals(MeterUnit.LITRE, MeterUnit.fromSymbol("L"));
  }

  @Test
  void rejectsUnknownSymbols() {
    assertThrows(IllegalArgumentException.class, () -> MeterUnit.fromSymbol("MWh"));
    assertThrows(IllegalArgumentException.class, () -> MeterUnit.fromSymbol(" "));
  }
}
