package com.ospicorp.meterseries.meter.model;

import java.util.List;

/**
 * How a meter's series comes into existence. Resolved once when the catalog is built so the
 * pipeline never has to re-inspect raw configuration.
 */
public sealed interface MeterKind permits MeterKind.Physical, MeterKind.Master, MeterKind.Virtual {

  MeterCategory category();

  record Physical() implements MeterKind {
    @Override
    public MeterCategory category() {
      return MeterCategory.PHYSICAL;
    }
  }

  record Master(List<Period> periods) implements MeterKind {
    public Master {
      periods = List.copyOf(periods);
    }

    @Override
    public MeterCategory category() {
      return MeterCategory.MASTER;
    }
  }

  record Virtual(VirtualMeterDefinition definition) implements MeterKind {
    @Override
    public MeterCategory category() {
      return MeterCategory.VIRTUAL;
    }
  }
}
