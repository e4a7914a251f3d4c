package com.ospicorp.meterseries.config;

import com.ospicorp.meterseries.meter.service.MeterCatalog;
import com.ospicorp.meterseries.meter.service.MeterCatalogFactory;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  MeterCatalog meterCatalog(MeterCatalogProperties properties) {
    return new MeterCatalogFactory().create(properties);
  }
}
