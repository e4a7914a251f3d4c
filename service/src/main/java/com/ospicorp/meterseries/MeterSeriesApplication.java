package com.ospicorp.meterseries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MeterSeriesApplication {
  public static void main(String[] args) {
    SpringApplication.run(MeterSeriesApplication.class, args);
  }
}
