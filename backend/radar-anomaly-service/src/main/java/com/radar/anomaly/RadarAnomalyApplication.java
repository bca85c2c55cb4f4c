package com.radar.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadarAnomalyApplication {

  public static void main(String[] args) {
    SpringApplication.run(RadarAnomalyApplication.class, args);
  }
}
