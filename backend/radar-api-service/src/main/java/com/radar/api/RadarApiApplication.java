package com.radar.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadarApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(RadarApiApplication.class, args);
  }
}
