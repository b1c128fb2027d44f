package com.vehicle.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VehicleTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(VehicleTrackerApplication.class, args);
  }
}
