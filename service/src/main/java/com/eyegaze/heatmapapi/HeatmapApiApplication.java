package com.eyegaze.heatmapapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HeatmapApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(HeatmapApiApplication.class, args);
  }
}
