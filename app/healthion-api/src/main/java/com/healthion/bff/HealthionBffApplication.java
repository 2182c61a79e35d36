package com.healthion.bff;

import com.healthion.common.config.UtcClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@Import(UtcClockConfig.class)
@RestController
public class HealthionBffApplication {

  public static void main(String[] args) {
    SpringApplication.run(HealthionBffApplication.class, args);
  }

  @GetMapping("/")
  public String root() {
    return "healthion-api: ok";
  }
}
