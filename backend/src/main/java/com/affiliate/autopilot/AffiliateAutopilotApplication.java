package com.affiliate.autopilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AffiliateAutopilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(AffiliateAutopilotApplication.class, args);
  }
}
