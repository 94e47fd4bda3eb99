package com.dealdesk.deal_bff;

import com.dealdesk.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DealBffApplication {

  public static void main(String[] args) {
    SpringApplication.run(DealBffApplication.class, args);
  }
}
