package org.budgetanalyzer.fxrates;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FxRatesServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(FxRatesServiceApplication.class, args);
  }
}
