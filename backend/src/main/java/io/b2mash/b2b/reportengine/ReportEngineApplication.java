package io.b2mash.b2b.reportengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReportEngineApplication.class, args);
  }
}
