package com.flamingo.ai.companybrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the company knowledge base query service. */
@SpringBootApplication
public class CompanyBrainApplication {

  public static void main(String[] args) {
    SpringApplication.run(CompanyBrainApplication.class, args);
  }
}
