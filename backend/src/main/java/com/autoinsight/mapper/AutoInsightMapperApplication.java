package com.autoinsight.mapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoInsightMapperApplication {

  public static void main(String[] args) {
    SpringApplication.run(AutoInsightMapperApplication.class, args);
  }
}
