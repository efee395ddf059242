package com.flamingo.ai.foodscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the local food scout service. */
@SpringBootApplication
public class FoodScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(FoodScoutApplication.class, args);
  }
}
