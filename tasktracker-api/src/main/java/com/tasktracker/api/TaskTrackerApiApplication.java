package com.tasktracker.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.tasktracker")
@EnableJpaRepositories(basePackages = "com.tasktracker.infrastructure")
@EntityScan(basePackages = "com.tasktracker.infrastructure")
@ConfigurationPropertiesScan(basePackages = "com.tasktracker")
public class TaskTrackerApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(TaskTrackerApiApplication.class, args);
  }
}
