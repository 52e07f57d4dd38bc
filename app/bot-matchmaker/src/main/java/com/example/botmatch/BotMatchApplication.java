/*
 * Where: Bot matchmaker entry point
 * What: Boots Spring, scans configuration properties and enables the scheduler
 * Why: The matchmaking worker, status API and game server client run as one application
 */
package com.example.botmatch;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class BotMatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(BotMatchApplication.class, args);
  }
}
