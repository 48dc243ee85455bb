// Namespace
package com.gnovoa.fantasy;

// Imports
import com.gnovoa.fantasy.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class FantasyLeagueEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(FantasyLeagueEngineApplication.class, args);
  }
}
