package com.scratchsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main Spring Boot application for the scratcher asset sync service.
 *
 * With {@code catalog.run-on-startup=true} it refreshes once and exits with the run's exit code.
 */
@SpringBootApplication
public class ScratcherSyncApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ScratcherSyncApplication.class, args);
        if (context.getEnvironment().getProperty("catalog.run-on-startup", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
