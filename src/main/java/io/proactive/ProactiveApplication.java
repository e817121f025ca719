package io.proactive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Proactive scheduler for an always-on assistant: runs scheduled agent jobs and a
 * standing-instructions heartbeat, and notifies the owner of the results.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProactiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProactiveApplication.class, args);
    }
}
