package dev.vacancypoller.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tick intervals and search profiles for the polling loop.
 * Loaded from application.yml under 'poller' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "poller")
public class PollerProperties {

    private Duration refreshInterval = Duration.ofSeconds(60);
    private Duration parseInterval = Duration.ofSeconds(600);
    private List<String> searchProfiles = new ArrayList<>(List.of("Nest.js", "Go"));
    private int perPage = 100;

    /** How long context shutdown waits for a running job to finish. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
