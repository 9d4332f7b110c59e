package dev.vacancypoller.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Job-board OAuth client registration and API endpoints.
 * Loaded from application.yml under 'hh' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hh")
public class HeadHunterProperties {

    private String clientId;
    private String clientSecret;
    private String redirectUri;
    private String apiBaseUrl = "https://api.hh.ru";
    private String authBaseUrl = "https://hh.ru";
    private String userAgent = "HHelper/1.0";
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Fail startup when the OAuth client registration is incomplete.
     */
    @PostConstruct
    public void validate() {
        require("hh.client-id", clientId);
        require("hh.client-secret", clientSecret);
        require("hh.redirect-uri", redirectUri);
    }

    private static void require(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required configuration property: " + name);
        }
    }
}
