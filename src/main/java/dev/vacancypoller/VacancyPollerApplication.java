package dev.vacancypoller;

import dev.vacancypoller.scheduler.PollingScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class VacancyPollerApplication implements CommandLineRunner {

    private final PollingScheduler pollingScheduler;

    public static void main(String[] args) {
        SpringApplication.run(VacancyPollerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        log.info("========================================");
        log.info("Vacancy Poller Starting");
        log.info("========================================");

        // Blocks until the context shuts down and stops the scheduler
        pollingScheduler.start();

        log.info("Vacancy Poller exiting...");
    }
}
