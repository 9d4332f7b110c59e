package dev.vacancypoller.service;

import dev.vacancypoller.config.PollerProperties;
import dev.vacancypoller.entity.Credential;
import dev.vacancypoller.metrics.PollerMetrics;
import dev.vacancypoller.repository.CredentialRepository;
import dev.vacancypoller.service.VacancyIngestionService.IngestionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Fetches and ingests similar vacancies for every linked account with a live token,
 * once per configured search profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VacancyPollService {

    private static final String SEPARATOR = "========================================";

    private final CredentialRepository credentialRepository;
    private final VacancyFetchService fetchService;
    private final VacancyIngestionService ingestionService;
    private final PollerProperties properties;
    private final PollerMetrics metrics;
    private final Clock clock;

    /**
     * Run one poll over all credentials and search profiles.
     *
     * @return totals across every ingested search result
     */
    public IngestionResult parse() {
        log.debug("Parsing vacancies...");

        List<Credential> credentials;
        try {
            credentials = credentialRepository.findAll();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to load credentials: {}", e.getMessage(), e);
            return IngestionResult.empty();
        }

        IngestionResult total = IngestionResult.empty();
        for (String profile : properties.getSearchProfiles()) {
            for (Credential credential : credentials) {
                // Expired tokens wait for the next refresh tick
                if (!credential.isValidAt(clock.instant())) {
                    log.debug("Token expired for subject {}, skipping '{}'", credential.getSubjectId(), profile);
                    continue;
                }

                Optional<String> result = fetchService.fetchFor(credential, profile);
                if (result.isEmpty()) {
                    continue;
                }
                total = total.plus(ingestionService.ingest(result.get()));
            }
        }

        metrics.updateLastRunStats(total.found(), total.created(), total.failed());

        log.info(SEPARATOR);
        log.info("POLL SUMMARY: {} accounts, {} profiles, {} vacancies seen, {} new, {} failed",
                credentials.size(), properties.getSearchProfiles().size(),
                total.found(), total.created(), total.failed());
        log.info(SEPARATOR);
        return total;
    }
}
