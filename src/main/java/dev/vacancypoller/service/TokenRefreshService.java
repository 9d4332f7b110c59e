package dev.vacancypoller.service;

import dev.vacancypoller.client.HeadHunterClient;
import dev.vacancypoller.entity.Credential;
import dev.vacancypoller.metrics.PollerMetrics;
import dev.vacancypoller.model.TokenResponse;
import dev.vacancypoller.repository.CredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Rotates expired token pairs using their refresh tokens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenRefreshService {

    private final CredentialRepository credentialRepository;
    private final HeadHunterClient headHunterClient;
    private final PollerMetrics metrics;
    private final Clock clock;

    /**
     * Refresh every stored credential whose access token has expired.
     * Failures are logged per credential and never abort the batch.
     */
    public void refreshAll() {
        log.debug("Updating tokens...");

        List<Credential> credentials;
        try {
            credentials = credentialRepository.findAll();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to load credentials: {}", e.getMessage(), e);
            return;
        }

        int refreshed = 0;
        int failed = 0;
        for (Credential credential : credentials) {
            if (credential.isValidAt(clock.instant())) {
                log.debug("Skip token update for subject: {}", credential.getSubjectId());
                continue;
            }
            if (refresh(credential)) {
                refreshed++;
            } else {
                failed++;
            }
        }

        log.info("Token refresh finished: {} credentials, {} refreshed, {} failed",
                credentials.size(), refreshed, failed);
    }

    private boolean refresh(Credential credential) {
        String subjectId = credential.getSubjectId();

        TokenResponse response;
        try {
            response = headHunterClient.refreshToken(credential.getRefreshToken()).block();
        } catch (RuntimeException e) {
            log.error("Token refresh request failed for subject {}: {}", subjectId, e.getMessage());
            metrics.recordTokenRefreshFailure();
            return false;
        }

        if (response == null || !response.isComplete()) {
            log.error("Token endpoint returned no usable token pair for subject {}", subjectId);
            metrics.recordTokenRefreshFailure();
            return false;
        }

        Instant now = clock.instant();
        credential.rotate(response.getAccessToken(), response.getRefreshToken(), response.getExpiresIn(), now);

        try {
            credentialRepository.save(credential);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to store refreshed token for subject {}: {}", subjectId, e.getMessage(), e);
            metrics.recordTokenRefreshFailure();
            return false;
        }

        metrics.recordTokenRefreshed();
        log.info("Refreshed token for subject {} (expires in {}s)", subjectId, response.getExpiresIn());
        return true;
    }
}
