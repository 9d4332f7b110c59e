package dev.vacancypoller.service;

import dev.vacancypoller.client.HeadHunterClient;
import dev.vacancypoller.entity.Credential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs one similar-vacancy search for a credential's resume.
 * Token validity is the caller's concern.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VacancyFetchService {

    private final HeadHunterClient headHunterClient;

    /**
     * Fetch the raw search result for one search profile.
     *
     * @return the undecoded response body, or empty if the request failed
     */
    public Optional<String> fetchFor(Credential credential, String searchProfile) {
        try {
            String body = headHunterClient
                    .similarVacancies(credential.getSubjectId(), credential.getAccessToken(), searchProfile)
                    .block();
            if (body == null || body.isBlank()) {
                log.warn("Empty similar-vacancy response for subject {} ('{}')",
                        credential.getSubjectId(), searchProfile);
                return Optional.empty();
            }
            return Optional.of(body);
        } catch (RuntimeException e) {
            log.error("Similar-vacancy request failed for subject {} ('{}'): {}",
                    credential.getSubjectId(), searchProfile, e.getMessage());
            return Optional.empty();
        }
    }
}
