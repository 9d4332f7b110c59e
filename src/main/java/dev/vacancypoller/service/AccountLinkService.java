package dev.vacancypoller.service;

import dev.vacancypoller.client.HeadHunterClient;
import dev.vacancypoller.entity.Credential;
import dev.vacancypoller.model.ResumeList;
import dev.vacancypoller.model.TokenResponse;
import dev.vacancypoller.repository.CredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;

/**
 * Links a job-board account from an OAuth authorization code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLinkService {

    private final HeadHunterClient headHunterClient;
    private final CredentialRepository credentialRepository;
    private final Clock clock;

    public String authorizeUrl() {
        return headHunterClient.authorizeUrl();
    }

    /**
     * Exchange the code, resolve the account's first resume and store its credential.
     * Relinking an already stored resume replaces its token pair.
     *
     * @param code authorization code from the callback query
     * @return the stored credential
     * @throws AuthorizationException if the code is empty or the provider rejects it
     */
    public Credential link(String code) {
        if (code == null || code.isBlank()) {
            throw new AuthorizationException("Callback code is empty");
        }

        TokenResponse token;
        try {
            token = headHunterClient.exchangeCode(code).block();
        } catch (RuntimeException e) {
            throw new AuthorizationException("Authorization code exchange failed: " + e.getMessage(), e);
        }
        if (token == null || !token.isComplete()) {
            throw new AuthorizationException("Token endpoint returned no usable token pair");
        }

        ResumeList resumes;
        try {
            resumes = headHunterClient.myResumes(token.getAccessToken()).block();
        } catch (RuntimeException e) {
            throw new AuthorizationException("Resume lookup failed: " + e.getMessage(), e);
        }
        if (resumes == null || resumes.getItems() == null || resumes.getItems().isEmpty()) {
            throw new AuthorizationException("Account has no resumes");
        }

        String subjectId = resumes.getItems().get(0).getId();
        Instant now = clock.instant();

        Credential credential = credentialRepository.findBySubjectId(subjectId)
                .orElseGet(() -> Credential.builder().subjectId(subjectId).build());
        boolean relink = credential.getId() != null;
        credential.setAuthCode(code);
        credential.rotate(token.getAccessToken(), token.getRefreshToken(), token.getExpiresIn(), now);

        try {
            Credential saved = credentialRepository.save(credential);
            log.info("{} account for subject {}", relink ? "Relinked" : "Linked", subjectId);
            return saved;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to store credential for subject {}: {}", subjectId, e.getMessage(), e);
            throw e;
        }
    }
}
