package dev.vacancypoller.service;

import dev.vacancypoller.client.HeadHunterClient;
import dev.vacancypoller.entity.Credential;
import dev.vacancypoller.metrics.PollerMetrics;
import dev.vacancypoller.model.TokenResponse;
import dev.vacancypoller.repository.CredentialRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenRefreshServiceTest {

    private static final long T = 1_700_000_000L;

    @Mock
    private CredentialRepository credentialRepository;

    @Mock
    private HeadHunterClient headHunterClient;

    @Mock
    private PollerMetrics metrics;

    private TokenRefreshService serviceAt(long epochSecond) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
        return new TokenRefreshService(credentialRepository, headHunterClient, metrics, clock);
    }

    private Credential credential(String subjectId, String refreshToken) {
        return Credential.builder()
                .id((long) subjectId.hashCode())
                .subjectId(subjectId)
                .accessToken("access-" + subjectId)
                .refreshToken(refreshToken)
                .issuedAt(T)
                .expiresInSeconds(100)
                .build();
    }

    @Nested
    @DisplayName("Expiry decisions")
    class ExpiryTests {

        @Test
        @DisplayName("Should skip a credential whose token is still valid")
        void shouldSkipValidCredential() {
            Credential credential = credential("resume-1", "refresh-1");
            when(credentialRepository.findAll()).thenReturn(List.of(credential));

            serviceAt(T + 50).refreshAll();

            verifyNoInteractions(headHunterClient);
            verify(credentialRepository, never()).save(any());
            assertThat(credential.getIssuedAt()).isEqualTo(T);
            assertThat(credential.getAccessToken()).isEqualTo("access-resume-1");
        }

        @Test
        @DisplayName("Should refresh an expired credential and reset issuedAt to now")
        void shouldRefreshExpiredCredential() {
            Credential credential = credential("resume-1", "refresh-1");
            when(credentialRepository.findAll()).thenReturn(List.of(credential));
            when(headHunterClient.refreshToken("refresh-1"))
                    .thenReturn(Mono.just(new TokenResponse("new-access", "new-refresh", 1209600L, "bearer")));

            serviceAt(T + 150).refreshAll();

            ArgumentCaptor<Credential> captor = ArgumentCaptor.forClass(Credential.class);
            verify(credentialRepository).save(captor.capture());
            Credential saved = captor.getValue();
            assertThat(saved)
                    .extracting(Credential::getAccessToken, Credential::getRefreshToken,
                            Credential::getExpiresInSeconds, Credential::getIssuedAt)
                    .containsExactly("new-access", "new-refresh", 1209600L, T + 150);
            verify(metrics).recordTokenRefreshed();
        }

        @Test
        @DisplayName("Should treat the exact expiry instant as expired")
        void shouldRefreshAtExactExpiry() {
            Credential credential = credential("resume-1", "refresh-1");
            when(credentialRepository.findAll()).thenReturn(List.of(credential));
            when(headHunterClient.refreshToken("refresh-1"))
                    .thenReturn(Mono.just(new TokenResponse("new-access", "new-refresh", 100L, "bearer")));

            serviceAt(T + 100).refreshAll();

            verify(headHunterClient).refreshToken("refresh-1");
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureTests {

        @Test
        @DisplayName("Should continue with the next credential when a refresh request fails")
        void shouldContinueAfterTransportError() {
            Credential broken = credential("resume-1", "refresh-1");
            Credential healthy = credential("resume-2", "refresh-2");
            when(credentialRepository.findAll()).thenReturn(List.of(broken, healthy));
            when(headHunterClient.refreshToken("refresh-1")).thenReturn(Mono.error(
                    new WebClientRequestException(new IOException("connection reset"),
                            HttpMethod.POST, URI.create("http://hh/oauth/token"), new HttpHeaders())));
            when(headHunterClient.refreshToken("refresh-2"))
                    .thenReturn(Mono.just(new TokenResponse("a2", "r2", 100L, "bearer")));

            serviceAt(T + 150).refreshAll();

            verify(credentialRepository, times(1)).save(healthy);
            verify(credentialRepository, never()).save(broken);
            assertThat(broken.getIssuedAt()).isEqualTo(T);
            verify(metrics).recordTokenRefreshFailure();
            verify(metrics).recordTokenRefreshed();
        }

        @Test
        @DisplayName("Should not store an incomplete token response")
        void shouldRejectIncompleteResponse() {
            Credential credential = credential("resume-1", "refresh-1");
            when(credentialRepository.findAll()).thenReturn(List.of(credential));
            when(headHunterClient.refreshToken("refresh-1"))
                    .thenReturn(Mono.just(new TokenResponse(null, null, null, null)));

            serviceAt(T + 150).refreshAll();

            verify(credentialRepository, never()).save(any());
            assertThat(credential.getAccessToken()).isEqualTo("access-resume-1");
            verify(metrics).recordTokenRefreshFailure();
        }

        @ParameterizedTest
        @ValueSource(longs = {0, -1})
        @DisplayName("Should not store a token response without a positive lifetime")
        void shouldRejectNonPositiveLifetime(long expiresIn) {
            Credential credential = credential("resume-1", "refresh-1");
            when(credentialRepository.findAll()).thenReturn(List.of(credential));
            when(headHunterClient.refreshToken("refresh-1"))
                    .thenReturn(Mono.just(new TokenResponse("a", "r", expiresIn, "bearer")));

            serviceAt(T + 150).refreshAll();

            verify(credentialRepository, never()).save(any());
            assertThat(credential.getExpiresInSeconds()).isEqualTo(100);
            verify(metrics).recordTokenRefreshFailure();
        }

        @Test
        @DisplayName("Should not store a token response missing expires_in")
        void shouldRejectMissingLifetime() {
            Credential credential = credential("resume-1", "refresh-1");
            when(credentialRepository.findAll()).thenReturn(List.of(credential));
            when(headHunterClient.refreshToken("refresh-1"))
                    .thenReturn(Mono.just(new TokenResponse("a", "r", null, "bearer")));

            serviceAt(T + 150).refreshAll();

            verify(credentialRepository, never()).save(any());
            verify(metrics).recordTokenRefreshFailure();
        }

        @Test
        @DisplayName("Should continue with the next credential when no transaction can be opened")
        void shouldContinueAfterTransactionFailure() {
            Credential first = credential("resume-1", "refresh-1");
            Credential second = credential("resume-2", "refresh-2");
            when(credentialRepository.findAll()).thenReturn(List.of(first, second));
            when(headHunterClient.refreshToken(anyString()))
                    .thenReturn(Mono.just(new TokenResponse("a", "r", 100L, "bearer")));
            when(credentialRepository.save(first))
                    .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));
            when(credentialRepository.save(second)).thenReturn(second);

            serviceAt(T + 150).refreshAll();

            verify(headHunterClient).refreshToken("refresh-1");
            verify(headHunterClient).refreshToken("refresh-2");
            verify(credentialRepository).save(second);
            verify(metrics).recordTokenRefreshFailure();
            verify(metrics).recordTokenRefreshed();
        }

        @Test
        @DisplayName("Should return normally when loading credentials cannot open a transaction")
        void shouldReturnWhenTransactionUnavailable() {
            when(credentialRepository.findAll())
                    .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

            serviceAt(T + 150).refreshAll();

            verifyNoInteractions(headHunterClient, metrics);
        }

        @Test
        @DisplayName("Should continue when writing a refreshed credential fails")
        void shouldContinueAfterPersistenceError() {
            Credential first = credential("resume-1", "refresh-1");
            Credential second = credential("resume-2", "refresh-2");
            when(credentialRepository.findAll()).thenReturn(List.of(first, second));
            when(headHunterClient.refreshToken(anyString()))
                    .thenReturn(Mono.just(new TokenResponse("a", "r", 100L, "bearer")));
            when(credentialRepository.save(first)).thenThrow(new DataAccessResourceFailureException("db down"));
            when(credentialRepository.save(second)).thenReturn(second);

            serviceAt(T + 150).refreshAll();

            verify(credentialRepository).save(first);
            verify(credentialRepository).save(second);
            verify(metrics).recordTokenRefreshFailure();
            verify(metrics).recordTokenRefreshed();
        }

        @Test
        @DisplayName("Should do nothing when credentials cannot be loaded")
        void shouldStopWhenStoreUnavailable() {
            when(credentialRepository.findAll()).thenThrow(new DataAccessResourceFailureException("db down"));

            serviceAt(T + 150).refreshAll();

            verifyNoInteractions(headHunterClient);
        }
    }
}
