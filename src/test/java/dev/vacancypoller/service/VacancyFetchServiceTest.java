package dev.vacancypoller.service;

import dev.vacancypoller.client.HeadHunterClient;
import dev.vacancypoller.entity.Credential;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VacancyFetchServiceTest {

  @Mock
  private HeadHunterClient headHunterClient;

  private VacancyFetchService fetchService;

  private final Credential credential = Credential.builder()
      .subjectId("resume-1")
      .accessToken("token-1")
      .refreshToken("refresh-1")
      .issuedAt(0)
      .expiresInSeconds(100)
      .build();

  @BeforeEach
  void setUp() {
    fetchService = new VacancyFetchService(headHunterClient);
  }

  @Test
  void shouldReturnRawBodyForProfile() {
    String body = "{\"found\": 1, \"items\": [{\"id\": \"A\"}]}";
    when(headHunterClient.similarVacancies("resume-1", "token-1", "Go")).thenReturn(Mono.just(body));

    assertThat(fetchService.fetchFor(credential, "Go")).contains(body);
  }

  @Test
  void shouldReturnEmptyOnHttpError() {
    when(headHunterClient.similarVacancies("resume-1", "token-1", "Go"))
        .thenReturn(Mono.error(WebClientResponseException.create(
            HttpStatus.FORBIDDEN.value(), "Forbidden", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8)));

    assertThat(fetchService.fetchFor(credential, "Go")).isEmpty();
  }

  @Test
  void shouldReturnEmptyOnTimeout() {
    when(headHunterClient.similarVacancies("resume-1", "token-1", "Go"))
        .thenReturn(Mono.error(new TimeoutException("Did not observe any item")));

    assertThat(fetchService.fetchFor(credential, "Go")).isEmpty();
  }

  @Test
  void shouldReturnEmptyForBlankBody() {
    when(headHunterClient.similarVacancies("resume-1", "token-1", "Go")).thenReturn(Mono.empty());

    assertThat(fetchService.fetchFor(credential, "Go")).isEmpty();
  }
}
