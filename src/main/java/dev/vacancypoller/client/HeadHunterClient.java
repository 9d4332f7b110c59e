package dev.vacancypoller.client;

import dev.vacancypoller.config.HeadHunterProperties;
import dev.vacancypoller.config.PollerProperties;
import dev.vacancypoller.metrics.PollerMetrics;
import dev.vacancypoller.model.ResumeList;
import dev.vacancypoller.model.TokenResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Objects;

/**
 * WebClient wrapper for the job board's OAuth and resume APIs.
 * Every request carries the configured request timeout.
 */
@Component
public class HeadHunterClient {

    static final String PRODUCT_HEADER = "HH-User-Agent";

    static final String ENDPOINT_TOKEN = "oauth_token";
    static final String ENDPOINT_SIMILAR = "similar_vacancies";
    static final String ENDPOINT_RESUMES = "resumes_mine";

    private final WebClient webClient;
    private final HeadHunterProperties properties;
    private final PollerProperties pollerProperties;
    private final PollerMetrics metrics;

    public HeadHunterClient(WebClient.Builder webClientBuilder, HeadHunterProperties properties,
            PollerProperties pollerProperties, PollerMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getRequestTimeout());

        this.webClient = webClientBuilder
                .baseUrl(Objects.requireNonNull(properties.getApiBaseUrl()))
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(PRODUCT_HEADER, properties.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.properties = properties;
        this.pollerProperties = pollerProperties;
        this.metrics = metrics;
    }

    /**
     * Browser URL that starts the authorization-code flow.
     */
    public String authorizeUrl() {
        return UriComponentsBuilder.fromUriString(properties.getAuthBaseUrl())
                .path("/oauth/authorize")
                .queryParam("response_type", "code")
                .queryParam("client_id", properties.getClientId())
                .queryParam("redirect_uri", properties.getRedirectUri())
                .encode()
                .build()
                .toUriString();
    }

    /**
     * Exchange a refresh token for a new access/refresh pair.
     */
    public Mono<TokenResponse> refreshToken(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        return postToken(form);
    }

    /**
     * Exchange an authorization code from the OAuth callback for a token pair.
     */
    public Mono<TokenResponse> exchangeCode(String code) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("client_id", properties.getClientId());
        form.add("client_secret", properties.getClientSecret());
        form.add("redirect_uri", properties.getRedirectUri());
        return postToken(form);
    }

    /**
     * Similar-vacancy search for a resume. The body is returned undecoded.
     */
    public Mono<String> similarVacancies(String resumeId, String accessToken, String searchText) {
        return timed(ENDPOINT_SIMILAR, webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/resumes/{id}/similar_vacancies")
                        .queryParam("per_page", pollerProperties.getPerPage())
                        .queryParam("text", "{text}")
                        .build(resumeId, searchText))
                .headers(headers -> headers.setBearerAuth(accessToken))
                .retrieve()
                .bodyToMono(String.class));
    }

    /**
     * Resumes owned by the bearer of {@code accessToken}.
     */
    public Mono<ResumeList> myResumes(String accessToken) {
        return timed(ENDPOINT_RESUMES, webClient.get()
                .uri("/resumes/mine")
                .headers(headers -> headers.setBearerAuth(accessToken))
                .retrieve()
                .bodyToMono(ResumeList.class));
    }

    @SuppressWarnings("null")
    private Mono<TokenResponse> postToken(MultiValueMap<String, String> form) {
        return timed(ENDPOINT_TOKEN, webClient.post()
                .uri("/oauth/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(TokenResponse.class));
    }

    private <T> Mono<T> timed(String endpoint, Mono<T> request) {
        Duration timeout = properties.getRequestTimeout();
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            metrics.recordApiCall(endpoint);
            return request
                    .timeout(timeout)
                    .doOnError(e -> metrics.recordApiError(endpoint))
                    .doOnTerminate(() -> metrics.recordApiLatency(endpoint,
                            System.currentTimeMillis() - start));
        });
    }
}
