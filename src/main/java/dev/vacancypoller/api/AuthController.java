package dev.vacancypoller.api;

import dev.vacancypoller.service.AccountLinkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.util.Map;

/**
 * OAuth entry points: redirect to the job board and receive its callback.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AccountLinkService accountLinkService;

    @GetMapping
    public ResponseEntity<Void> redirect() {
        String location = accountLinkService.authorizeUrl();
        log.debug("Redirecting to {}", location);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(location))
                .build();
    }

    @GetMapping("/callback")
    public Mono<Map<String, String>> callback(@RequestParam(name = "code", required = false) String code) {
        // Token exchange and JPA writes block
        return Mono.fromCallable(() -> accountLinkService.link(code))
                .subscribeOn(Schedulers.boundedElastic())
                .map(credential -> Map.of("status", "ok"));
    }
}
