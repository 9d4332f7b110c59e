package dev.vacancypoller.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vacancypoller.entity.Vacancy;
import dev.vacancypoller.metrics.PollerMetrics;
import dev.vacancypoller.model.VacancySearchResult;
import dev.vacancypoller.model.VacancySearchResult.Contacts;
import dev.vacancypoller.model.VacancySearchResult.Item;
import dev.vacancypoller.model.VacancySearchResult.Salary;
import dev.vacancypoller.repository.VacancyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;

/**
 * Decodes a similar-vacancy search result and stores the vacancies not seen before.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VacancyIngestionService {

    private final VacancyRepository vacancyRepository;
    private final ObjectMapper objectMapper;
    private final PollerMetrics metrics;
    private final Clock clock;

    /**
     * Outcome of ingesting one search result.
     */
    public record IngestionResult(int found, int skipped, int created, int failed) {

        public static IngestionResult empty() {
            return new IngestionResult(0, 0, 0, 0);
        }

        public IngestionResult plus(IngestionResult other) {
            return new IngestionResult(found + other.found, skipped + other.skipped,
                    created + other.created, failed + other.failed);
        }
    }

    /**
     * Ingest one raw search result.
     *
     * @param rawResult JSON body of the similar-vacancies endpoint
     * @return counts of items seen, skipped as duplicates, created and failed
     */
    public IngestionResult ingest(String rawResult) {
        VacancySearchResult result;
        try {
            result = objectMapper.readValue(rawResult, VacancySearchResult.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to decode similar-vacancy result: {}", e.getOriginalMessage());
            return IngestionResult.empty();
        }

        if (result == null || result.getFound() == 0) {
            log.debug("Search result is empty");
            return IngestionResult.empty();
        }

        List<Item> items = result.getItems() == null ? List.of() : result.getItems();
        int skipped = 0;
        int created = 0;
        int failed = 0;

        for (Item item : items) {
            if (item == null || item.getId() == null || item.getId().isBlank()) {
                log.warn("Skipping vacancy item without id");
                failed++;
                continue;
            }

            try {
                if (vacancyRepository.existsByVacancyId(item.getId())) {
                    skipped++;
                    continue;
                }
                vacancyRepository.save(toVacancy(item));
                created++;
                log.debug("Stored vacancy {} '{}'", item.getId(), item.getName());
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to store vacancy {}: {}", item.getId(), e.getMessage());
                failed++;
            }
        }

        metrics.recordVacanciesFound(items.size());
        metrics.recordVacanciesSkipped(skipped);
        metrics.recordVacanciesCreated(created);
        metrics.recordVacanciesFailed(failed);

        log.info("Ingestion: {} items, {} already stored, {} new, {} failed",
                items.size(), skipped, created, failed);

        return new IngestionResult(items.size(), skipped, created, failed);
    }

    /**
     * Map a wire item to a new row, replacing absent salary and contact fields
     * with the stored "no data" values.
     */
    Vacancy toVacancy(Item item) {
        Salary salary = item.getSalary();
        Contacts contacts = item.getContacts();

        return Vacancy.builder()
                .vacancyId(item.getId())
                .name(item.getName() == null ? Vacancy.NO_DATA : item.getName())
                .url(item.getUrl())
                .alternateUrl(item.getAlternateUrl())
                .salaryCurrency(textOrNoData(salary == null ? null : salary.getCurrency()))
                .salaryFrom(amountOrNone(salary == null ? null : salary.getFrom()))
                .salaryTo(amountOrNone(salary == null ? null : salary.getTo()))
                .contactEmail(textOrNoData(contacts == null ? null : contacts.getEmail()))
                .contactName(textOrNoData(contacts == null ? null : contacts.getName()))
                .notified(false)
                .discoveredAt(clock.instant())
                .build();
    }

    private static String textOrNoData(String value) {
        return value == null ? Vacancy.NO_DATA : value;
    }

    private static int amountOrNone(Integer value) {
        return value == null ? Vacancy.NO_AMOUNT : value;
    }
}
