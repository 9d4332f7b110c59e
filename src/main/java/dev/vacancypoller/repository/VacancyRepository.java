package dev.vacancypoller.repository;

import dev.vacancypoller.entity.Vacancy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for vacancies keyed by the job board's vacancy id.
 */
@Repository
public interface VacancyRepository extends JpaRepository<Vacancy, Long> {

    /**
     * Check if a vacancy has already been ingested.
     */
    boolean existsByVacancyId(String vacancyId);

    /**
     * Vacancies the notifier has not picked up yet.
     */
    List<Vacancy> findByNotifiedFalse();
}
