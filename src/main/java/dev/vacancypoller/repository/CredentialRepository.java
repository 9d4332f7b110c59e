package dev.vacancypoller.repository;

import dev.vacancypoller.entity.Credential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Stored token material, one row per linked account.
 */
@Repository
public interface CredentialRepository extends JpaRepository<Credential, Long> {

    Optional<Credential> findBySubjectId(String subjectId);
}
