package dev.vacancypoller.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * OAuth token pair for one linked job-board account.
 * A row exists only while the account is linked.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "credentials", indexes = {
        @Index(name = "idx_subject_id", columnList = "subjectId", unique = true)
})
public class Credential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Resume id on the job board. */
    @Column(nullable = false, unique = true)
    private String subjectId;

    @ToString.Exclude
    @Column(nullable = false, length = 1024)
    private String accessToken;

    @ToString.Exclude
    @Column(nullable = false, length = 1024)
    private String refreshToken;

    @ToString.Exclude
    @Column(length = 1024)
    private String authCode;

    /** Epoch seconds when the current token pair was obtained. */
    @Column(nullable = false)
    private long issuedAt;

    @Column(nullable = false)
    private long expiresInSeconds;

    public long getExpiresAt() {
        return issuedAt + expiresInSeconds;
    }

    /**
     * The access token is usable strictly before {@code issuedAt + expiresInSeconds}.
     */
    public boolean isValidAt(Instant now) {
        return now.getEpochSecond() < getExpiresAt();
    }

    /**
     * Replace the token pair and restart the lifetime at {@code now}.
     */
    public void rotate(String accessToken, String refreshToken, long expiresInSeconds, Instant now) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresInSeconds = expiresInSeconds;
        this.issuedAt = now.getEpochSecond();
    }
}
