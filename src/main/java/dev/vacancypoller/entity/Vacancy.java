package dev.vacancypoller.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A vacancy seen on the job board. Rows are append-only; only the
 * notifier flips {@code notified}.
 *
 * <p>Absent salary and contact fields are stored as {@link #NO_DATA} / {@link #NO_AMOUNT},
 * the values rows written by earlier deployments already carry.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "vacancies", indexes = {
        @Index(name = "idx_vacancy_id", columnList = "vacancyId", unique = true),
        @Index(name = "idx_notified", columnList = "notified")
})
public class Vacancy {

    public static final String NO_DATA = "Null";
    public static final int NO_AMOUNT = 0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String vacancyId;

    @Column(nullable = false, length = 1024)
    private String name;

    @Column(length = 2048)
    private String url;

    @Column(length = 2048)
    private String alternateUrl;

    @Column(nullable = false)
    private String salaryCurrency;

    @Column(nullable = false)
    private int salaryFrom;

    @Column(nullable = false)
    private int salaryTo;

    @Column(nullable = false)
    private String contactEmail;

    @Column(nullable = false)
    private String contactName;

    @Column(nullable = false)
    private boolean notified;

    @Column(nullable = false)
    private Instant discoveredAt;

    public boolean hasSalary() {
        return !NO_DATA.equals(salaryCurrency) || salaryFrom != NO_AMOUNT || salaryTo != NO_AMOUNT;
    }

    public boolean hasContact() {
        return !NO_DATA.equals(contactEmail) || !NO_DATA.equals(contactName);
    }
}
