package com.pensionai.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "advisory_run")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdvisoryRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", length = 64, nullable = false, unique = true)
    private String runId;

    @Column(name = "user_id", length = 120)
    private String userId;

    @Column(name = "user_query", nullable = false, columnDefinition = "TEXT")
    private String userQuery;

    @Column(name = "status", length = 20, nullable = false)
    private String status;

    @Column(name = "termination", length = 20)
    private String termination;

    @Column(name = "turn_count", nullable = false)
    private int turnCount;

    @Column(name = "partial_result", nullable = false)
    private boolean partialResult;

    @Column(name = "blocked_categories", length = 200)
    private String blockedCategories;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
