package com.sosapp.emergency.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "failed_operations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedOperation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "operation_type", nullable = false, length = 60)
    private String operationType;

    @Column(nullable = false, length = 500)
    private String details;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    private boolean resolved;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
