package com.koni.vitals.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for one entry of the pipeline key-value state table.
 */
@Entity
@Table(
    name = "pipeline_state",
    indexes = {
        @Index(name = "idx_pipeline_state_expires_at", columnList = "expires_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StateEntryEntity {
    
    @Id
    @Column(name = "state_key", length = 512)
    private String key;
    
    @Column(name = "state_value", nullable = false, length = 1_048_576)
    private String value;
    
    @Column(name = "expires_at")
    private Instant expiresAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
