package com.koni.vitals.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for hot-store samples.
 * The primary key (site, point_name, ts) makes repeated writes of one sample an update.
 */
@Entity
@IdClass(SampleId.class)
@Table(
    name = "samples",
    indexes = {
        @Index(name = "idx_samples_site_ts", columnList = "site, ts DESC")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SampleEntity {
    
    @Id
    @Column(name = "site", nullable = false, length = 128)
    private String site;
    
    @Id
    @Column(name = "point_name", nullable = false, length = 512)
    private String pointName;
    
    @Id
    @Column(name = "ts", nullable = false)
    private Long timestamp;
    
    @Column(name = "sample_value", nullable = false)
    private double value;
    
    @Column(name = "ingested_at", nullable = false)
    private Instant ingestedAt;
}
