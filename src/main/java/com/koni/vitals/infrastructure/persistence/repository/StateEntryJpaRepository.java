package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.infrastructure.persistence.entity.StateEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Spring Data JPA repository for StateEntryEntity.
 */
@Repository
public interface StateEntryJpaRepository extends JpaRepository<StateEntryEntity, String> {
    
    @Modifying
    @Query("delete from StateEntryEntity e where e.expiresAt is not null and e.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
