package com.koni.vitals.infrastructure.persistence.repository;

import com.koni.vitals.infrastructure.persistence.entity.SampleEntity;
import com.koni.vitals.infrastructure.persistence.entity.SampleId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for SampleEntity.
 */
@Repository
public interface SampleJpaRepository extends JpaRepository<SampleEntity, SampleId> {
    
    @Query("select max(s.timestamp) from SampleEntity s where s.site = :site")
    Long findMaxTimestamp(@Param("site") String site);
    
    @Query("select distinct s.pointName from SampleEntity s where s.site = :site and s.timestamp < :before order by s.pointName")
    List<String> findDistinctPointNamesBefore(@Param("site") String site, @Param("before") long before);
    
    @Query("select min(s.timestamp) from SampleEntity s "
            + "where s.site = :site and s.pointName = :pointName and s.timestamp < :before")
    Long findMinTimestampBefore(@Param("site") String site,
                                @Param("pointName") String pointName,
                                @Param("before") long before);
    
    @Query("select count(s) from SampleEntity s "
            + "where s.site = :site and s.pointName = :pointName and s.timestamp >= :from and s.timestamp < :to")
    long countInRange(@Param("site") String site,
                      @Param("pointName") String pointName,
                      @Param("from") long from,
                      @Param("to") long to);
    
    /**
     * Keyset page: rows after {@code after} within [from, to), oldest first.
     */
    @Query("select s from SampleEntity s "
            + "where s.site = :site and s.pointName = :pointName "
            + "and s.timestamp >= :from and s.timestamp < :to and s.timestamp > :after "
            + "order by s.timestamp asc")
    List<SampleEntity> findPageAfter(@Param("site") String site,
                                     @Param("pointName") String pointName,
                                     @Param("from") long from,
                                     @Param("to") long to,
                                     @Param("after") long after,
                                     Pageable pageable);
    
    @Modifying
    @Query("delete from SampleEntity s "
            + "where s.site = :site and s.pointName = :pointName and s.timestamp >= :from and s.timestamp < :to")
    int deleteRange(@Param("site") String site,
                    @Param("pointName") String pointName,
                    @Param("from") long from,
                    @Param("to") long to);
}
