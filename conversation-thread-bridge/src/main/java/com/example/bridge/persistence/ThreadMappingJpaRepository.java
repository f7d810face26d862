package com.example.bridge.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ThreadMappingJpaRepository extends JpaRepository<ThreadMappingEntity, String> {

    Optional<ThreadMappingEntity> findByTenantIdAndScopeKey(String tenantId, String scopeKey);

    List<ThreadMappingEntity> findByLastActivityAtBeforeOrderByLastActivityAtAsc(Instant olderThan, Pageable pageable);

    List<ThreadMappingEntity> findByTenantIdAndActiveTrueOrderByLastActivityAtDesc(String tenantId, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query(
            "update ThreadMappingEntity m set m.lastActivityAt = :now, m.active = true "
                    + "where m.threadId = :threadId and m.lastActivityAt < :now")
    int touch(@Param("threadId") String threadId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("update ThreadMappingEntity m set m.active = false where m.threadId = :threadId")
    int deactivate(@Param("threadId") String threadId);

    @Modifying(clearAutomatically = true)
    @Query("delete from ThreadMappingEntity m where m.threadId = :threadId and m.lastActivityAt < :olderThan")
    int deleteIfInactive(@Param("threadId") String threadId, @Param("olderThan") Instant olderThan);

    @Modifying(clearAutomatically = true)
    @Query("delete from ThreadMappingEntity m where m.threadId = :threadId")
    int release(@Param("threadId") String threadId);
}
