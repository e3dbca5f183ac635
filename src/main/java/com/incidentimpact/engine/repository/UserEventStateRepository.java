package com.incidentimpact.engine.repository;

import com.incidentimpact.engine.entity.UserEventState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * The only state this engine mutates. Writes are additive and idempotent.
 */
@Repository
public interface UserEventStateRepository extends JpaRepository<UserEventState, Long> {

    /**
     * Atomic insert-if-absent on (user_id, event_id). Concurrent requests for the same
     * user race on the unique constraint, never on a read-then-write.
     *
     * @return 1 when this call created the row (first delivery), 0 when it already existed
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO user_event_states (user_id, event_id, delivered_at, is_read)
        VALUES (:userId, :eventId, :deliveredAt, false)
        ON CONFLICT (user_id, event_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(
        @Param("userId") String userId,
        @Param("eventId") Long eventId,
        @Param("deliveredAt") Instant deliveredAt
    );

    @Modifying
    @Transactional
    @Query("""
        UPDATE UserEventState s SET s.read = true, s.readAt = :readAt
        WHERE s.userId = :userId AND s.eventId = :eventId AND s.read = false
        """)
    int markRead(
        @Param("userId") String userId,
        @Param("eventId") Long eventId,
        @Param("readAt") Instant readAt
    );

    List<UserEventState> findByUserIdAndEventIdIn(String userId, Collection<Long> eventIds);

    List<UserEventState> findByUserIdAndReadFalseOrderByDeliveredAtDesc(String userId);

    /**
     * Drops a user's state rows whose event expired before {@code now}.
     */
    @Modifying
    @Transactional
    @Query(value = """
        DELETE FROM user_event_states s
        USING incident_events e
        WHERE s.event_id = e.id
        AND s.user_id = :userId
        AND e.expires_at < :now
        """, nativeQuery = true)
    int deleteExpiredForUser(@Param("userId") String userId, @Param("now") Instant now);
}
