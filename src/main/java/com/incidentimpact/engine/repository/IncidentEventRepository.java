package com.incidentimpact.engine.repository;

import com.incidentimpact.engine.entity.IncidentEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read surface over the normalized event table, plus the lookup the ingestion
 * boundary uses for upserts.
 *
 * PostGIS Functions Used:
 * - ST_MakeEnvelope(minX, minY, maxX, maxY, srid): query rectangle, (X, Y) = (lon, lat)
 * - {@code &&}: bounding-box overlap, answered from the GiST index
 * - pg_advisory_xact_lock(key): write lock held until the transaction ends
 */
@Repository
public interface IncidentEventRepository extends JpaRepository<IncidentEvent, Long> {

    /**
     * Events whose geometry bounding box overlaps the query rectangle and whose validity
     * window overlaps {@code [asOf, windowEnd]}. Pass {@code windowEnd == asOf} for a
     * point-in-time query.
     */
    @Query(value = """
        SELECT * FROM incident_events e
        WHERE e.geometry && ST_MakeEnvelope(:minLon, :minLat, :maxLon, :maxLat, 4326)
        AND e.start_time <= :windowEnd
        AND e.expires_at >= :asOf
        ORDER BY e.id
        """, nativeQuery = true)
    List<IncidentEvent> findInBoundingBox(
        @Param("minLon") double minLon,
        @Param("minLat") double minLat,
        @Param("maxLon") double maxLon,
        @Param("maxLat") double maxLat,
        @Param("asOf") Instant asOf,
        @Param("windowEnd") Instant windowEnd
    );

    /**
     * Incremental sync: every event with a version strictly above the cursor.
     */
    List<IncidentEvent> findByVersionGreaterThanOrderByVersionAsc(long version);

    /**
     * Every event not yet expired at {@code asOf}, used to build the cache snapshot.
     */
    List<IncidentEvent> findByExpiresAtGreaterThanEqualOrderByIdAsc(Instant asOf);

    @Query("SELECT e FROM IncidentEvent e WHERE e.id IN :ids AND e.expiresAt >= :asOf ORDER BY e.id")
    List<IncidentEvent> findNotExpiredByIds(@Param("ids") Collection<Long> ids, @Param("asOf") Instant asOf);

    @Query("SELECT COALESCE(MAX(e.version), 0) FROM IncidentEvent e")
    long findMaxVersion();

    Optional<IncidentEvent> findByExternalId(String externalId);

    /**
     * Blocks until this transaction holds the event write lock. Held to commit or
     * rollback, so writers commit in the order they take versions.
     */
    @Query(value = "SELECT 1 FROM pg_advisory_xact_lock(:key)", nativeQuery = true)
    int acquireWriteLock(@Param("key") long key);
}
