package com.incidentimpact.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incidentimpact.engine.dto.CachedEventRecord;
import com.incidentimpact.engine.entity.IncidentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.io.ParseException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis snapshot of every non-expired event, keyed by the event store version it was
 * built at.
 *
 * A snapshot is only looked up under the store's current max version, so any upsert
 * makes older snapshots unreachable and a cached answer always matches the database.
 * Old keys simply age out through their TTL.
 *
 * Redis Storage Format:
 * - Key: "events:snapshot:{version}"
 * - Value: JSON {@link CachedEventRecord.Snapshot}, geometries as WKT
 *
 * Redis failures are reported as an empty lookup; callers fall back to the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventCacheService {

    static final String SNAPSHOT_KEY_PREFIX = "events:snapshot:";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${incident-impact.cache.enabled:true}")
    private boolean enabled = true;

    @Value("${incident-impact.cache.ttl-minutes:10}")
    private long ttlMinutes = 10;

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the snapshot built at {@code version}, if one exists and covers {@code asOf}.
     * A snapshot built after {@code asOf} may lack events that expired in between, so it
     * is not used for such queries.
     */
    public Optional<List<IncidentEvent>> findSnapshot(long version, Instant asOf) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String json = stringRedisTemplate.opsForValue().get(SNAPSHOT_KEY_PREFIX + version);
            if (json == null) {
                log.debug("No cached event snapshot for version {}", version);
                return Optional.empty();
            }
            CachedEventRecord.Snapshot snapshot = objectMapper.readValue(json, CachedEventRecord.Snapshot.class);
            if (asOf.isBefore(snapshot.createdAt())) {
                log.debug("Snapshot v{} built at {} does not cover asOf {}", version, snapshot.createdAt(), asOf);
                return Optional.empty();
            }
            List<IncidentEvent> events = new ArrayList<>(snapshot.events().size());
            for (CachedEventRecord record : snapshot.events()) {
                events.add(record.toEntity());
            }
            return Optional.of(events);
        } catch (JsonProcessingException | ParseException e) {
            log.error("Discarding unreadable event snapshot v{}", version, e);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Event snapshot lookup failed, falling back to database: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores the active-event snapshot built at {@code version}. Failures are logged only.
     */
    public void storeSnapshot(long version, Instant createdAt, List<IncidentEvent> events) {
        if (!enabled) {
            return;
        }
        try {
            List<CachedEventRecord> records = events.stream().map(CachedEventRecord::fromEntity).toList();
            String json = objectMapper.writeValueAsString(new CachedEventRecord.Snapshot(version, createdAt, records));
            stringRedisTemplate.opsForValue().set(SNAPSHOT_KEY_PREFIX + version, json, ttlMinutes, TimeUnit.MINUTES);
            log.debug("Cached event snapshot v{} with {} events", version, records.size());
        } catch (JsonProcessingException e) {
            log.error("Could not serialize event snapshot v{}", version, e);
        } catch (RuntimeException e) {
            log.warn("Could not store event snapshot v{}: {}", version, e.getMessage());
        }
    }
}
