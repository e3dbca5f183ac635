package com.incidentimpact.engine.service;

import com.incidentimpact.engine.entity.IncidentEvent;
import com.incidentimpact.engine.exception.EventStoreUnavailableException;
import com.incidentimpact.engine.model.BoundingBox;
import com.incidentimpact.engine.repository.IncidentEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-only query surface over the event store.
 *
 * Performs the coarse geographic filter (bounding box) so the intersection engine only
 * sees a bounded candidate set. Bounding-box queries are served from the Redis snapshot
 * when one exists for the current store version; version queries always go to the
 * database.
 *
 * Each call makes a single attempt. Connectivity failures surface as
 * {@link EventStoreUnavailableException}; retry policy belongs to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventStoreGateway {

    private final IncidentEventRepository eventRepository;
    private final EventCacheService eventCacheService;
    private final Clock clock;

    @Value("${incident-impact.cache.max-snapshot-lag-ms:1000}")
    private long maxSnapshotLagMs = 1000;

    /**
     * Events overlapping {@code box} and active at {@code asOf}.
     */
    public List<IncidentEvent> queryByBoundingBox(BoundingBox box, Instant asOf) {
        return queryByBoundingBox(box, asOf, Duration.ZERO);
    }

    /**
     * Events whose geometry bounding box overlaps {@code box} and whose validity window
     * overlaps {@code [asOf, asOf + lookahead]}. Events expired before {@code asOf} are
     * never returned.
     */
    public List<IncidentEvent> queryByBoundingBox(BoundingBox box, Instant asOf, Duration lookahead) {
        Instant windowEnd = asOf.plus(lookahead);

        if (eventCacheService.isEnabled()) {
            Optional<List<IncidentEvent>> cached = activeSnapshot(asOf);
            if (cached.isPresent()) {
                List<IncidentEvent> matches = cached.get().stream()
                    .filter(e -> box.intersects(e.getGeometry().getEnvelopeInternal()))
                    .filter(e -> e.overlapsWindow(asOf, windowEnd))
                    .toList();
                log.debug("Bounding box {} matched {} cached events", box, matches.size());
                return matches;
            }
        }

        List<IncidentEvent> events = runQuery("bounding box query", () -> eventRepository.findInBoundingBox(
            box.minLon(), box.minLat(), box.maxLon(), box.maxLat(), asOf, windowEnd));
        log.debug("Bounding box {} matched {} events in the store", box, events.size());
        return events;
    }

    /**
     * Every event with {@code version > sinceVersion}, in version order.
     */
    public List<IncidentEvent> queryByVersion(long sinceVersion) {
        return runQuery("version query", () -> eventRepository.findByVersionGreaterThanOrderByVersionAsc(sinceVersion));
    }

    /**
     * Highest version currently in the store, 0 when empty.
     */
    public long currentVersion() {
        return runQuery("max version query", eventRepository::findMaxVersion);
    }

    public List<IncidentEvent> findNotExpired(Collection<Long> ids, Instant asOf) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return runQuery("id query", () -> eventRepository.findNotExpiredByIds(ids, asOf));
    }

    public Optional<IncidentEvent> findById(Long id) {
        return runQuery("id lookup", () -> eventRepository.findById(id));
    }

    /**
     * Snapshot of non-expired events at the current store version, loading and caching
     * it on a miss. Empty when the snapshot cannot serve {@code asOf}.
     *
     * Callers read {@code asOf} from the clock shortly before calling, so a miss builds
     * the snapshot from {@code asOf} itself when it lags the clock by at most
     * {@code maxSnapshotLagMs}. Older queries go to the database.
     */
    private Optional<List<IncidentEvent>> activeSnapshot(Instant asOf) {
        long version = currentVersion();
        Optional<List<IncidentEvent>> cached = eventCacheService.findSnapshot(version, asOf);
        if (cached.isPresent()) {
            return cached;
        }

        Instant now = clock.instant();
        if (asOf.isBefore(now.minusMillis(maxSnapshotLagMs))) {
            return Optional.empty();
        }
        Instant builtFrom = asOf.isBefore(now) ? asOf : now;
        List<IncidentEvent> active = runQuery("active event load",
            () -> eventRepository.findByExpiresAtGreaterThanEqualOrderByIdAsc(builtFrom));
        eventCacheService.storeSnapshot(version, builtFrom, active);
        return Optional.of(active);
    }

    private <T> T runQuery(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                 | RecoverableDataAccessException | CannotCreateTransactionException e) {
            log.error("Event store unavailable during {}", operation, e);
            throw new EventStoreUnavailableException("Event store unavailable during " + operation, e);
        }
    }
}
