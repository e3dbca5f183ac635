package com.incidentimpact.engine.service;

import com.incidentimpact.engine.repository.IncidentEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Hands out strictly increasing event versions.
 *
 * Versions are epoch milliseconds when the wall clock is ahead of the last issued value
 * and {@code last + 1} otherwise, so they stay readable as timestamps while never
 * repeating or going backwards. The first call seeds from the highest version already
 * stored. Callers hold the event write lock, which orders concurrent requests; the
 * in-memory seed assumes a single ingestion writer process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventVersionClock {

    private final IncidentEventRepository eventRepository;
    private final Clock clock;

    private long lastIssued = -1;

    public synchronized long next() {
        if (lastIssued < 0) {
            lastIssued = eventRepository.findMaxVersion();
            log.info("Event version clock seeded at {}", lastIssued);
        }
        lastIssued = Math.max(clock.millis(), lastIssued + 1);
        return lastIssued;
    }
}
