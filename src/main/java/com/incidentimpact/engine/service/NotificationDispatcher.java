package com.incidentimpact.engine.service;

import com.incidentimpact.engine.dto.AffectingEventRecord;
import com.incidentimpact.engine.dto.EventRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Hands first deliveries to the notification side over STOMP.
 *
 * Subscribers listen on {@code /user/queue/incident-events}. Push, email and SMS
 * transport happen downstream of the broker. A failed hand-off is logged and does not
 * fail the request; the delivery row is already recorded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final SimpMessagingTemplate messagingTemplate;

    @Value("${incident-impact.notifications.destination:/queue/incident-events}")
    private String destination = "/queue/incident-events";

    public void dispatch(String userId, AffectingEventRecord payload) {
        send(userId, payload, payload.event().id());
    }

    public void dispatch(String userId, EventRecord payload) {
        send(userId, payload, payload.id());
    }

    private void send(String userId, Object payload, Long eventId) {
        try {
            messagingTemplate.convertAndSendToUser(userId, destination, payload);
            log.debug("Delivered event {} to user {}", eventId, userId);
        } catch (MessagingException e) {
            log.error("Failed to hand event {} to notification delivery for user {}", eventId, userId, e);
        }
    }
}
