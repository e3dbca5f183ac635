package com.incidentimpact.engine.service;

import com.incidentimpact.engine.EventFixtures;
import com.incidentimpact.engine.dto.EventRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private NotificationDispatcher dispatcher;

    @Test
    void shouldSendToUserQueue() {
        EventRecord record = EventRecord.fromEntity(EventFixtures.corridorIncident());

        dispatcher.dispatch("user-17", record);

        verify(messagingTemplate).convertAndSendToUser("user-17", "/queue/incident-events", record);
    }

    @Test
    void shouldSwallowBrokerFailure() {
        doThrow(new MessageDeliveryException("broker down"))
            .when(messagingTemplate).convertAndSendToUser(anyString(), anyString(), any(Object.class));

        assertDoesNotThrow(() -> dispatcher.dispatch("user-17",
            EventRecord.fromEntity(EventFixtures.corridorIncident())));
    }
}
