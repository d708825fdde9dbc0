package com.brainvault.messaging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdeaEnrichmentDispatcher Unit Tests")
class IdeaEnrichmentDispatcherTest {

    @Mock
    private IdeaEnrichmentProducer producer;

    @InjectMocks
    private IdeaEnrichmentDispatcher dispatcher;

    @Test
    @DisplayName("Captured idea is handed to the producer")
    void testDispatch() {
        dispatcher.onIdeaCaptured(new IdeaCapturedEvent(this, 8L));

        verify(producer).sendEnrichmentTask(8L);
    }

    @Test
    @DisplayName("Unreachable broker does not fail the capture")
    void testBrokerDown() {
        doThrow(new RuntimeException("Failed to send enrichment task for idea: 8"))
                .when(producer).sendEnrichmentTask(8L);

        assertDoesNotThrow(() -> dispatcher.onIdeaCaptured(new IdeaCapturedEvent(this, 8L)));
    }
}
