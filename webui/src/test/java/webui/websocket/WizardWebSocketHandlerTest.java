package webui.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WizardWebSocketHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private WebSocketSession socket;

    private WizardWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new WizardWebSocketHandler(mapper);
        lenient().when(socket.isOpen()).thenReturn(true);
        lenient().when(socket.getId()).thenReturn("ws-1");
    }

    @Test
    void testSubscribedSocketReceivesUpdates() throws IOException {
        handler.handleTextMessage(socket, new TextMessage("{\"action\":\"subscribe\",\"sessionId\":\"abc\"}"));

        handler.broadcastUpdate("abc", Map.of("type", "progress", "currentStep", 2));

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(sent.capture());
        assertEquals(2, mapper.readTree(sent.getValue().getPayload()).get("currentStep").asInt());
    }

    @Test
    void testUnsubscribeAndCloseStopUpdates() throws IOException {
        handler.handleTextMessage(socket, new TextMessage("{\"action\":\"subscribe\",\"sessionId\":\"abc\"}"));
        handler.handleTextMessage(socket, new TextMessage("{\"action\":\"unsubscribe\",\"sessionId\":\"abc\"}"));
        handler.broadcastUpdate("abc", Map.of("type", "progress"));

        handler.handleTextMessage(socket, new TextMessage("{\"action\":\"subscribe\",\"sessionId\":\"def\"}"));
        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);
        handler.broadcastUpdate("def", Map.of("type", "progress"));

        verify(socket, never()).sendMessage(any());
    }

    @Test
    void testNonTextFieldsAndMalformedPayloadsAreTolerated() throws IOException {
        handler.handleTextMessage(socket, new TextMessage("{\"action\":\"subscribe\",\"sessionId\":42}"));
        handler.handleTextMessage(socket, new TextMessage("{\"action\":\"subscribe\"}"));
        handler.handleTextMessage(socket, new TextMessage("not json"));

        handler.broadcastUpdate("42", Map.of("type", "analysis"));

        verify(socket).sendMessage(any());
    }
}
