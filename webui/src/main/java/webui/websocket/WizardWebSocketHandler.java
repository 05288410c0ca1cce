package webui.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Обработчик WebSocket: рассылает подписчикам изменения шага, состояния анализа и уведомления сессии мастера.
 *
 * <p>Клиент подписывается сообщением {@code {"action":"subscribe","sessionId":"..."}}.
 */
@Component
public class WizardWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(WizardWebSocketHandler.class);

    // wizard session id -> subscribed sockets
    private final Map<String, CopyOnWriteArraySet<WebSocketSession>> sessionSubscriptions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public WizardWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        logger.info("WebSocket connection established: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try {
            JsonNode data = objectMapper.readTree(message.getPayload());

            String action = data.path("action").asText(null);
            String wizardSessionId = data.path("sessionId").asText(null);

            if ("subscribe".equals(action) && wizardSessionId != null) {
                subscribe(session, wizardSessionId);
                logger.info("WebSocket {} subscribed to wizard session {}", session.getId(), wizardSessionId);
            } else if ("unsubscribe".equals(action) && wizardSessionId != null) {
                unsubscribe(session, wizardSessionId);
                logger.info("WebSocket {} unsubscribed from wizard session {}", session.getId(), wizardSessionId);
            } else {
                logger.warn("Unsupported WebSocket message from {}: {}", session.getId(), action);
            }
        } catch (IOException e) {
            logger.error("Malformed WebSocket message from {}", session.getId(), e);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionSubscriptions.values().forEach(set -> set.remove(session));
        logger.info("WebSocket connection closed: {}", session.getId());
    }

    private void subscribe(WebSocketSession wsSession, String wizardSessionId) {
        sessionSubscriptions.computeIfAbsent(wizardSessionId, k -> new CopyOnWriteArraySet<>())
                .add(wsSession);
    }

    private void unsubscribe(WebSocketSession wsSession, String wizardSessionId) {
        CopyOnWriteArraySet<WebSocketSession> sessions = sessionSubscriptions.get(wizardSessionId);
        if (sessions != null) {
            sessions.remove(wsSession);
            if (sessions.isEmpty()) {
                sessionSubscriptions.remove(wizardSessionId);
            }
        }
    }

    /**
     * Забыть всех подписчиков закрытой сессии мастера.
     */
    public void forget(String wizardSessionId) {
        sessionSubscriptions.remove(wizardSessionId);
    }

    /**
     * Рассылка обновления всем подписчикам сессии мастера.
     */
    public void broadcastUpdate(String wizardSessionId, Map<String, Object> update) {
        CopyOnWriteArraySet<WebSocketSession> sessions = sessionSubscriptions.get(wizardSessionId);
        if (sessions == null || sessions.isEmpty()) {
            return;
        }

        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(update));
        } catch (IOException e) {
            logger.error("Cannot serialize update for wizard session {}", wizardSessionId, e);
            return;
        }

        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                continue;
            }
            try {
                // concurrent writes on one socket are not allowed
                synchronized (session) {
                    session.sendMessage(message);
                }
            } catch (IOException e) {
                logger.error("Error sending WebSocket message to session {}", session.getId(), e);
                sessions.remove(session);
            } catch (IllegalStateException e) {
                logger.warn("WebSocket session {} is in invalid state, skipping update", session.getId());
            }
        }
    }
}
