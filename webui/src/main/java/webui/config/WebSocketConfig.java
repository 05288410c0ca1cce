package webui.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import webui.websocket.WizardWebSocketHandler;

/**
 * Конфигурация WebSocket для обновлений сессий мастера в реальном времени.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WizardWebSocketHandler wizardWebSocketHandler;

    public WebSocketConfig(WizardWebSocketHandler wizardWebSocketHandler) {
        this.wizardWebSocketHandler = wizardWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(wizardWebSocketHandler, "/ws/wizard")
                .setAllowedOrigins(
                    "http://localhost:3000",
                    "http://localhost:8080",
                    "http://127.0.0.1:3000",
                    "http://127.0.0.1:8080"
                );
    }
}
