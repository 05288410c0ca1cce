package webui.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Новая конфигурация экрана. Поля {@code config} соответствуют полям записи конфигурации экрана,
 * например {@code {"valueCol":"sales","lags":24}}.
 */
public record ConfigUpdateRequest(JsonNode config) {
}
