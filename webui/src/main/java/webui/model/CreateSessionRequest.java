package webui.model;

/**
 * Запрос на создание сессии мастера.
 */
public record CreateSessionRequest(
    String screen,
    DatasetPayload dataset
) {
}
