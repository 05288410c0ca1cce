package model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Временное уведомление, которое пользователь может закрыть.
 *
 * <p>Содержит короткий заголовок и, если доступно, описание ошибки от внешнего сервиса.
 */
public record Notification(
    String id,
    NotificationLevel level,
    String title,
    String description,
    Instant createdAt
) {
    public Notification {
        Objects.requireNonNull(level, "level cannot be null");
        Objects.requireNonNull(title, "title cannot be null");
        if (id == null || id.isEmpty()) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static Notification info(String title, String description) {
        return new Notification(null, NotificationLevel.INFO, title, description, null);
    }

    public static Notification success(String title, String description) {
        return new Notification(null, NotificationLevel.SUCCESS, title, description, null);
    }

    public static Notification error(String title, String description) {
        return new Notification(null, NotificationLevel.ERROR, title, description, null);
    }
}
