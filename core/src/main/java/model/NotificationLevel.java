package model;

/**
 * Уровни пользовательских уведомлений мастера анализа.
 */
public enum NotificationLevel {
    INFO("Info"),
    SUCCESS("Success"),
    ERROR("Error");

    private final String displayName;

    NotificationLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isError() {
        return this == ERROR;
    }
}
