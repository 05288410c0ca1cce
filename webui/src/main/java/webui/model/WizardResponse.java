package webui.model;

/**
 * Ответ на команды мастера: создание сессии, навигация, изменение конфигурации.
 */
public record WizardResponse(
    String sessionId,
    String status,
    String message,
    Object session // SessionView
) {
    public static WizardResponse success(String sessionId, String message) {
        return new WizardResponse(sessionId, "success", message, null);
    }

    public static WizardResponse error(String message) {
        return new WizardResponse(null, "error", message, null);
    }

    public static WizardResponse withView(SessionView view, String message) {
        return new WizardResponse(view.sessionId(), "success", message, view);
    }
}
