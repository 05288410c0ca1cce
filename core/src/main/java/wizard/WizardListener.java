package wizard;

import analysis.AnalysisState;
import model.Notification;

/**
 * Слушатель событий сессии мастера (WebSocket, консоль CLI).
 */
public interface WizardListener {

    default void onProgress(WizardSession<?> session, WizardProgress progress) {
    }

    default void onAnalysisState(WizardSession<?> session, AnalysisState state) {
    }

    default void onNotification(WizardSession<?> session, Notification notification) {
    }
}
