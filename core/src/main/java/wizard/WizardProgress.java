package wizard;

import java.util.Objects;

/**
 * Снимок прогресса мастера: текущий шаг и самый дальний достигнутый шаг.
 * Всегда {@code maxReached >= current}.
 */
public record WizardProgress(WizardStep current, WizardStep maxReached) {
    public WizardProgress {
        Objects.requireNonNull(current, "current cannot be null");
        Objects.requireNonNull(maxReached, "maxReached cannot be null");
        if (maxReached.getId() < current.getId()) {
            throw new IllegalArgumentException("maxReached " + maxReached + " is behind current " + current);
        }
    }

    public static WizardProgress initial() {
        return new WizardProgress(WizardStep.VARIABLES, WizardStep.VARIABLES);
    }

    /**
     * Шаг доступен для перехода по клику в индикаторе шагов.
     */
    public boolean isReachable(WizardStep step) {
        return step.getId() <= maxReached.getId();
    }
}
