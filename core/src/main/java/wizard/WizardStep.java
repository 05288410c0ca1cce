package wizard;

import java.util.Arrays;
import java.util.Optional;

/**
 * Шаги мастера анализа. Их всегда шесть, порядок фиксирован.
 */
public enum WizardStep {
    VARIABLES(1, "Variables"),
    SETTINGS(2, "Settings"),
    VALIDATION(3, "Validation"),
    SUMMARY(4, "Summary"),
    REASONING(5, "Reasoning"),
    STATISTICS(6, "Statistics");

    public static final int FIRST = 1;
    public static final int LAST = 6;

    private final int id;
    private final String label;

    WizardStep(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Шаги, начиная с этого, отображают результат анализа.
     */
    public boolean showsResult() {
        return id >= SUMMARY.id;
    }

    public static Optional<WizardStep> fromId(int id) {
        return Arrays.stream(values()).filter(step -> step.id == id).findFirst();
    }

    public static WizardStep of(int id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown wizard step: " + id));
    }
}
