package validator;

import analysis.AnalysisConfig;
import model.Dataset;

import java.util.Map;
import java.util.Objects;

/**
 * Входные данные одной оценки проверок: конфигурация, набор данных и производные границы.
 */
public final class ValidationContext<C extends AnalysisConfig> {
    private final C config;
    private final Dataset dataset;
    private final Map<String, Integer> bounds;

    ValidationContext(C config, Dataset dataset, Map<String, Integer> bounds) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.bounds = Map.copyOf(bounds);
    }

    public C config() {
        return config;
    }

    public Dataset dataset() {
        return dataset;
    }

    /**
     * @throws IllegalArgumentException если граница с таким именем не объявлена
     */
    public int bound(String name) {
        Integer value = bounds.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown bound: " + name);
        }
        return value;
    }

    public Map<String, Integer> bounds() {
        return bounds;
    }
}
