package analysis;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Успешный результат вычисления вместе с конфигурацией, которая его породила.
 *
 * <p>Полезная нагрузка - JSON-ответ вычислительного сервиса, прошедший структурную проверку
 * ({@link ResultSchema}). Производные значения (рекомендуемый порядок модели, интерпретации)
 * передаются без изменений: ядро не интерпретирует числа.
 */
public final class AnalysisResult<C extends AnalysisConfig> {
    private final C config;
    private final JsonNode payload;
    private final Instant completedAt;

    public AnalysisResult(C config, JsonNode payload, Instant completedAt) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.payload = Objects.requireNonNull(payload, "payload cannot be null").deepCopy();
        this.completedAt = Objects.requireNonNull(completedAt, "completedAt cannot be null");
    }

    public C getConfig() {
        return config;
    }

    /**
     * @return копия JSON-ответа сервиса (кэшированный результат не может быть изменен снаружи)
     */
    public JsonNode getPayload() {
        return payload.deepCopy();
    }

    /**
     * Значение по JSON Pointer без копирования всего ответа.
     *
     * @param pointer JSON Pointer, например {@code /results/p_value}
     * @return узел или MissingNode, если поле отсутствует
     */
    public JsonNode at(String pointer) {
        return payload.at(pointer).deepCopy();
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    /**
     * Результат актуален, только если он получен для той же конфигурации, что выбрана сейчас.
     */
    public boolean matches(AnalysisConfig currentConfig) {
        return config.equals(currentConfig);
    }

    @Override
    public String toString() {
        return "AnalysisResult{config=" + config + ", completedAt=" + completedAt + "}";
    }
}
