package analysis;

import java.time.Instant;
import java.util.Objects;

/**
 * Запрос на вычисление, отправленный во внешний сервис.
 * Помечен конфигурацией, для которой он был выпущен: одновременно может существовать только один.
 */
public record AnalysisRequest<C extends AnalysisConfig>(C config, Instant issuedAt) {
    public AnalysisRequest {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(issuedAt, "issuedAt cannot be null");
    }
}
