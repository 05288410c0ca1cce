package analysis;

import com.fasterxml.jackson.databind.JsonNode;
import model.Outcome;

/**
 * Граница вычислительного сервиса.
 *
 * <p>Реализация выполняет ровно один исходящий запрос на вызов и никогда не бросает исключений:
 * любые проблемы транспорта и протокола возвращаются как {@link Outcome#failure(AnalysisError)}.
 */
public interface ComputationClient {

    /**
     * Выполнить вычисление.
     *
     * @param endpoint путь вычисления, например {@code /api/analysis/acf-pacf}
     * @param body     тело запроса {@code {data, ...поля конфигурации}}
     * @return JSON-ответ сервиса или ошибка {@link AnalysisError.Kind#NETWORK} / {@link AnalysisError.Kind#SCHEMA}
     */
    Outcome<JsonNode> compute(String endpoint, JsonNode body);
}
