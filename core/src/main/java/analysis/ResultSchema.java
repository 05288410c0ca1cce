package analysis;

import com.fasterxml.jackson.databind.JsonNode;
import model.Outcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Структурная проверка ответа вычислительного сервиса.
 *
 * <p>Проверяется только наличие полей, которые экран читает при отображении и экспорте.
 * Значения (включая производные рекомендации) не интерпретируются.
 */
public final class ResultSchema {
    private final List<String> requiredPointers;

    private ResultSchema(List<String> requiredPointers) {
        this.requiredPointers = List.copyOf(requiredPointers);
    }

    /**
     * @param pointers JSON Pointer обязательных полей, например {@code /results/acf}
     */
    public static ResultSchema require(String... pointers) {
        return new ResultSchema(List.of(pointers));
    }

    public List<String> getRequiredPointers() {
        return requiredPointers;
    }

    public Outcome<JsonNode> check(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Outcome.failure(AnalysisError.schema("Response is not a JSON object"));
        }
        List<String> missing = new ArrayList<>();
        for (String pointer : requiredPointers) {
            JsonNode node = payload.at(pointer);
            if (node.isMissingNode() || node.isNull()) {
                missing.add(pointer);
            }
        }
        if (!missing.isEmpty()) {
            return Outcome.failure(AnalysisError.schema("Response is missing required fields: " + String.join(", ", missing)));
        }
        return Outcome.success(payload);
    }
}
