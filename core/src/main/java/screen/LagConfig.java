package screen;

import analysis.AnalysisConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация анализа одного временного ряда: колонка значений и число лагов.
 */
public record LagConfig(String valueCol, int lags) implements AnalysisConfig {

    @Override
    public List<String> selectedVariables() {
        return valueCol != null ? List.of(valueCol) : List.of();
    }

    @Override
    public Map<String, Object> requestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("valueCol", valueCol);
        fields.put("lags", lags);
        return fields;
    }

    public LagConfig withLags(int newLags) {
        return new LagConfig(valueCol, newLags);
    }
}
