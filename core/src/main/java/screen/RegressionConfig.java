package screen;

import analysis.AnalysisConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация регрессионной диагностики: зависимая переменная и предикторы.
 */
public record RegressionConfig(String dependent, List<String> independents) implements AnalysisConfig {

    public RegressionConfig {
        independents = independents != null ? List.copyOf(independents) : List.of();
    }

    public int predictorCount() {
        return independents.size();
    }

    @Override
    public List<String> selectedVariables() {
        List<String> variables = new ArrayList<>();
        if (dependent != null) {
            variables.add(dependent);
        }
        variables.addAll(independents);
        return variables;
    }

    @Override
    public Map<String, Object> requestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("dependent", dependent);
        fields.put("independents", independents);
        return fields;
    }
}
