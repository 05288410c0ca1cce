package screen;

import analysis.AnalysisConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Конфигурация двухшагового МНК: исход Y, эндогенная переменная X, инструменты Z
 * и необязательные экзогенные контрольные переменные.
 */
public record InstrumentalConfig(String outcome, String endogenous, List<String> instruments, List<String> exogenous)
    implements AnalysisConfig {

    public InstrumentalConfig {
        instruments = instruments != null ? List.copyOf(instruments) : List.of();
        exogenous = exogenous != null ? List.copyOf(exogenous) : List.of();
    }

    @Override
    public List<String> selectedVariables() {
        List<String> variables = new ArrayList<>();
        if (outcome != null) {
            variables.add(outcome);
        }
        if (endogenous != null) {
            variables.add(endogenous);
        }
        variables.addAll(instruments);
        variables.addAll(exogenous);
        return variables;
    }

    @Override
    public Map<String, Object> requestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("outcome_col", outcome);
        fields.put("endogenous_col", endogenous);
        fields.put("instrument_cols", instruments);
        // The service expects null rather than an empty list when there are no controls.
        fields.put("exogenous_cols", exogenous.isEmpty() ? null : exogenous);
        return fields;
    }
}
