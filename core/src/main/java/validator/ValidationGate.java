package validator;

import analysis.AnalysisConfig;
import model.Dataset;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Оценка готовности экрана к запуску анализа.
 *
 * <p>Список проверок пересчитывается при каждом чтении и не кэшируется: результат зависит
 * только от текущей конфигурации и набора данных. Проверки синхронные и дешевые.
 *
 * <p>Пример объявления:
 * <pre>{@code
 * ValidationGate<LagConfig> gate = ValidationGate.<LagConfig>builder()
 *     .bound("maxLags", (config, data) -> data.numericValues(config.valueCol()).size() / 2 - 1)
 *     .check("Sufficient data", ctx -> n(ctx) >= 50, ctx -> n(ctx) + " observations (minimum: 50)")
 *     .build();
 * }</pre>
 */
public final class ValidationGate<C extends AnalysisConfig> {
    private final List<ValidationRule<C>> rules;
    private final Map<String, DerivedBound<C>> bounds;

    private ValidationGate(Builder<C> builder) {
        this.rules = List.copyOf(builder.rules);
        this.bounds = Collections.unmodifiableMap(new LinkedHashMap<>(builder.bounds));
    }

    public static <C extends AnalysisConfig> Builder<C> builder() {
        return new Builder<>();
    }

    /**
     * Пересчитать все проверки в порядке объявления.
     */
    public ValidationReport evaluate(C config, Dataset dataset) {
        ValidationContext<C> context = new ValidationContext<>(config, dataset, derivedBounds(config, dataset));
        List<ValidationCheck> checks = new ArrayList<>(rules.size());
        for (ValidationRule<C> rule : rules) {
            checks.add(rule.evaluate(context));
        }
        return new ValidationReport(checks);
    }

    public boolean allPassed(C config, Dataset dataset) {
        return evaluate(config, dataset).allPassed();
    }

    /**
     * Производные границы, которые отображает шаг настроек (единый источник истины).
     */
    public Map<String, Integer> derivedBounds(C config, Dataset dataset) {
        Map<String, Integer> values = new LinkedHashMap<>();
        bounds.forEach((name, bound) -> values.put(name, bound.compute(config, dataset)));
        return values;
    }

    public int ruleCount() {
        return rules.size();
    }

    public static class Builder<C extends AnalysisConfig> {
        private final List<ValidationRule<C>> rules = new ArrayList<>();
        private final Map<String, DerivedBound<C>> bounds = new LinkedHashMap<>();

        public Builder<C> bound(String name, DerivedBound<C> bound) {
            this.bounds.put(Objects.requireNonNull(name), Objects.requireNonNull(bound));
            return this;
        }

        public Builder<C> rule(ValidationRule<C> rule) {
            this.rules.add(Objects.requireNonNull(rule));
            return this;
        }

        public Builder<C> check(String label,
                                Predicate<ValidationContext<C>> condition,
                                Function<ValidationContext<C>, String> detail) {
            Objects.requireNonNull(label);
            return rule(context -> new ValidationCheck(label, condition.test(context), detail.apply(context)));
        }

        public ValidationGate<C> build() {
            return new ValidationGate<>(this);
        }
    }
}
