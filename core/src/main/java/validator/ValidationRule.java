package validator;

import analysis.AnalysisConfig;

/**
 * Одна чистая проверка готовности. Не должна иметь побочных эффектов и обращаться к сети.
 */
@FunctionalInterface
public interface ValidationRule<C extends AnalysisConfig> {

    ValidationCheck evaluate(ValidationContext<C> context);
}
