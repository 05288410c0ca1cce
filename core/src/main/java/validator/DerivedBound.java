package validator;

import analysis.AnalysisConfig;
import model.Dataset;

/**
 * Граница, вычисляемая из конфигурации и данных (например, максимальное число лагов).
 * Ее читают и проверки, и шаг настроек, поэтому она объявляется в одном месте - в {@link ValidationGate}.
 */
@FunctionalInterface
public interface DerivedBound<C extends AnalysisConfig> {

    int compute(C config, Dataset dataset);
}
