package analysis;

import java.util.List;
import java.util.Map;

/**
 * Конфигурация анализа: выбор переменных и параметров на конкретном экране.
 *
 * <p>Для ядра мастера конфигурация непрозрачна. Используются только:
 * <ul>
 *   <li>{@link Object#equals(Object)} - как ключ кэша результата и признак устаревания</li>
 *   <li>{@link #selectedVariables()} - смена набора переменных сбрасывает прогресс мастера</li>
 *   <li>{@link #requestFields()} - поля запроса к вычислительному сервису</li>
 * </ul>
 *
 * <p>Реализации должны быть неизменяемыми значениями (как правило, record).
 */
public interface AnalysisConfig {

    /**
     * Имена выбранных колонок набора данных в порядке выбора.
     * Изменение этого списка означает смену "вселенной переменных" и сбрасывает мастер к шагу 1.
     */
    List<String> selectedVariables();

    /**
     * Поля конфигурации в виде, в котором их ожидает вычислительный сервис
     * (например, {@code valueCol}, {@code lags}, {@code instrument_cols}).
     */
    Map<String, Object> requestFields();
}
