package analysis;

/**
 * Состояние координатора анализа.
 */
public enum AnalysisState {
    /** Запросов еще не было или результат был сброшен. */
    IDLE,
    /** Запрос отправлен, ответ еще не получен. Повторный запуск отклоняется. */
    PENDING,
    /** Последний запрос завершился успешно, результат закэширован. */
    SUCCESS,
    /** Последний запрос завершился ошибкой. */
    ERROR
}
