package screen;

import analysis.AnalysisConfig;
import analysis.AnalysisResult;
import analysis.ResultSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import validator.ValidationGate;

/**
 * Определение экрана анализа: все, чем экраны отличаются друг от друга.
 *
 * <p>Мастер, координатор и конвейер экспорта одинаковы для всех экранов;
 * экран поставляет только данные: адрес вычисления, проверки, обязательные поля ответа
 * и макет экспорта.
 *
 * @param <C> тип конфигурации экрана
 */
public interface AnalysisScreen<C extends AnalysisConfig> {

    /**
     * Короткий идентификатор экрана, например {@code acf-pacf}.
     * Используется в адресе сервиса документов и в REST API.
     */
    String getSlug();

    String getDisplayName();

    /**
     * Базовое имя файлов экспорта, например {@code ACF_PACF}.
     */
    String getExportName();

    /**
     * Путь вычисления в вычислительном сервисе.
     */
    String getEndpoint();

    /**
     * Имя файла эталонного скрипта анализа в репозитории кода.
     */
    String getScriptFile();

    Class<C> getConfigType();

    /**
     * Достаточно ли данных, чтобы вообще показать мастер (иначе показывается вводная страница).
     */
    boolean canRun(Dataset dataset);

    /**
     * Конфигурация по умолчанию, выбираемая при загрузке набора данных.
     */
    C defaultConfig(Dataset dataset);

    ValidationGate<C> getGate();

    ResultSchema getSchema();

    /**
     * Тело запроса к вычислительному сервису: {@code {data, ...поля конфигурации}}.
     */
    JsonNode buildRequest(C config, Dataset dataset);

    ExportLayout exportLayout(AnalysisResult<C> result, Dataset dataset);

    /**
     * Тело запроса к сервису документов (без изображения: его добавляет конвейер экспорта).
     */
    ObjectNode documentRequest(AnalysisResult<C> result, Dataset dataset);
}
