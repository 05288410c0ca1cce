package screen;

import analysis.AnalysisConfig;
import analysis.ResultSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import validator.ValidationGate;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Базовый класс экранов анализа. Хранит метаданные экрана и собирает тело запроса
 * из данных и полей конфигурации.
 *
 * <p>Подклассы должны:
 * <ul>
 *   <li>передать метаданные экрана в конструктор</li>
 *   <li>объявить проверки ({@link #createGate()}) и обязательные поля ответа ({@link #createSchema()})</li>
 *   <li>описать макет экспорта и тело запроса к сервису документов</li>
 * </ul>
 */
public abstract class AbstractAnalysisScreen<C extends AnalysisConfig> implements AnalysisScreen<C> {
    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final String slug;
    private final String displayName;
    private final String exportName;
    private final String endpoint;
    private final String scriptFile;
    private final Class<C> configType;
    private final ValidationGate<C> gate;
    private final ResultSchema schema;

    protected AbstractAnalysisScreen(String slug, String displayName, String exportName,
                                     String endpoint, String scriptFile, Class<C> configType) {
        this.slug = Objects.requireNonNull(slug, "slug cannot be null");
        this.displayName = Objects.requireNonNull(displayName, "displayName cannot be null");
        this.exportName = Objects.requireNonNull(exportName, "exportName cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
        this.scriptFile = Objects.requireNonNull(scriptFile, "scriptFile cannot be null");
        this.configType = Objects.requireNonNull(configType, "configType cannot be null");
        this.gate = createGate();
        this.schema = createSchema();
    }

    protected abstract ValidationGate<C> createGate();

    protected abstract ResultSchema createSchema();

    @Override
    public JsonNode buildRequest(C config, Dataset dataset) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("data", requestData(config, dataset));
        requestFields(config).forEach((name, value) -> body.set(name, MAPPER.valueToTree(value)));
        return body;
    }

    /**
     * Поля конфигурации в запросе. Экран может переименовать их под свое вычисление.
     */
    protected Map<String, Object> requestFields(C config) {
        return config.requestFields();
    }

    /**
     * Данные запроса. По умолчанию - все строки набора данных.
     */
    protected JsonNode requestData(C config, Dataset dataset) {
        return MAPPER.valueToTree(dataset.getRows());
    }

    protected static boolean isSelected(String column) {
        return column != null && !column.isBlank();
    }

    protected static boolean nameContains(String column, String fragment) {
        return column.toLowerCase(Locale.ROOT).contains(fragment);
    }

    @Override
    public String getSlug() {
        return slug;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String getExportName() {
        return exportName;
    }

    @Override
    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public String getScriptFile() {
        return scriptFile;
    }

    @Override
    public Class<C> getConfigType() {
        return configType;
    }

    @Override
    public ValidationGate<C> getGate() {
        return gate;
    }

    @Override
    public ResultSchema getSchema() {
        return schema;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{slug=" + slug + "}";
    }
}
