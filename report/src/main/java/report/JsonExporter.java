package report;

import analysis.AnalysisConfig;
import analysis.AnalysisError;
import analysis.AnalysisResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import model.Dataset;
import model.Outcome;
import screen.AnalysisScreen;

import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Экспорт результата в JSON для программной обработки.
 *
 * <p>Документ содержит метаинформацию (экран, конфигурация, время получения результата,
 * размер выборки) и ответ вычислительного сервиса без изменений.
 *
 * <p>Особенности формата:
 * <ul>
 *   <li>pretty-print с отступами</li>
 *   <li>временные метки в ISO-8601, а не Unix timestamp</li>
 * </ul>
 */
public final class JsonExporter implements Exporter {
    private static final Logger logger = Logger.getLogger(JsonExporter.class.getName());

    private final ObjectMapper objectMapper;

    public JsonExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
            ExportJob<C> job, AnalysisScreen<C> screen, Dataset dataset) {
        AnalysisResult<C> result = job.source();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("analysis", screen.getDisplayName());
        json.put("screen", screen.getSlug());
        json.put("completedAt", result.getCompletedAt());
        json.put("exportedAt", job.timestamp());
        json.put("sampleSize", dataset.rowCount());
        json.put("config", result.getConfig().requestFields());
        json.put("result", result.getPayload());

        try {
            byte[] content = objectMapper.writeValueAsBytes(json);
            String fileName = ExportFileNames.fileName(screen.getExportName(), ExportKind.JSON,
                job.timestamp().atZone(ZoneOffset.UTC).toLocalDate());
            return CompletableFuture.completedFuture(Outcome.success(
                new ExportArtifact(ExportKind.JSON, fileName, ExportKind.JSON.getMediaType(), content)));
        } catch (JsonProcessingException e) {
            logger.warning("JSON export failed for " + screen.getSlug() + ": " + e.getMessage());
            return CompletableFuture.completedFuture(Outcome.failure(
                AnalysisError.document("Could not serialize result: " + e.getOriginalMessage())));
        }
    }

    @Override
    public ExportKind getKind() {
        return ExportKind.JSON;
    }
}
