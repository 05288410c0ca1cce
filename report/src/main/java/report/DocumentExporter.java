package report;

import analysis.AnalysisConfig;
import analysis.AnalysisError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import http.HttpClient;
import http.ServiceRequest;
import http.ServiceResponse;
import model.Dataset;
import model.Outcome;
import screen.AnalysisScreen;
import wizard.WizardSettings;

import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Экспорт в документ Word через внешний сервис документов.
 *
 * <p>В сервис отправляется полный результат, поля конфигурации и, если область результатов
 * удалось растеризовать, изображение в base64 (поле {@code image}). Ответ 2xx с непустым телом -
 * это файл документа; любой другой исход - ошибка DOCUMENT.
 */
public final class DocumentExporter implements Exporter {
    private static final Logger logger = Logger.getLogger(DocumentExporter.class.getName());

    private final HttpClient httpClient;
    private final WizardSettings settings;
    private final ImageExporter imageExporter;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public DocumentExporter(HttpClient httpClient, WizardSettings settings, ImageExporter imageExporter,
                            ObjectMapper objectMapper, Executor executor) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.imageExporter = Objects.requireNonNull(imageExporter, "imageExporter cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
            ExportJob<C> job, AnalysisScreen<C> screen, Dataset dataset) {
        String fileName = ExportFileNames.fileName(screen.getExportName(), ExportKind.DOCUMENT,
            job.timestamp().atZone(ZoneOffset.UTC).toLocalDate());
        return CompletableFuture.supplyAsync(() -> {
            ObjectNode body = screen.documentRequest(job.source(), dataset);
            imageExporter.render(screen.exportLayout(job.source(), dataset))
                .toOptional()
                .ifPresent(png -> body.put("image", Base64.getEncoder().encodeToString(png)));
            return request(settings.documentUrl(screen.getSlug()), body);
        }, executor).thenApply(outcome -> outcome.map(bytes ->
            new ExportArtifact(ExportKind.DOCUMENT, fileName, ExportKind.DOCUMENT.getMediaType(), bytes)));
    }

    private Outcome<byte[]> request(String url, ObjectNode body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return Outcome.failure(AnalysisError.document("Could not serialize document request: " + e.getOriginalMessage()));
        }

        logger.info("POST " + url);
        ServiceResponse response = httpClient.execute(ServiceRequest.postJson(url, json));
        if (response.hasError()) {
            String message = response.getError().map(Throwable::getMessage).orElse("unknown error");
            logger.warning("Document service unreachable at " + url + ": " + message);
            return Outcome.failure(AnalysisError.document("Document service unreachable: " + message));
        }
        if (!response.isSuccessful()) {
            logger.warning("Document service returned " + response.getStatusCode() + " for " + url);
            return Outcome.failure(AnalysisError.document("Failed to generate document (HTTP " + response.getStatusCode() + ")"));
        }
        if (!response.hasBody()) {
            logger.warning("Document service returned an empty body for " + url);
            return Outcome.failure(AnalysisError.document("Document service returned an empty document"));
        }
        logger.info("Document generated: " + response.getBody().length + " bytes in " + response.getResponseTimeMs() + "ms");
        return Outcome.success(response.getBody());
    }

    @Override
    public ExportKind getKind() {
        return ExportKind.DOCUMENT;
    }
}
