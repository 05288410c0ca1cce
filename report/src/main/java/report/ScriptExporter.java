package report;

import analysis.AnalysisConfig;
import analysis.AnalysisError;
import http.HttpClient;
import http.ServiceRequest;
import http.ServiceResponse;
import model.Dataset;
import model.Outcome;
import screen.AnalysisScreen;
import wizard.WizardSettings;

import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Загрузка эталонного Python-скрипта анализа из репозитория кода.
 */
public final class ScriptExporter implements Exporter {
    private static final Logger logger = Logger.getLogger(ScriptExporter.class.getName());

    private final HttpClient httpClient;
    private final WizardSettings settings;
    private final Executor executor;

    public ScriptExporter(HttpClient httpClient, WizardSettings settings, Executor executor) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
            ExportJob<C> job, AnalysisScreen<C> screen, Dataset dataset) {
        String url = settings.scriptUrl(screen.getScriptFile());
        String fileName = ExportFileNames.fileName(screen.getExportName(), ExportKind.SCRIPT,
            job.timestamp().atZone(ZoneOffset.UTC).toLocalDate());
        return CompletableFuture.supplyAsync(() -> fetch(url), executor)
            .thenApply(outcome -> outcome.map(bytes ->
                new ExportArtifact(ExportKind.SCRIPT, fileName, ExportKind.SCRIPT.getMediaType(), bytes)));
    }

    private Outcome<byte[]> fetch(String url) {
        logger.info("GET " + url);
        ServiceResponse response = httpClient.execute(ServiceRequest.get(url));
        if (response.hasError()) {
            String message = response.getError().map(Throwable::getMessage).orElse("unknown error");
            logger.warning("Script source unreachable at " + url + ": " + message);
            return Outcome.failure(AnalysisError.document("Failed to load code: " + message));
        }
        if (!response.isSuccessful() || !response.hasBody()) {
            logger.warning("Script source returned " + response.getStatusCode() + " for " + url);
            return Outcome.failure(AnalysisError.document("Failed to load code (HTTP " + response.getStatusCode() + ")"));
        }
        return Outcome.success(response.getBody());
    }

    @Override
    public ExportKind getKind() {
        return ExportKind.SCRIPT;
    }
}
