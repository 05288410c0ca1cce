package report;

import analysis.AnalysisConfig;
import analysis.AnalysisError;
import analysis.AnalysisResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import http.HttpClient;
import model.Notification;
import model.Outcome;
import wizard.WizardSession;
import wizard.WizardSettings;

import java.io.IOException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Конвейер экспорта: выбор экспортера по виду, стейджинг файла и доставка пользователю.
 *
 * <p>Правила:
 * <ul>
 *   <li>экспортируется только актуальный результат сессии; устаревший или отсутствующий - ошибка VALIDATION</li>
 *   <li>у каждого вида экспорта в каждой сессии свой флаг выполнения; повторный запуск, пока флаг
 *       установлен, отклоняется</li>
 *   <li>экспорт не меняет шаг мастера и кэш результата</li>
 *   <li>временный файл освобождается сразу после доставки, успешной или нет</li>
 *   <li>каждый исход сообщается уведомлением в сессии</li>
 * </ul>
 */
public final class ExportPipeline {
    private static final Logger logger = Logger.getLogger(ExportPipeline.class.getName());

    private final Map<ExportKind, Exporter> exporters;
    private final DownloadStager stager;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ExportPipeline(WizardSettings settings, HttpClient httpClient, ObjectMapper objectMapper,
                          Executor executor, DownloadStager stager) {
        this(createExporters(settings, httpClient, objectMapper, executor), stager, Clock.systemUTC());
    }

    public ExportPipeline(Map<ExportKind, Exporter> exporters, DownloadStager stager, Clock clock) {
        this.exporters = new EnumMap<>(Objects.requireNonNull(exporters, "exporters cannot be null"));
        this.stager = Objects.requireNonNull(stager, "stager cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    private static Map<ExportKind, Exporter> createExporters(WizardSettings settings, HttpClient httpClient,
                                                             ObjectMapper objectMapper, Executor executor) {
        ImageExporter imageExporter = new ImageExporter(executor);
        Map<ExportKind, Exporter> exporters = new EnumMap<>(ExportKind.class);
        exporters.put(ExportKind.TABULAR, new TabularExporter());
        exporters.put(ExportKind.IMAGE, imageExporter);
        exporters.put(ExportKind.DOCUMENT, new DocumentExporter(httpClient, settings, imageExporter, objectMapper, executor));
        exporters.put(ExportKind.JSON, new JsonExporter());
        exporters.put(ExportKind.SCRIPT, new ScriptExporter(httpClient, settings, executor));
        return exporters;
    }

    /**
     * Экспортировать актуальный результат сессии.
     *
     * @param kind    вид экспорта
     * @param session сессия мастера
     * @param sink    поверхность доставки файла
     * @return будущее с готовым файлом; никогда не завершается исключением
     */
    public <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
            ExportKind kind, WizardSession<C> session, DownloadSink sink) {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(session, "session cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");

        Optional<AnalysisResult<C>> current = session.getCurrentResult();
        if (current.isEmpty()) {
            AnalysisError error = AnalysisError.validation("No current analysis result to export");
            session.postNotification(Notification.error(kind.getFailureKind().getDefaultTitle(), error.getDescription()));
            return CompletableFuture.completedFuture(Outcome.failure(error));
        }

        String flag = flagKey(session, kind);
        if (!inFlight.add(flag)) {
            logger.fine("Export " + kind + " already running for session " + session.getId());
            return CompletableFuture.completedFuture(
                Outcome.failure(AnalysisError.validation(kind.getDescription() + " export is already in progress")));
        }

        Exporter exporter = exporters.get(kind);
        if (exporter == null) {
            inFlight.remove(flag);
            return CompletableFuture.completedFuture(
                Outcome.failure(new AnalysisError(kind.getFailureKind(), null, "Export format not available: " + kind)));
        }

        if (kind == ExportKind.DOCUMENT) {
            session.postNotification(Notification.info("Generating Word...", "Creating APA format report"));
        }
        logger.info("Export " + kind + " started for session " + session.getId());

        ExportJob<C> job = new ExportJob<>(kind, current.get(), clock.instant());
        CompletableFuture<Outcome<ExportArtifact>> produced;
        try {
            produced = exporter.export(job, session.getScreen(), session.getDataset());
        } catch (RuntimeException e) {
            produced = CompletableFuture.failedFuture(e);
        }

        return produced
            .exceptionally(throwable -> {
                logger.warning("Export " + kind + " failed unexpectedly: " + throwable);
                return Outcome.failure(new AnalysisError(kind.getFailureKind(), null, String.valueOf(throwable.getMessage())));
            })
            .thenApply(outcome -> {
                try {
                    return deliver(kind, session, outcome, sink);
                } finally {
                    inFlight.remove(flag);
                }
            });
    }

    private Outcome<ExportArtifact> deliver(ExportKind kind, WizardSession<?> session,
                                            Outcome<ExportArtifact> outcome, DownloadSink sink) {
        if (outcome.isSuccess()) {
            ExportArtifact artifact = outcome.getValue();
            try (StagedDownload staged = stager.stage(artifact)) {
                sink.deliver(staged);
            } catch (IOException | RuntimeException e) {
                logger.warning("Delivery of " + artifact.getFileName() + " failed: " + e.getMessage());
                outcome = Outcome.failure(new AnalysisError(kind.getFailureKind(), "Download failed", e.getMessage()));
            }
        }

        if (outcome.isSuccess()) {
            logger.info("Export " + kind + " completed: " + outcome.getValue());
            session.postNotification(Notification.success("Download complete", outcome.getValue().getFileName()));
        } else {
            AnalysisError error = outcome.getError();
            logger.warning("Export " + kind + " failed: " + error);
            session.postNotification(Notification.error(error.getTitle(), error.getDescription()));
        }
        return outcome;
    }

    /**
     * Выполняется ли сейчас экспорт данного вида в сессии (флаг "скачивается").
     */
    public boolean isInProgress(WizardSession<?> session, ExportKind kind) {
        return inFlight.contains(flagKey(session, kind));
    }

    private static String flagKey(WizardSession<?> session, ExportKind kind) {
        return session.getId() + ":" + kind.name();
    }
}
