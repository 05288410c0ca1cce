package report;

import analysis.AnalysisConfig;
import analysis.AnalysisError;
import model.Dataset;
import model.Outcome;
import screen.AnalysisScreen;
import screen.ExportLayout;

import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Экспорт области результатов в PNG (двукратный масштаб, белый фон).
 * Растеризация выполняется на переданном {@link Executor}.
 */
public final class ImageExporter implements Exporter {
    private static final Logger logger = Logger.getLogger(ImageExporter.class.getName());

    private final Executor executor;

    public ImageExporter(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
            ExportJob<C> job, AnalysisScreen<C> screen, Dataset dataset) {
        ExportLayout layout = screen.exportLayout(job.source(), dataset);
        String fileName = ExportFileNames.fileName(screen.getExportName(), ExportKind.IMAGE,
            job.timestamp().atZone(ZoneOffset.UTC).toLocalDate());
        return CompletableFuture.supplyAsync(() -> render(layout), executor)
            .thenApply(outcome -> outcome.map(png ->
                new ExportArtifact(ExportKind.IMAGE, fileName, ExportKind.IMAGE.getMediaType(), png)));
    }

    /**
     * Растеризовать макет синхронно. Используется также для вложения изображения в документ.
     */
    public Outcome<byte[]> render(ExportLayout layout) {
        try {
            byte[] png = new ResultsPageRenderer().renderPng(layout);
            logger.fine("Rendered results image: " + png.length + " bytes");
            return Outcome.success(png);
        } catch (RenderException e) {
            logger.warning("Results image could not be rendered: " + e.getMessage());
            return Outcome.failure(AnalysisError.render(e.getMessage()));
        } catch (RuntimeException e) {
            logger.warning("Unexpected failure while rendering results image: " + e);
            return Outcome.failure(AnalysisError.render("Failed to render results: " + e.getMessage()));
        }
    }

    @Override
    public ExportKind getKind() {
        return ExportKind.IMAGE;
    }
}
