package report;

import analysis.AnalysisConfig;
import model.Dataset;
import model.Outcome;
import screen.AnalysisScreen;
import screen.ExportLayout;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Экспорт результата в CSV.
 *
 * <p>Структура файла повторяет макет экрана: заголовок, затем разделы через пустую строку.
 * Раздел состоит из необязательного заголовка, строк "метка,значение" и необязательной таблицы
 * со строкой заголовков.
 */
public final class TabularExporter implements Exporter {
    private static final Logger logger = Logger.getLogger(TabularExporter.class.getName());

    @Override
    public <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
            ExportJob<C> job, AnalysisScreen<C> screen, Dataset dataset) {
        String csv = render(screen.exportLayout(job.source(), dataset));
        String fileName = ExportFileNames.fileName(screen.getExportName(), ExportKind.TABULAR,
            job.timestamp().atZone(ZoneOffset.UTC).toLocalDate());
        logger.fine("CSV export for " + screen.getSlug() + ": " + csv.length() + " chars");
        return CompletableFuture.completedFuture(Outcome.success(new ExportArtifact(
            ExportKind.TABULAR, fileName, ExportKind.TABULAR.getMediaType() + ";charset=utf-8",
            csv.getBytes(StandardCharsets.UTF_8))));
    }

    /**
     * Преобразовать макет в текст CSV.
     */
    public String render(ExportLayout layout) {
        StringBuilder csv = new StringBuilder();
        csv.append(escape(layout.getTitle())).append('\n');

        for (ExportLayout.Section section : layout.getSections()) {
            csv.append('\n');
            if (section.heading() != null) {
                csv.append(escape(section.heading())).append('\n');
            }
            for (ExportLayout.Row row : section.rows()) {
                csv.append(escape(row.label())).append(',').append(escape(row.value())).append('\n');
            }
            section.optionalTable().ifPresent(table -> {
                appendLine(csv, table.headers());
                table.rows().forEach(row -> appendLine(csv, row));
            });
        }
        return csv.toString();
    }

    private static void appendLine(StringBuilder csv, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(escape(cells.get(i)));
        }
        csv.append('\n');
    }

    /**
     * Значения с запятой, кавычкой или переводом строки заключаются в кавычки, кавычки удваиваются.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    @Override
    public ExportKind getKind() {
        return ExportKind.TABULAR;
    }
}
