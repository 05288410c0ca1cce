package report;

import analysis.AnalysisConfig;
import model.Dataset;
import model.Outcome;
import screen.AnalysisScreen;

import java.util.concurrent.CompletableFuture;

/**
 * Интерфейс для генераторов файлов экспорта.
 *
 * <p>Экспортер только формирует содержимое файла: он не меняет состояние мастера и кэш результата.
 * Ошибки возвращаются значением {@link Outcome}, будущее никогда не завершается исключением.
 *
 * @see ExportPipeline
 */
public interface Exporter {

    /**
     * Сформировать файл экспорта для результата.
     *
     * @param job     операция экспорта с исходным (актуальным) результатом
     * @param screen  экран, которому принадлежит результат
     * @param dataset набор данных, на котором получен результат
     * @param <C>     тип конфигурации экрана
     */
    <C extends AnalysisConfig> CompletableFuture<Outcome<ExportArtifact>> export(
        ExportJob<C> job, AnalysisScreen<C> screen, Dataset dataset);

    ExportKind getKind();
}
