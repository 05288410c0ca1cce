package report;

import java.io.IOException;

/**
 * Поверхность доставки файла пользователю (каталог CLI, HTTP-ответ веб-интерфейса).
 */
@FunctionalInterface
public interface DownloadSink {

    void deliver(StagedDownload download) throws IOException;
}
