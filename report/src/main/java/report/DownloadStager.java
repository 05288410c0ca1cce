package report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Размещение файлов экспорта во временном каталоге перед доставкой пользователю.
 * Учитывает количество неосвобожденных дескрипторов.
 */
public final class DownloadStager {
    private static final Logger logger = Logger.getLogger(DownloadStager.class.getName());

    private final Path directory;
    private final AtomicInteger openHandles = new AtomicInteger();

    public DownloadStager(Path directory) {
        this.directory = directory;
    }

    /**
     * Стейджинг в системном временном каталоге.
     */
    public DownloadStager() {
        this(null);
    }

    public StagedDownload stage(ExportArtifact artifact) throws IOException {
        String suffix = "." + artifact.getKind().getExtension();
        Path file = directory != null
            ? Files.createTempFile(directory, "export-", suffix)
            : Files.createTempFile("export-", suffix);
        try {
            Files.write(file, artifact.getContent());
        } catch (IOException e) {
            Files.deleteIfExists(file);
            throw e;
        }
        openHandles.incrementAndGet();
        logger.fine("Staged " + artifact.getFileName() + " at " + file);
        return new StagedDownload(file, artifact.getFileName(), artifact.getMediaType(),
            released -> {
                openHandles.decrementAndGet();
                logger.fine("Released staged download " + released.getFileName());
            });
    }

    public int getOpenHandleCount() {
        return openHandles.get();
    }
}
