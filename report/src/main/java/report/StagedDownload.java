package report;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Временный дескриптор загрузки: файл экспорта во временном каталоге.
 *
 * <p>Освобождается сразу после доставки, успешной или нет; повторный {@link #close()} ничего не делает.
 */
public final class StagedDownload implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StagedDownload.class.getName());

    private final Path path;
    private final String fileName;
    private final String mediaType;
    private final Consumer<StagedDownload> onRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    StagedDownload(Path path, String fileName, String mediaType, Consumer<StagedDownload> onRelease) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
        this.fileName = Objects.requireNonNull(fileName, "fileName cannot be null");
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType cannot be null");
        this.onRelease = Objects.requireNonNull(onRelease, "onRelease cannot be null");
    }

    public String getFileName() {
        return fileName;
    }

    public String getMediaType() {
        return mediaType;
    }

    public Path getPath() {
        return path;
    }

    public InputStream openStream() throws IOException {
        if (released.get()) {
            throw new IOException("Download " + fileName + " has already been released");
        }
        return Files.newInputStream(path);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warning("Failed to delete staged download " + path + ": " + e.getMessage());
        } finally {
            onRelease.accept(this);
        }
    }
}
