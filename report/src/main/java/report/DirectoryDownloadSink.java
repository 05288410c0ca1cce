package report;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Доставка файлов экспорта в каталог на диске.
 */
public final class DirectoryDownloadSink implements DownloadSink {
    private static final Logger logger = Logger.getLogger(DirectoryDownloadSink.class.getName());

    private final Path outputDirectory;
    private final List<Path> delivered = Collections.synchronizedList(new ArrayList<>());

    public DirectoryDownloadSink(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory cannot be null");
    }

    @Override
    public void deliver(StagedDownload download) throws IOException {
        Files.createDirectories(outputDirectory);
        Path target = outputDirectory.resolve(download.getFileName());
        try (InputStream in = download.openStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        delivered.add(target);
        logger.info("Saved " + target);
    }

    public List<Path> getDelivered() {
        synchronized (delivered) {
            return List.copyOf(delivered);
        }
    }
}
