package webui.service;

import report.DownloadSink;
import report.StagedDownload;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Приемник, который считывает подготовленный файл в память для отдачи в HTTP-ответе.
 */
public final class BufferedDownloadSink implements DownloadSink {

    private volatile Download download;

    @Override
    public void deliver(StagedDownload staged) throws IOException {
        try (InputStream in = staged.openStream()) {
            download = new Download(staged.getFileName(), staged.getMediaType(), in.readAllBytes());
        }
    }

    public Optional<Download> getDownload() {
        return Optional.ofNullable(download);
    }

    public record Download(String fileName, String mediaType, byte[] content) {
    }
}
