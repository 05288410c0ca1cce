package report;

import java.util.Objects;

/**
 * Готовый файл экспорта: имя, тип содержимого и байты.
 */
public final class ExportArtifact {
    private final ExportKind kind;
    private final String fileName;
    private final String mediaType;
    private final byte[] content;

    public ExportArtifact(ExportKind kind, String fileName, String mediaType, byte[] content) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.fileName = Objects.requireNonNull(fileName, "fileName cannot be null");
        this.mediaType = Objects.requireNonNull(mediaType, "mediaType cannot be null");
        this.content = Objects.requireNonNull(content, "content cannot be null").clone();
    }

    public ExportKind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }

    public String getMediaType() {
        return mediaType;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    @Override
    public String toString() {
        return "ExportArtifact{" + fileName + ", " + content.length + " bytes}";
    }
}
