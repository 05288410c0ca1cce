package analysis;

import java.util.Objects;

/**
 * Ошибка мастера анализа, предназначенная для показа пользователю.
 *
 * <p>Таксономия ошибок:
 * <ul>
 *   <li>{@link Kind#VALIDATION} - не выполнено предусловие (проверки не пройдены или запрос уже выполняется)</li>
 *   <li>{@link Kind#NETWORK} - сервис недоступен или вернул ошибку; можно повторить,
 *       ранее полученный результат не сбрасывается</li>
 *   <li>{@link Kind#SCHEMA} - ответ получен, но не соответствует ожидаемой структуре; жесткая ошибка</li>
 *   <li>{@link Kind#RENDER} - не удалось растеризовать область результатов (только экспорт PNG)</li>
 *   <li>{@link Kind#DOCUMENT} - не удалось получить документ от сервиса рендеринга или скрипт анализа</li>
 * </ul>
 */
public final class AnalysisError {
    private final Kind kind;
    private final String title;
    private final String description;

    public enum Kind {
        VALIDATION("Validation required"),
        NETWORK("Analysis Error"),
        SCHEMA("Unexpected response"),
        RENDER("Download failed"),
        DOCUMENT("Export failed");

        private final String defaultTitle;

        Kind(String defaultTitle) {
            this.defaultTitle = defaultTitle;
        }

        public String getDefaultTitle() {
            return defaultTitle;
        }
    }

    public AnalysisError(Kind kind, String title, String description) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.title = title != null && !title.isBlank() ? title : kind.getDefaultTitle();
        this.description = description;
    }

    public static AnalysisError validation(String description) {
        return new AnalysisError(Kind.VALIDATION, null, description);
    }

    public static AnalysisError network(String description) {
        return new AnalysisError(Kind.NETWORK, null, description);
    }

    public static AnalysisError schema(String description) {
        return new AnalysisError(Kind.SCHEMA, null, description);
    }

    public static AnalysisError render(String description) {
        return new AnalysisError(Kind.RENDER, null, description);
    }

    public static AnalysisError document(String description) {
        return new AnalysisError(Kind.DOCUMENT, null, description);
    }

    public Kind getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Жесткая ошибка делает ранее закэшированный результат недействительным.
     */
    public boolean isHardFailure() {
        return kind == Kind.SCHEMA;
    }

    @Override
    public String toString() {
        return kind + ": " + title + (description != null ? " - " + description : "");
    }
}
