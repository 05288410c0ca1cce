package report;

import analysis.AnalysisError;

/**
 * Форматы экспорта результата анализа.
 */
public enum ExportKind {
    /**
     * Фиксированный набор полей результата в CSV. Формируется синхронно.
     */
    TABULAR("CSV spreadsheet", "csv", "text/csv", false, AnalysisError.Kind.DOCUMENT),

    /**
     * Растровое изображение области результатов (сводка и графики) в двукратном масштабе.
     */
    IMAGE("PNG image of the results", "png", "image/png", true, AnalysisError.Kind.RENDER),

    /**
     * Документ Word, который формирует внешний сервис документов.
     */
    DOCUMENT("Word document", "docx",
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document", true, AnalysisError.Kind.DOCUMENT),

    /**
     * Полный JSON-ответ вычислительного сервиса с конфигурацией.
     */
    JSON("Raw JSON result", "json", "application/json", false, AnalysisError.Kind.DOCUMENT),

    /**
     * Эталонный Python-скрипт анализа из репозитория кода.
     */
    SCRIPT("Python analysis script", "py", "text/x-python", true, AnalysisError.Kind.DOCUMENT);

    private final String description;
    private final String extension;
    private final String mediaType;
    private final boolean async;
    private final AnalysisError.Kind failureKind;

    ExportKind(String description, String extension, String mediaType, boolean async, AnalysisError.Kind failureKind) {
        this.description = description;
        this.extension = extension;
        this.mediaType = mediaType;
        this.async = async;
        this.failureKind = failureKind;
    }

    public String getDescription() {
        return description;
    }

    public String getExtension() {
        return extension;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * Формат требует ожидания (растеризация или внешний сервис).
     */
    public boolean isAsync() {
        return async;
    }

    /**
     * Вид ошибки, которым сообщается о сбое этого экспорта.
     */
    public AnalysisError.Kind getFailureKind() {
        return failureKind;
    }
}
