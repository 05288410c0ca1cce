package report;

/**
 * Область результатов не может быть растеризована (удаленный график, неизвестный формат изображения).
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
