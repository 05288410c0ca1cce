package validator;

import java.util.Objects;

/**
 * Результат одной проверки готовности к запуску анализа.
 *
 * @param label  короткое название проверки, например "Sufficient data"
 * @param passed пройдена ли проверка
 * @param detail пояснение для пользователя, например "120 observations (minimum: 50)"
 */
public record ValidationCheck(String label, boolean passed, String detail) {
    public ValidationCheck {
        Objects.requireNonNull(label, "label cannot be null");
        if (detail == null) {
            detail = "";
        }
    }

    public static ValidationCheck passed(String label, String detail) {
        return new ValidationCheck(label, true, detail);
    }

    public static ValidationCheck failed(String label, String detail) {
        return new ValidationCheck(label, false, detail);
    }
}
