package model;

import analysis.AnalysisError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Результат операции, которая может завершиться ошибкой: либо значение, либо {@link AnalysisError}.
 *
 * <p>Ошибки мастера анализа никогда не пересекают границу компонента в виде исключений:
 * компонент, породивший ошибку, возвращает {@code Outcome} с описанием, а вызывающий код
 * превращает его в уведомление для пользователя.
 *
 * @param <T> тип значения при успехе
 */
public final class Outcome<T> {
    private final T value;
    private final AnalysisError error;

    private Outcome(T value, AnalysisError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value cannot be null"), null);
    }

    public static <T> Outcome<T> failure(AnalysisError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException если результат - ошибка
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure: " + error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException если результат успешный
     */
    public AnalysisError getError() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? Outcome.success(mapper.apply(value)) : Outcome.failure(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome{success=" + value + "}" : "Outcome{failure=" + error + "}";
    }
}
