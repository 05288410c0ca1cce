package wizard;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Конечный автомат шагов мастера.
 *
 * <p>Правила переходов:
 * <ul>
 *   <li>{@link #goTo(WizardStep)} разрешен на любой уже достигнутый шаг, а также на шаги результата (4-6),
 *       если есть актуальный результат; запрещенный переход молча игнорируется</li>
 *   <li>{@link #next()} на шаге проверки запускает анализ и переходит к шагу 4 только при успехе;
 *       на шагах результата подчиняется тому же правилу, что и {@link #goTo(WizardStep)}</li>
 *   <li>{@link #prev()} не меняет максимальный достигнутый шаг</li>
 *   <li>{@link #reset()} возвращает мастер к шагу 1</li>
 * </ul>
 *
 * <p>Внешние проверки ({@code resultAvailable}, {@code analysisTrigger}) вызываются без удержания
 * монитора автомата.
 */
public final class WizardStateMachine {
    private static final Logger logger = Logger.getLogger(WizardStateMachine.class.getName());

    private final BooleanSupplier resultAvailable;
    private final Supplier<CompletableFuture<Boolean>> analysisTrigger;

    private WizardStep current = WizardStep.VARIABLES;
    private WizardStep maxReached = WizardStep.VARIABLES;
    // Incremented on reset so that an analysis finishing afterwards cannot advance the wizard.
    private long epoch;

    /**
     * @param resultAvailable  есть ли актуальный (не устаревший) результат анализа
     * @param analysisTrigger  запуск анализа; будущее завершается {@code true} только при успехе
     */
    public WizardStateMachine(BooleanSupplier resultAvailable,
                              Supplier<CompletableFuture<Boolean>> analysisTrigger) {
        this.resultAvailable = Objects.requireNonNull(resultAvailable, "resultAvailable cannot be null");
        this.analysisTrigger = Objects.requireNonNull(analysisTrigger, "analysisTrigger cannot be null");
    }

    public synchronized WizardProgress getProgress() {
        return new WizardProgress(current, maxReached);
    }

    /**
     * Перейти на шаг, если это разрешено.
     *
     * @return прогресс после попытки перехода
     */
    public WizardProgress goTo(WizardStep step) {
        Objects.requireNonNull(step, "step cannot be null");
        boolean result = step.showsResult() && resultAvailable.getAsBoolean();
        synchronized (this) {
            if (step.getId() <= maxReached.getId() || result) {
                moveTo(step);
            } else {
                logger.fine("Ignoring navigation to " + step + " (max reached: " + maxReached + ")");
            }
            return getProgress();
        }
    }

    /**
     * Следующий шаг. На шаге проверки выполняется асинхронно: переход к шагу 4 происходит
     * после успешного завершения анализа, если мастер не был сброшен за это время.
     */
    public CompletableFuture<WizardProgress> next() {
        final long requestEpoch;
        boolean result = resultAvailable.getAsBoolean();
        synchronized (this) {
            if (current != WizardStep.VALIDATION) {
                if (current.getId() < WizardStep.LAST) {
                    WizardStep following = WizardStep.of(current.getId() + 1);
                    if (!following.showsResult() || following.getId() <= maxReached.getId() || result) {
                        moveTo(following);
                    } else {
                        logger.fine("Ignoring next to " + following + ": no current result");
                    }
                }
                return CompletableFuture.completedFuture(getProgress());
            }
            requestEpoch = epoch;
        }

        logger.info("Validation step passed, running analysis");
        return analysisTrigger.get().thenApply(success -> {
            synchronized (this) {
                if (!Boolean.TRUE.equals(success)) {
                    logger.fine("Analysis did not succeed, staying on " + current);
                } else if (requestEpoch != epoch || current != WizardStep.VALIDATION) {
                    logger.info("Wizard changed while analysis was running, not advancing");
                } else {
                    moveTo(WizardStep.SUMMARY);
                }
                return getProgress();
            }
        });
    }

    public synchronized WizardProgress prev() {
        if (current.getId() > WizardStep.FIRST) {
            current = WizardStep.of(current.getId() - 1);
            logger.fine("Moved back to " + current);
        }
        return getProgress();
    }

    public synchronized WizardProgress reset() {
        epoch++;
        current = WizardStep.VARIABLES;
        maxReached = WizardStep.VARIABLES;
        logger.info("Wizard reset to step 1");
        return getProgress();
    }

    private void moveTo(WizardStep step) {
        current = step;
        if (step.getId() > maxReached.getId()) {
            maxReached = step;
        }
        logger.fine("Moved to " + current + " (max reached: " + maxReached + ")");
    }
}
