package wizard;

import analysis.AnalysisConfig;
import analysis.AnalysisCoordinator;
import analysis.AnalysisError;
import analysis.AnalysisResult;
import analysis.AnalysisState;
import analysis.ComputationClient;
import model.Dataset;
import model.Notification;
import model.Outcome;
import screen.AnalysisScreen;
import validator.ValidationReport;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Сессия мастера для одного экземпляра экрана анализа.
 *
 * <p>Связывает набор данных, текущую конфигурацию, проверки, автомат шагов и координатор анализа.
 * Все изменения состояния сессии сериализуются монитором сессии.
 *
 * <p>Правила сброса:
 * <ul>
 *   <li>смена набора данных - конфигурация по умолчанию, шаг 1, кэш очищен</li>
 *   <li>смена выбранных переменных - шаг 1, кэш очищен</li>
 *   <li>смена только параметров (например, числа лагов) - прогресс сохраняется, кэшированный результат
 *       становится устаревшим и не отображается и не экспортируется</li>
 * </ul>
 */
public final class WizardSession<C extends AnalysisConfig> {
    private static final Logger logger = Logger.getLogger(WizardSession.class.getName());

    /**
     * Сколько последних уведомлений хранит сессия; более старые вытесняются.
     */
    public static final int MAX_NOTIFICATIONS = 20;

    private final String id;
    private final AnalysisScreen<C> screen;
    private final AnalysisCoordinator<C> coordinator;
    private final WizardStateMachine stateMachine;
    private final Deque<Notification> notifications = new ArrayDeque<>();
    private final List<WizardListener> listeners = new CopyOnWriteArrayList<>();

    private Dataset dataset;
    private C config;

    public WizardSession(AnalysisScreen<C> screen, ComputationClient client, Executor executor, Dataset dataset) {
        this.id = UUID.randomUUID().toString();
        this.screen = Objects.requireNonNull(screen, "screen cannot be null");
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.config = screen.defaultConfig(dataset);
        this.coordinator = new AnalysisCoordinator<>(client, screen.getEndpoint(), screen.getSchema(),
            screen.getGate(), screen::buildRequest, executor);
        this.stateMachine = new WizardStateMachine(this::hasCurrentResult, this::runAnalysis);
        logger.info("Wizard session " + id + " created for screen " + screen.getSlug() + " on " + dataset);
    }

    public String getId() {
        return id;
    }

    public AnalysisScreen<C> getScreen() {
        return screen;
    }

    public synchronized Dataset getDataset() {
        return dataset;
    }

    public synchronized C getConfig() {
        return config;
    }

    /**
     * Для набора данных недостаточно колонок или строк: показывается вводная страница вместо мастера.
     */
    public synchronized boolean isIntroOnly() {
        return !screen.canRun(dataset);
    }

    public WizardProgress getProgress() {
        return stateMachine.getProgress();
    }

    public AnalysisState getAnalysisState() {
        return coordinator.getState();
    }

    public synchronized ValidationReport getValidationReport() {
        return screen.getGate().evaluate(config, dataset);
    }

    /**
     * Производные границы для шага настроек (например, максимальное число лагов).
     */
    public synchronized Map<String, Integer> getDerivedBounds() {
        return screen.getGate().derivedBounds(config, dataset);
    }

    // ---------- data and configuration ----------

    public void changeDataset(Dataset newDataset) {
        Objects.requireNonNull(newDataset, "dataset cannot be null");
        synchronized (this) {
            dataset = newDataset;
            config = screen.defaultConfig(newDataset);
            coordinator.clear();
            logger.info("Session " + id + ": dataset changed to " + newDataset + ", config reset to " + config);
        }
        fireProgress(stateMachine.reset());
    }

    public void updateConfig(C newConfig) {
        Objects.requireNonNull(newConfig, "config cannot be null");
        boolean variablesChanged;
        synchronized (this) {
            variablesChanged = !newConfig.selectedVariables().equals(config.selectedVariables());
            config = newConfig;
            if (variablesChanged) {
                coordinator.clear();
            }
            logger.fine("Session " + id + ": config updated to " + newConfig);
        }
        if (variablesChanged) {
            logger.info("Session " + id + ": variable selection changed, resetting wizard");
            fireProgress(stateMachine.reset());
        }
    }

    /**
     * Применить конфигурацию, полученную из нетипизированного источника (JSON REST API).
     *
     * @throws ClassCastException если объект не является конфигурацией этого экрана
     */
    public void applyConfig(Object newConfig) {
        updateConfig(screen.getConfigType().cast(newConfig));
    }

    // ---------- navigation ----------

    public CompletableFuture<WizardProgress> next() {
        return stateMachine.next().thenApply(progress -> {
            fireProgress(progress);
            return progress;
        });
    }

    public WizardProgress prev() {
        return fireProgress(stateMachine.prev());
    }

    public WizardProgress goTo(WizardStep step) {
        return fireProgress(stateMachine.goTo(step));
    }

    /**
     * Начать новый анализ: шаг 1, результат сброшен. Набор данных и конфигурация сохраняются.
     */
    public WizardProgress startOver() {
        coordinator.clear();
        return fireProgress(stateMachine.reset());
    }

    // ---------- analysis ----------

    /**
     * Запустить анализ для текущей конфигурации.
     *
     * @return {@code true}, если анализ успешен и результат соответствует текущей конфигурации
     */
    public CompletableFuture<Boolean> runAnalysis() {
        final C submitted;
        final CompletableFuture<Outcome<AnalysisResult<C>>> future;
        synchronized (this) {
            submitted = config;
            future = coordinator.submit(submitted, dataset, this::isCurrentConfig);
        }
        fireAnalysisState(coordinator.getState());

        return future.thenApply(outcome -> {
            fireAnalysisState(coordinator.getState());
            if (outcome.isFailure()) {
                AnalysisError error = outcome.getError();
                postNotification(Notification.error(error.getTitle(), error.getDescription()));
                return false;
            }
            synchronized (this) {
                if (!outcome.getValue().matches(config)) {
                    logger.info("Session " + id + ": result for " + submitted + " arrived after config change");
                    return false;
                }
            }
            return true;
        });
    }

    private synchronized boolean isCurrentConfig(C candidate) {
        return candidate.equals(config);
    }

    synchronized boolean hasCurrentResult() {
        return coordinator.getResultFor(config).isPresent();
    }

    /**
     * Результат, который можно отображать и экспортировать: только актуальный для текущей конфигурации.
     */
    public synchronized Optional<AnalysisResult<C>> getCurrentResult() {
        return coordinator.getResultFor(config);
    }

    /**
     * Закэшированный результат существует, но получен для другой конфигурации.
     */
    public synchronized boolean isResultStale() {
        return coordinator.getCachedResult().isPresent() && coordinator.getResultFor(config).isEmpty();
    }

    public Optional<AnalysisError> getLastError() {
        return coordinator.getLastError();
    }

    // ---------- notifications ----------

    public void postNotification(Notification notification) {
        synchronized (notifications) {
            notifications.addLast(notification);
            while (notifications.size() > MAX_NOTIFICATIONS) {
                notifications.removeFirst();
            }
        }
        logger.fine("Session " + id + ": notification " + notification.level() + " " + notification.title());
        listeners.forEach(listener -> listener.onNotification(this, notification));
    }

    public List<Notification> getNotifications() {
        synchronized (notifications) {
            return List.copyOf(notifications);
        }
    }

    public boolean dismissNotification(String notificationId) {
        synchronized (notifications) {
            return notifications.removeIf(notification -> notification.id().equals(notificationId));
        }
    }

    // ---------- listeners ----------

    public void addListener(WizardListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(WizardListener listener) {
        listeners.remove(listener);
    }

    private WizardProgress fireProgress(WizardProgress progress) {
        listeners.forEach(listener -> listener.onProgress(this, progress));
        return progress;
    }

    private void fireAnalysisState(AnalysisState state) {
        listeners.forEach(listener -> listener.onAnalysisState(this, state));
    }

    @Override
    public String toString() {
        return "WizardSession{id=" + id + ", screen=" + screen.getSlug() + "}";
    }
}
