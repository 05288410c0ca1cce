package analysis;

import com.fasterxml.jackson.databind.JsonNode;
import model.Dataset;
import model.Outcome;
import validator.ValidationGate;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Координатор запросов на вычисление для одного экрана анализа.
 *
 * <p>Гарантии:
 * <ul>
 *   <li>одновременно выполняется не более одного запроса; повторный запуск в состоянии
 *       {@link AnalysisState#PENDING} отклоняется без исходящего вызова</li>
 *   <li>запуск при непройденных проверках отклоняется ошибкой VALIDATION без исходящего вызова</li>
 *   <li>успешный результат кэшируется вместе с конфигурацией, для которой он получен</li>
 *   <li>ошибка NETWORK не трогает кэш, ошибка SCHEMA его сбрасывает</li>
 *   <li>ответ для конфигурации, которая перестала быть текущей, не кэшируется</li>
 * </ul>
 *
 * <p>Все изменения состояния выполняются под монитором координатора. Сетевой вызов
 * выполняется на переданном {@link Executor}.
 *
 * @param <C> тип конфигурации экрана
 */
public final class AnalysisCoordinator<C extends AnalysisConfig> {
    private static final Logger logger = Logger.getLogger(AnalysisCoordinator.class.getName());

    private final ComputationClient client;
    private final String endpoint;
    private final ResultSchema schema;
    private final ValidationGate<C> gate;
    private final BiFunction<C, Dataset, JsonNode> requestEncoder;
    private final Executor executor;
    private final Clock clock;

    private AnalysisState state = AnalysisState.IDLE;
    private AnalysisRequest<C> pendingRequest;
    private AnalysisResult<C> cachedResult;
    private AnalysisError lastError;
    // Bumped by clear(): responses issued before a reset are not cached.
    private long generation;

    public AnalysisCoordinator(ComputationClient client,
                               String endpoint,
                               ResultSchema schema,
                               ValidationGate<C> gate,
                               BiFunction<C, Dataset, JsonNode> requestEncoder,
                               Executor executor) {
        this(client, endpoint, schema, gate, requestEncoder, executor, Clock.systemUTC());
    }

    public AnalysisCoordinator(ComputationClient client,
                               String endpoint,
                               ResultSchema schema,
                               ValidationGate<C> gate,
                               BiFunction<C, Dataset, JsonNode> requestEncoder,
                               Executor executor,
                               Clock clock) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.gate = Objects.requireNonNull(gate, "gate cannot be null");
        this.requestEncoder = Objects.requireNonNull(requestEncoder, "requestEncoder cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Запустить вычисление для конфигурации, которая считается текущей до получения ответа.
     */
    public CompletableFuture<Outcome<AnalysisResult<C>>> submit(C config, Dataset dataset) {
        return submit(config, dataset, submitted -> true);
    }

    /**
     * Запустить вычисление для конфигурации.
     *
     * <p>Переход в {@link AnalysisState#PENDING} происходит синхронно, до возврата из метода.
     * При получении ответа {@code stillCurrent} проверяет, осталась ли отправленная конфигурация
     * текущей; если нет, ответ возвращается вызывающему, но не кэшируется.
     *
     * @param stillCurrent проверка актуальности; вызывается без удержания монитора координатора
     * @return будущее с результатом; никогда не завершается исключением
     */
    public CompletableFuture<Outcome<AnalysisResult<C>>> submit(C config, Dataset dataset, Predicate<C> stillCurrent) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(stillCurrent, "stillCurrent cannot be null");

        final AnalysisRequest<C> request;
        final long requestGeneration;
        synchronized (this) {
            if (state == AnalysisState.PENDING) {
                logger.fine("Submit rejected for " + endpoint + ": request already pending");
                return CompletableFuture.completedFuture(
                    Outcome.failure(AnalysisError.validation("An analysis is already running")));
            }
            if (!gate.allPassed(config, dataset)) {
                logger.fine("Submit rejected for " + endpoint + ": validation checks not passed");
                return CompletableFuture.completedFuture(
                    Outcome.failure(AnalysisError.validation("Please complete all validation checks before running the analysis")));
            }
            request = new AnalysisRequest<>(config, clock.instant());
            requestGeneration = generation;
            pendingRequest = request;
            state = AnalysisState.PENDING;
            logger.info("Analysis " + endpoint + " started for " + config);
        }

        JsonNode body;
        try {
            body = requestEncoder.apply(config, dataset);
        } catch (RuntimeException e) {
            logger.warning("Could not build request for " + endpoint + ": " + e);
            return CompletableFuture.completedFuture(complete(request, requestGeneration, false,
                Outcome.failure(AnalysisError.validation("Could not build analysis request: " + rootMessage(e)))));
        }
        return CompletableFuture
            .supplyAsync(() -> client.compute(endpoint, body), executor)
            .exceptionally(throwable -> {
                logger.warning("Computation call for " + endpoint + " failed: " + throwable.getMessage());
                return Outcome.failure(AnalysisError.network(rootMessage(throwable)));
            })
            .thenApply(outcome -> complete(request, requestGeneration, !stillCurrent.test(request.config()), outcome));
    }

    private synchronized Outcome<AnalysisResult<C>> complete(AnalysisRequest<C> request,
                                                            long requestGeneration,
                                                            boolean superseded,
                                                            Outcome<JsonNode> response) {
        pendingRequest = null;
        boolean discarded = superseded || requestGeneration != generation;

        Outcome<JsonNode> checked = response.isSuccess() ? schema.check(response.getValue()) : response;
        if (checked.isFailure()) {
            AnalysisError error = checked.getError();
            if (discarded) {
                logger.info("Ignoring failure of superseded analysis " + request.config() + ": " + error);
                state = cachedResult != null ? AnalysisState.SUCCESS : AnalysisState.IDLE;
                return Outcome.failure(error);
            }
            lastError = error;
            state = AnalysisState.ERROR;
            if (error.isHardFailure()) {
                cachedResult = null;
            }
            logger.warning("Analysis " + endpoint + " failed: " + error);
            return Outcome.failure(error);
        }

        AnalysisResult<C> result = new AnalysisResult<>(request.config(), checked.getValue(), clock.instant());
        if (discarded) {
            logger.info("Discarding result of superseded analysis " + request.config());
            state = cachedResult != null ? AnalysisState.SUCCESS : AnalysisState.IDLE;
            return Outcome.success(result);
        }
        cachedResult = result;
        lastError = null;
        state = AnalysisState.SUCCESS;
        logger.info("Analysis " + endpoint + " completed for " + request.config());
        return Outcome.success(result);
    }

    /**
     * Сбросить кэш и последнюю ошибку. Выполняющийся запрос не отменяется,
     * но его ответ не попадет в кэш.
     */
    public synchronized void clear() {
        generation++;
        cachedResult = null;
        lastError = null;
        if (state != AnalysisState.PENDING) {
            state = AnalysisState.IDLE;
        }
        logger.fine("Analysis cache cleared for " + endpoint);
    }

    public synchronized AnalysisState getState() {
        return state;
    }

    public synchronized boolean isPending() {
        return state == AnalysisState.PENDING;
    }

    public synchronized Optional<AnalysisRequest<C>> getPendingRequest() {
        return Optional.ofNullable(pendingRequest);
    }

    /**
     * Закэшированный результат, возможно устаревший относительно текущей конфигурации.
     */
    public synchronized Optional<AnalysisResult<C>> getCachedResult() {
        return Optional.ofNullable(cachedResult);
    }

    /**
     * Результат, только если он получен для данной конфигурации.
     */
    public synchronized Optional<AnalysisResult<C>> getResultFor(C config) {
        if (cachedResult != null && cachedResult.matches(config)) {
            return Optional.of(cachedResult);
        }
        return Optional.empty();
    }

    public synchronized Optional<AnalysisError> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public String getEndpoint() {
        return endpoint;
    }

    private static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
