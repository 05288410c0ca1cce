package webui.service;

import analysis.AnalysisConfig;
import analysis.AnalysisState;
import analysis.ComputationClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import model.Dataset;
import model.Notification;
import model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import report.DownloadSink;
import report.ExportArtifact;
import report.ExportKind;
import report.ExportPipeline;
import screen.AnalysisScreen;
import screen.ScreenRegistry;
import validator.ValidationReport;
import webui.model.ScreenInfo;
import webui.model.SessionView;
import webui.websocket.WizardWebSocketHandler;
import wizard.WizardListener;
import wizard.WizardProgress;
import wizard.WizardSession;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Сервис управления сессиями мастера анализа.
 */
@Service
public class WizardService {
    private static final Logger logger = LoggerFactory.getLogger(WizardService.class);

    private final ScreenRegistry screenRegistry;
    private final ComputationClient computationClient;
    private final ExportPipeline exportPipeline;
    private final ExecutorService executorService;
    private final ObjectMapper objectMapper;
    private final WizardWebSocketHandler webSocketHandler;
    private final Map<String, WizardSession<?>> activeSessions = new ConcurrentHashMap<>();
    private final WizardListener broadcaster = new BroadcastingListener();

    public WizardService(ScreenRegistry screenRegistry,
                         ComputationClient computationClient,
                         ExportPipeline exportPipeline,
                         ExecutorService wizardExecutor,
                         ObjectMapper objectMapper,
                         WizardWebSocketHandler webSocketHandler) {
        this.screenRegistry = screenRegistry;
        this.computationClient = computationClient;
        this.exportPipeline = exportPipeline;
        this.executorService = wizardExecutor;
        this.objectMapper = objectMapper;
        this.webSocketHandler = webSocketHandler;
        logger.info("Wizard service ready with screens {}", screenRegistry.getSlugs());
    }

    public List<ScreenInfo> getScreens() {
        return screenRegistry.getAllScreens().stream().map(ScreenInfo::of).toList();
    }

    /**
     * Создать сессию мастера для экрана.
     *
     * @throws IllegalArgumentException если экран неизвестен
     */
    public WizardSession<?> createSession(String screenSlug, Dataset dataset) {
        AnalysisScreen<?> screen = screenRegistry.getScreen(screenSlug)
            .orElseThrow(() -> new IllegalArgumentException("Unknown analysis screen: " + screenSlug));
        WizardSession<?> session = newSession(screen, dataset);
        session.addListener(broadcaster);
        activeSessions.put(session.getId(), session);
        logger.info("Created wizard session {} for screen {} ({} rows)", session.getId(), screenSlug, dataset.rowCount());
        return session;
    }

    private <C extends AnalysisConfig> WizardSession<C> newSession(AnalysisScreen<C> screen, Dataset dataset) {
        return new WizardSession<>(screen, computationClient, executorService, dataset);
    }

    public Optional<WizardSession<?>> getSession(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    public boolean closeSession(String sessionId) {
        WizardSession<?> session = activeSessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.removeListener(broadcaster);
        webSocketHandler.forget(sessionId);
        logger.info("Closed wizard session {}", sessionId);
        return true;
    }

    /**
     * Применить конфигурацию из JSON: поля преобразуются в запись конфигурации экрана.
     *
     * @throws IllegalArgumentException если JSON не соответствует конфигурации экрана
     */
    public void updateConfig(WizardSession<?> session, JsonNode config) {
        if (config == null || !config.isObject()) {
            throw new IllegalArgumentException("config must be a JSON object");
        }
        Object converted = objectMapper.convertValue(config, session.getScreen().getConfigType());
        session.applyConfig(converted);
    }

    /**
     * Экспорт актуального результата; файл доставляется в переданный приемник.
     */
    public CompletableFuture<Outcome<ExportArtifact>> export(WizardSession<?> session, ExportKind kind, DownloadSink sink) {
        return exportPipeline.export(kind, session, sink);
    }

    public SessionView toView(WizardSession<?> session) {
        return buildView(session);
    }

    private <C extends AnalysisConfig> SessionView buildView(WizardSession<C> session) {
        WizardProgress progress = session.getProgress();
        ValidationReport report = session.getValidationReport();
        Dataset dataset = session.getDataset();

        JsonNode result = null;
        if (progress.current().showsResult()) {
            result = session.getCurrentResult().map(r -> r.getPayload()).orElse(null);
        }

        SessionView.ErrorInfo lastError = session.getLastError()
            .map(error -> new SessionView.ErrorInfo(error.getKind().name(), error.getTitle(), error.getDescription()))
            .orElse(null);

        Map<ExportKind, Boolean> exports = new EnumMap<>(ExportKind.class);
        for (ExportKind kind : ExportKind.values()) {
            exports.put(kind, exportPipeline.isInProgress(session, kind));
        }

        return new SessionView(
            session.getId(),
            session.getScreen().getSlug(),
            session.getScreen().getDisplayName(),
            dataset.getName(),
            dataset.rowCount(),
            session.isIntroOnly(),
            progress.current().getId(),
            progress.current().getLabel(),
            progress.maxReached().getId(),
            session.getAnalysisState(),
            session.getConfig(),
            session.getDerivedBounds(),
            report.checks(),
            report.allPassed(),
            result,
            session.isResultStale(),
            lastError,
            session.getNotifications(),
            exports
        );
    }

    @PreDestroy
    public void cleanup() {
        logger.info("Closing {} wizard sessions...", activeSessions.size());
        new ArrayList<>(activeSessions.keySet()).forEach(this::closeSession);
    }

    /**
     * Пересылает события сессий подписчикам WebSocket.
     */
    private class BroadcastingListener implements WizardListener {

        @Override
        public void onProgress(WizardSession<?> session, WizardProgress progress) {
            Map<String, Object> update = new HashMap<>();
            update.put("type", "progress");
            update.put("currentStep", progress.current().getId());
            update.put("maxReachedStep", progress.maxReached().getId());
            webSocketHandler.broadcastUpdate(session.getId(), update);
        }

        @Override
        public void onAnalysisState(WizardSession<?> session, AnalysisState state) {
            Map<String, Object> update = new HashMap<>();
            update.put("type", "analysis");
            update.put("state", state.name());
            webSocketHandler.broadcastUpdate(session.getId(), update);
        }

        @Override
        public void onNotification(WizardSession<?> session, Notification notification) {
            Map<String, Object> update = new HashMap<>();
            update.put("type", "notification");
            update.put("notification", notification);
            webSocketHandler.broadcastUpdate(session.getId(), update);
        }
    }
}
