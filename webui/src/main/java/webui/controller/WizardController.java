package webui.controller;

import model.Dataset;
import model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import report.ExportArtifact;
import report.ExportKind;
import webui.model.*;
import webui.service.BufferedDownloadSink;
import webui.service.WizardService;
import wizard.WizardProgress;
import wizard.WizardSession;
import wizard.WizardStep;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Контроллер мастера анализа: сессии, навигация по шагам, конфигурация и экспорт.
 */
@RestController
@RequestMapping("/api/wizard")
public class WizardController {
    private static final Logger logger = LoggerFactory.getLogger(WizardController.class);

    private final WizardService wizardService;

    public WizardController(WizardService wizardService) {
        this.wizardService = wizardService;
    }

    /**
     * Список экранов анализа.
     * GET /api/wizard/screens
     */
    @GetMapping("/screens")
    public List<ScreenInfo> getScreens() {
        return wizardService.getScreens();
    }

    /**
     * Создание сессии мастера для экрана и набора данных.
     * POST /api/wizard/sessions
     */
    @PostMapping("/sessions")
    public ResponseEntity<WizardResponse> createSession(@RequestBody CreateSessionRequest request) {
        if (request.screen() == null || request.screen().isBlank()) {
            return ResponseEntity.badRequest().body(WizardResponse.error("Screen is required"));
        }
        if (request.dataset() == null) {
            return ResponseEntity.badRequest().body(WizardResponse.error("Dataset is required"));
        }
        try {
            Dataset dataset = request.dataset().toDataset();
            WizardSession<?> session = wizardService.createSession(request.screen(), dataset);
            return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session), "Session created"));
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot create wizard session: {}", e.getMessage());
            return ResponseEntity.badRequest().body(WizardResponse.error(e.getMessage()));
        }
    }

    /**
     * Текущее состояние сессии.
     * GET /api/wizard/sessions/{sessionId}
     */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionView> getSession(@PathVariable("sessionId") String sessionId) {
        return wizardService.getSession(sessionId)
                .map(session -> ResponseEntity.ok(wizardService.toView(session)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Закрытие сессии.
     * DELETE /api/wizard/sessions/{sessionId}
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<WizardResponse> closeSession(@PathVariable("sessionId") String sessionId) {
        if (!wizardService.closeSession(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(WizardResponse.success(sessionId, "Session closed"));
    }

    /**
     * Замена набора данных: конфигурация по умолчанию, возврат на шаг 1.
     * PUT /api/wizard/sessions/{sessionId}/dataset
     */
    @PutMapping("/sessions/{sessionId}/dataset")
    public ResponseEntity<WizardResponse> changeDataset(@PathVariable("sessionId") String sessionId,
                                                        @RequestBody DatasetPayload dataset) {
        Optional<WizardSession<?>> sessionOpt = wizardService.getSession(sessionId);
        if (sessionOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        WizardSession<?> session = sessionOpt.get();
        session.changeDataset(dataset.toDataset());
        return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session), "Dataset changed"));
    }

    /**
     * Изменение конфигурации экрана.
     * PUT /api/wizard/sessions/{sessionId}/config
     */
    @PutMapping("/sessions/{sessionId}/config")
    public ResponseEntity<WizardResponse> updateConfig(@PathVariable("sessionId") String sessionId,
                                                       @RequestBody ConfigUpdateRequest request) {
        Optional<WizardSession<?>> sessionOpt = wizardService.getSession(sessionId);
        if (sessionOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        WizardSession<?> session = sessionOpt.get();
        try {
            wizardService.updateConfig(session, request.config());
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected config for session {}: {}", sessionId, e.getMessage());
            return ResponseEntity.badRequest().body(WizardResponse.error("Invalid configuration: " + e.getMessage()));
        }
        return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session), "Configuration updated"));
    }

    /**
     * Следующий шаг. С шага проверок запускает анализ и ждет его завершения.
     * POST /api/wizard/sessions/{sessionId}/next
     */
    @PostMapping("/sessions/{sessionId}/next")
    public ResponseEntity<WizardResponse> next(@PathVariable("sessionId") String sessionId) {
        Optional<WizardSession<?>> sessionOpt = wizardService.getSession(sessionId);
        if (sessionOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        WizardSession<?> session = sessionOpt.get();
        WizardProgress before = session.getProgress();
        WizardProgress after = session.next().join();
        String message = after.current() == before.current() && before.current() == WizardStep.VALIDATION
                ? "Analysis did not complete"
                : "Moved to step " + after.current().getId();
        return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session), message));
    }

    /**
     * Предыдущий шаг.
     * POST /api/wizard/sessions/{sessionId}/prev
     */
    @PostMapping("/sessions/{sessionId}/prev")
    public ResponseEntity<WizardResponse> prev(@PathVariable("sessionId") String sessionId) {
        return wizardService.getSession(sessionId)
                .map(session -> {
                    WizardProgress progress = session.prev();
                    return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session),
                            "Moved to step " + progress.current().getId()));
                })
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Переход по индикатору шагов.
     * POST /api/wizard/sessions/{sessionId}/goto/{step}
     */
    @PostMapping("/sessions/{sessionId}/goto/{step}")
    public ResponseEntity<WizardResponse> goTo(@PathVariable("sessionId") String sessionId,
                                               @PathVariable("step") int step) {
        Optional<WizardStep> target = WizardStep.fromId(step);
        if (target.isEmpty()) {
            return ResponseEntity.badRequest().body(WizardResponse.error("Unknown step: " + step));
        }
        return wizardService.getSession(sessionId)
                .map(session -> {
                    WizardProgress progress = session.goTo(target.get());
                    String message = progress.current() == target.get()
                            ? "Moved to step " + step
                            : "Step " + step + " is not reachable";
                    return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session), message));
                })
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Новый анализ: шаг 1, результат сброшен.
     * POST /api/wizard/sessions/{sessionId}/start-over
     */
    @PostMapping("/sessions/{sessionId}/start-over")
    public ResponseEntity<WizardResponse> startOver(@PathVariable("sessionId") String sessionId) {
        return wizardService.getSession(sessionId)
                .map(session -> {
                    session.startOver();
                    return ResponseEntity.ok(WizardResponse.withView(wizardService.toView(session), "Started over"));
                })
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Скачивание экспорта актуального результата.
     * GET /api/wizard/sessions/{sessionId}/export/{kind}
     */
    @GetMapping("/sessions/{sessionId}/export/{kind}")
    public ResponseEntity<Resource> export(@PathVariable("sessionId") String sessionId,
                                           @PathVariable("kind") String kindStr) {
        Optional<WizardSession<?>> sessionOpt = wizardService.getSession(sessionId);
        if (sessionOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        ExportKind kind;
        try {
            kind = ExportKind.valueOf(kindStr.toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }

        BufferedDownloadSink sink = new BufferedDownloadSink();
        Outcome<ExportArtifact> outcome;
        try {
            outcome = wizardService.export(sessionOpt.get(), kind, sink).join();
        } catch (CompletionException e) {
            logger.error("Export {} failed for session {}", kind, sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }

        if (outcome.isFailure()) {
            HttpStatus status = switch (outcome.getError().getKind()) {
                case VALIDATION -> HttpStatus.CONFLICT;
                default -> HttpStatus.BAD_GATEWAY;
            };
            return ResponseEntity.status(status).build();
        }

        return sink.getDownload()
                .map(download -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + download.fileName() + "\"")
                        .contentType(MediaType.parseMediaType(download.mediaType()))
                        .contentLength(download.content().length)
                        .body((Resource) new ByteArrayResource(download.content())))
                .orElse(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
    }

    /**
     * Закрытие уведомления.
     * DELETE /api/wizard/sessions/{sessionId}/notifications/{notificationId}
     */
    @DeleteMapping("/sessions/{sessionId}/notifications/{notificationId}")
    public ResponseEntity<Map<String, Object>> dismissNotification(@PathVariable("sessionId") String sessionId,
                                                                   @PathVariable("notificationId") String notificationId) {
        return wizardService.getSession(sessionId)
                .map(session -> ResponseEntity.ok(
                        Map.<String, Object>of("dismissed", session.dismissNotification(notificationId))))
                .orElse(ResponseEntity.notFound().build());
    }
}
