package webui.model;

import analysis.AnalysisState;
import com.fasterxml.jackson.databind.JsonNode;
import model.Notification;
import report.ExportKind;
import validator.ValidationCheck;

import java.util.List;
import java.util.Map;

/**
 * Снимок сессии мастера для отрисовки текущего шага.
 *
 * <p>{@code result} заполняется только на шагах результата и только для актуальной конфигурации.
 */
public record SessionView(
    String sessionId,
    String screen,
    String screenName,
    String datasetName,
    int rowCount,
    boolean introOnly,
    int currentStep,
    String currentStepLabel,
    int maxReachedStep,
    AnalysisState analysisState,
    Object config,
    Map<String, Integer> bounds,
    List<ValidationCheck> checks,
    boolean allChecksPassed,
    JsonNode result,
    boolean resultStale,
    ErrorInfo lastError,
    List<Notification> notifications,
    Map<ExportKind, Boolean> exportsInProgress
) {
    public record ErrorInfo(String kind, String title, String description) {
    }
}
