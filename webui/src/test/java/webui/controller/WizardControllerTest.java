package webui.controller;

import analysis.ComputationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import report.DownloadStager;
import report.ExportKind;
import report.ExportPipeline;
import report.TabularExporter;
import screen.ScreenRegistry;
import webui.model.ConfigUpdateRequest;
import webui.model.CreateSessionRequest;
import webui.model.DatasetPayload;
import webui.model.SessionView;
import webui.model.WizardResponse;
import webui.service.WizardService;
import webui.websocket.WizardWebSocketHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class WizardControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private ComputationClient computationClient;

    @Mock
    private WizardWebSocketHandler webSocketHandler;

    private WizardController controller;

    @BeforeEach
    void setUp() {
        ExportPipeline pipeline = new ExportPipeline(Map.of(ExportKind.TABULAR, new TabularExporter()),
            new DownloadStager(), Clock.systemUTC());
        WizardService service = new WizardService(ScreenRegistry.withDefaults(), computationClient, pipeline,
            Executors.newSingleThreadExecutor(), mapper, webSocketHandler);
        controller = new WizardController(service);

        ObjectNode results = mapper.createObjectNode();
        for (String field : List.of("acf", "pacf", "lags", "significant_acf_lags", "significant_pacf_lags")) {
            results.putArray(field).add(1);
        }
        results.put("ar_order_suggestion", 1);
        results.put("ma_order_suggestion", 0);
        results.put("model_recommendation", "AR(1)");
        ObjectNode payload = mapper.createObjectNode();
        payload.set("results", results);
        lenient().when(computationClient.compute(anyString(), any())).thenReturn(Outcome.success(payload));
    }

    private DatasetPayload dataset(int n) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(Map.of("sales", 10.0 + i % 5));
        }
        return new DatasetPayload("sales.csv", null, rows);
    }

    private String createSession() {
        ResponseEntity<WizardResponse> response = controller.createSession(new CreateSessionRequest("acf-pacf", dataset(120)));
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody().sessionId();
    }

    private SessionView view(ResponseEntity<WizardResponse> response) {
        return (SessionView) response.getBody().session();
    }

    @Test
    void testCreateSessionRequiresScreenAndDataset() {
        assertEquals(HttpStatus.BAD_REQUEST, controller.createSession(new CreateSessionRequest(null, dataset(5))).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, controller.createSession(new CreateSessionRequest("acf-pacf", null)).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, controller.createSession(new CreateSessionRequest("anova", dataset(5))).getStatusCode());
    }

    @Test
    void testUnknownSessionIsNotFound() {
        assertEquals(HttpStatus.NOT_FOUND, controller.getSession("missing").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.next("missing").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.export("missing", "TABULAR").getStatusCode());
    }

    @Test
    void testWizardFlowAndCsvDownload() throws IOException {
        String sessionId = createSession();

        controller.next(sessionId);
        controller.next(sessionId);
        SessionView summary = view(controller.next(sessionId));
        assertEquals(4, summary.currentStep());
        assertNotNull(summary.result());

        ResponseEntity<Resource> download = controller.export(sessionId, "tabular");
        assertEquals(HttpStatus.OK, download.getStatusCode());
        assertTrue(download.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION).contains("ACF_PACF_"));
        String csv = new String(download.getBody().getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertTrue(csv.startsWith("ACF/PACF Analysis Results"));
    }

    @Test
    void testExportWithoutResultIsConflict() {
        String sessionId = createSession();

        assertEquals(HttpStatus.CONFLICT, controller.export(sessionId, "TABULAR").getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST, controller.export(sessionId, "PDF").getStatusCode());
    }

    @Test
    void testConfigUpdateAndStaleResult() throws Exception {
        String sessionId = createSession();
        controller.next(sessionId);
        controller.next(sessionId);
        controller.next(sessionId);

        ResponseEntity<WizardResponse> response = controller.updateConfig(sessionId,
            new ConfigUpdateRequest(mapper.readTree("{\"valueCol\":\"sales\",\"lags\":12}")));

        SessionView view = view(response);
        assertEquals(4, view.currentStep());
        assertTrue(view.resultStale());
        assertNull(view.result());
    }

    @Test
    void testInvalidConfigIsBadRequest() throws Exception {
        String sessionId = createSession();

        ResponseEntity<WizardResponse> response = controller.updateConfig(sessionId,
            new ConfigUpdateRequest(mapper.readTree("\"lags\"")));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("error", response.getBody().status());
    }

    @Test
    void testGoToUnreachableStepKeepsCurrent() {
        String sessionId = createSession();

        SessionView view = view(controller.goTo(sessionId, 5));

        assertEquals(1, view.currentStep());
        assertEquals(HttpStatus.BAD_REQUEST, controller.goTo(sessionId, 9).getStatusCode());
    }

    @Test
    void testDismissNotification() {
        String sessionId = createSession();
        controller.export(sessionId, "TABULAR");
        SessionView view = controller.getSession(sessionId).getBody();
        String notificationId = view.notifications().get(0).id();

        ResponseEntity<Map<String, Object>> response = controller.dismissNotification(sessionId, notificationId);

        assertEquals(true, response.getBody().get("dismissed"));
        assertTrue(controller.getSession(sessionId).getBody().notifications().isEmpty());
    }
}
