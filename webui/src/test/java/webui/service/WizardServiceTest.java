package webui.service;

import analysis.AnalysisState;
import analysis.ComputationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import model.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import report.DownloadStager;
import report.ExportKind;
import report.ExportPipeline;
import report.JsonExporter;
import report.TabularExporter;
import screen.LagConfig;
import screen.ScreenRegistry;
import webui.model.SessionView;
import webui.websocket.WizardWebSocketHandler;
import wizard.WizardSession;
import wizard.WizardStep;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WizardServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private ComputationClient computationClient;

    @Mock
    private WizardWebSocketHandler webSocketHandler;

    private WizardService service;

    @BeforeEach
    void setUp() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        ExportPipeline pipeline = new ExportPipeline(
            Map.of(ExportKind.TABULAR, new TabularExporter(), ExportKind.JSON, new JsonExporter()),
            new DownloadStager(), Clock.systemUTC());
        service = new WizardService(ScreenRegistry.withDefaults(), computationClient, pipeline, executor,
            mapper, webSocketHandler);
        lenient().when(computationClient.compute(anyString(), any())).thenReturn(Outcome.success(acfPayload()));
    }

    static Dataset series(int n) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(Map.of("sales", 50.0 + i % 11));
        }
        return new Dataset("sales.csv", List.of("sales"), rows);
    }

    private ObjectNode acfPayload() {
        ObjectNode results = mapper.createObjectNode();
        for (String field : List.of("acf", "pacf", "lags", "significant_acf_lags", "significant_pacf_lags")) {
            results.putArray(field).add(1);
        }
        results.put("ar_order_suggestion", 1);
        results.put("ma_order_suggestion", 0);
        results.put("model_recommendation", "AR(1)");
        ObjectNode payload = mapper.createObjectNode();
        payload.set("results", results);
        return payload;
    }

    @Test
    void testScreensAreListed() {
        assertEquals(6, service.getScreens().size());
        assertEquals("acf-pacf", service.getScreens().get(0).slug());
    }

    @Test
    void testUnknownScreenIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.createSession("anova", series(10)));
    }

    @Test
    void testNewSessionView() {
        WizardSession<?> session = service.createSession("acf-pacf", series(120));

        SessionView view = service.toView(session);

        assertEquals(session.getId(), view.sessionId());
        assertEquals(1, view.currentStep());
        assertEquals(AnalysisState.IDLE, view.analysisState());
        assertEquals(59, view.bounds().get("maxLags"));
        assertEquals(4, view.checks().size());
        assertTrue(view.allChecksPassed());
        assertNull(view.result());
        assertFalse(view.exportsInProgress().get(ExportKind.TABULAR));
        assertTrue(service.getSession(session.getId()).isPresent());
    }

    @Test
    void testConfigFromJsonIsApplied() throws Exception {
        WizardSession<?> session = service.createSession("acf-pacf", series(120));

        service.updateConfig(session, mapper.readTree("{\"valueCol\":\"sales\",\"lags\":24}"));

        assertEquals(new LagConfig("sales", 24), session.getConfig());
    }

    @Test
    void testConfigMustBeObject() throws Exception {
        WizardSession<?> session = service.createSession("acf-pacf", series(120));

        assertThrows(IllegalArgumentException.class, () -> service.updateConfig(session, mapper.readTree("[1,2]")));
        assertThrows(IllegalArgumentException.class,
            () -> service.updateConfig(session, mapper.readTree("{\"lags\":\"many\"}")));
    }

    @Test
    void testResultShownOnlyOnResultSteps() {
        WizardSession<?> session = service.createSession("acf-pacf", series(120));
        session.next().join();
        session.next().join();
        session.next().join();

        SessionView summary = service.toView(session);
        assertEquals(WizardStep.SUMMARY.getId(), summary.currentStep());
        assertNotNull(summary.result());

        session.goTo(WizardStep.SETTINGS);
        assertNull(service.toView(session).result());
    }

    @Test
    void testEventsAreBroadcast() {
        WizardSession<?> session = service.createSession("acf-pacf", series(120));

        session.next().join();

        verify(webSocketHandler, atLeastOnce()).broadcastUpdate(eq(session.getId()), anyMap());
    }

    @Test
    void testCloseSession() {
        WizardSession<?> session = service.createSession("acf-pacf", series(120));

        assertTrue(service.closeSession(session.getId()));
        assertFalse(service.closeSession(session.getId()));
        assertTrue(service.getSession(session.getId()).isEmpty());
        verify(webSocketHandler).forget(session.getId());
    }
}
