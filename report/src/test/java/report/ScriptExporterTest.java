package report;

import analysis.AnalysisError;
import http.HttpClient;
import http.ServiceRequest;
import http.ServiceResponse;
import model.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import screen.AcfPacfScreen;
import wizard.WizardSettings;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScriptExporterTest {

    @Mock
    private HttpClient httpClient;

    private ScriptExporter exporter() {
        WizardSettings settings = WizardSettings.builder()
            .scriptUrlTemplate("https://scripts.example.com/{file}?alt=media")
            .build();
        return new ScriptExporter(httpClient, settings, Runnable::run);
    }

    @Test
    void testScriptIsFetchedFromTemplateUrl() {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(200).body("import pandas as pd\n").build());

        Outcome<ExportArtifact> outcome = exporter().export(ExportFixtures.job(ExportKind.SCRIPT, null),
            new AcfPacfScreen(), ExportFixtures.series(120)).join();

        assertTrue(outcome.isSuccess());
        assertEquals("ACF_PACF_2024-03-15.py", outcome.getValue().getFileName());
        assertEquals("import pandas as pd\n", new String(outcome.getValue().getContent(), StandardCharsets.UTF_8));

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(httpClient).execute(captor.capture());
        assertEquals("https://scripts.example.com/acf_pacf_analysis.py?alt=media", captor.getValue().getUrl());
        assertEquals("GET", captor.getValue().getMethod());
    }

    @Test
    void testMissingScriptIsDocumentFailure() {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(404).body("Not found").build());

        Outcome<ExportArtifact> outcome = exporter().export(ExportFixtures.job(ExportKind.SCRIPT, null),
            new AcfPacfScreen(), ExportFixtures.series(120)).join();

        assertEquals(AnalysisError.Kind.DOCUMENT, outcome.getError().getKind());
        assertEquals("Failed to load code (HTTP 404)", outcome.getError().getDescription());
    }
}
