package report;

import analysis.AnalysisError;
import com.fasterxml.jackson.databind.JsonNode;
import http.HttpClient;
import http.ServiceRequest;
import http.ServiceResponse;
import model.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import screen.AcfPacfScreen;
import wizard.WizardSettings;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentExporterTest {

    @Mock
    private HttpClient httpClient;

    private DocumentExporter exporter;

    @BeforeEach
    void setUp() {
        WizardSettings settings = WizardSettings.builder().documentBaseUrl("http://docs.local:3000/").build();
        exporter = new DocumentExporter(httpClient, settings, new ImageExporter(Runnable::run),
            ExportFixtures.MAPPER, Runnable::run);
    }

    private Outcome<ExportArtifact> export() {
        return exporter.export(ExportFixtures.job(ExportKind.DOCUMENT, ""), new AcfPacfScreen(),
            ExportFixtures.series(120)).join();
    }

    @Test
    void testDocumentIsReturnedAsDocx() throws Exception {
        byte[] docx = {0x50, 0x4B, 0x03, 0x04, 0x14};
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(200).body(docx).build());

        Outcome<ExportArtifact> outcome = export();

        assertTrue(outcome.isSuccess());
        assertEquals("ACF_PACF_2024-03-15.docx", outcome.getValue().getFileName());
        assertArrayEquals(docx, outcome.getValue().getContent());

        ArgumentCaptor<ServiceRequest> captor = ArgumentCaptor.forClass(ServiceRequest.class);
        verify(httpClient).execute(captor.capture());
        assertEquals("http://docs.local:3000/api/export/acf-pacf-docx", captor.getValue().getUrl());
        JsonNode body = ExportFixtures.MAPPER.readTree(captor.getValue().getBody());
        assertEquals("sales", body.get("valueCol").asText());
        assertEquals(20, body.get("lags").asInt());
        assertEquals(120, body.get("sampleSize").asInt());
        assertTrue(body.has("analysisResult"));
        assertTrue(body.hasNonNull("image"));
    }

    @Test
    void testServerErrorIsDocumentFailure() {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(500).body("{\"error\":\"boom\"}").build());

        Outcome<ExportArtifact> outcome = export();

        assertTrue(outcome.isFailure());
        assertEquals(AnalysisError.Kind.DOCUMENT, outcome.getError().getKind());
        assertEquals("Failed to generate document (HTTP 500)", outcome.getError().getDescription());
    }

    @Test
    void testEmptyBodyIsDocumentFailure() {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(200).body(new byte[0]).build());

        assertEquals(AnalysisError.Kind.DOCUMENT, export().getError().getKind());
    }

    @Test
    void testUnreachableServiceIsDocumentFailure() {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().error(new ConnectException("Connection refused")).build());

        Outcome<ExportArtifact> outcome = export();

        assertEquals(AnalysisError.Kind.DOCUMENT, outcome.getError().getKind());
        assertTrue(outcome.getError().getDescription().contains("Connection refused"));
    }
}
