package cli;

import http.HttpClient;
import http.ServiceRequest;
import http.ServiceResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;
import screen.ScreenRegistry;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WizardCliTest {

    private static final String ACF_RESPONSE = "{\"results\":{"
        + "\"acf\":[1.0,0.4],\"pacf\":[1.0,0.38],\"lags\":[0,1],"
        + "\"significant_acf_lags\":[1],\"significant_pacf_lags\":[1],"
        + "\"ar_order_suggestion\":1,\"ma_order_suggestion\":0,"
        + "\"model_recommendation\":\"AR(1)\"}}";

    @TempDir
    Path tempDir;

    @Mock
    private HttpClient httpClient;

    private Path dataFile;
    private StringWriter output;

    @BeforeEach
    void setUp() throws IOException {
        StringBuilder csv = new StringBuilder("date,sales\n");
        for (int i = 0; i < 120; i++) {
            csv.append("2024-01-").append(i + 1).append(',').append(100 + i % 9).append('\n');
        }
        dataFile = Files.writeString(tempDir.resolve("sales.csv"), csv.toString());
        output = new StringWriter();
    }

    private int run(String... args) {
        WizardCli cli = new WizardCli(ScreenRegistry.withDefaults(), httpClient);
        new CommandLine(cli).parseArgs(args);
        return cli.run(new PrintWriter(output, true));
    }

    private List<String> exportedFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void testListScreens() {
        assertEquals(0, run("--list-screens"));
        assertTrue(output.toString().contains("acf-pacf"));
        assertTrue(output.toString().contains("instrumental-variable"));
    }

    @Test
    void testMissingDatasetIsBadInput() {
        assertEquals(1, run());
        assertTrue(output.toString().contains("Dataset file is required"));
    }

    @Test
    void testUnknownScreenIsBadInput() {
        assertEquals(1, run("-s", "anova", dataFile.toString()));
        assertTrue(output.toString().contains("Unknown screen: anova"));
    }

    @Test
    void testSuccessfulRunWritesCsvAndJson() throws IOException {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(200).body(ACF_RESPONSE).build());
        Path out = tempDir.resolve("out");

        int exitCode = run("--lags", "24", "-e", "TABULAR,JSON", "-o", out.toString(), dataFile.toString());

        assertEquals(0, exitCode, output.toString());
        List<String> files = exportedFiles(out);
        assertEquals(2, files.size());
        assertTrue(files.get(0).matches("ACF_PACF_\\d{4}-\\d{2}-\\d{2}\\.csv"));
        assertTrue(files.get(1).matches("ACF_PACF_\\d{4}-\\d{2}-\\d{2}\\.json"));
        assertTrue(output.toString().contains("Analysis complete"));
    }

    @Test
    void testFailedExportIsReportedWithOwnExitCode() throws IOException {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(200).body(ACF_RESPONSE).build())
            .thenReturn(ServiceResponse.builder().statusCode(404).build());
        Path out = tempDir.resolve("out");

        int exitCode = run("-e", "TABULAR,SCRIPT", "-o", out.toString(), dataFile.toString());

        assertEquals(4, exitCode, output.toString());
        List<String> files = exportedFiles(out);
        assertEquals(1, files.size());
        assertTrue(files.get(0).endsWith(".csv"));
    }

    @Test
    void testFailedValidationMakesNoRequest() {
        assertEquals(2, run("--lags", "5", "-o", tempDir.resolve("out").toString(), dataFile.toString()));

        assertTrue(output.toString().contains("[ ] Appropriate lag count"));
        verify(httpClient, never()).execute(any(ServiceRequest.class));
    }

    @Test
    void testServiceErrorIsAnalysisFailure() {
        when(httpClient.execute(any(ServiceRequest.class)))
            .thenReturn(ServiceResponse.builder().statusCode(500).body("{\"error\":\"Internal failure\"}").build());

        assertEquals(3, run("-o", tempDir.resolve("out").toString(), dataFile.toString()));
        assertTrue(output.toString().contains("Internal failure"));
    }
}
