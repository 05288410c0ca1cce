package report;

import analysis.AnalysisResult;
import analysis.ComputationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import model.Outcome;
import screen.AcfPacfScreen;
import screen.LagConfig;
import wizard.WizardSession;
import wizard.WizardStep;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Общие данные для тестов экспорта.
 */
final class ExportFixtures {
    static final ObjectMapper MAPPER = new ObjectMapper();
    static final Instant EXPORTED_AT = Instant.parse("2024-03-15T10:30:00Z");

    private ExportFixtures() {
    }

    static Dataset series(int n) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("sales", 100.0 + (i % 7));
            rows.add(row);
        }
        return new Dataset("sales.csv", List.of("sales"), rows);
    }

    static ObjectNode acfPayload(String plot) {
        ObjectNode results = MAPPER.createObjectNode();
        results.putArray("acf").add(1.0).add(0.42);
        results.putArray("pacf").add(1.0).add(0.40);
        results.putArray("lags").add(0).add(1);
        results.putArray("significant_acf_lags").add(1);
        results.putArray("significant_pacf_lags").add(1);
        results.put("ar_order_suggestion", 1);
        results.put("ma_order_suggestion", 0);
        results.put("model_recommendation", "AR(1), consider ARMA");
        ObjectNode payload = MAPPER.createObjectNode();
        payload.set("results", results);
        if (plot != null) {
            payload.put("plot", plot);
        }
        return payload;
    }

    static AnalysisResult<LagConfig> acfResult(String plot) {
        return new AnalysisResult<>(new LagConfig("sales", 20), acfPayload(plot), EXPORTED_AT);
    }

    static ExportJob<LagConfig> job(ExportKind kind, String plot) {
        return new ExportJob<>(kind, acfResult(plot), EXPORTED_AT);
    }

    /**
     * Сессия ACF/PACF, прошедшая анализ и стоящая на шаге сводки.
     */
    static WizardSession<LagConfig> sessionWithResult(ComputationClient client) {
        WizardSession<LagConfig> session = new WizardSession<>(new AcfPacfScreen(), client, Runnable::run, series(120));
        session.next().join();
        session.next().join();
        if (session.next().join().current() != WizardStep.SUMMARY) {
            throw new IllegalStateException("analysis did not complete");
        }
        return session;
    }

    static ComputationClient succeedingClient() {
        return (endpoint, body) -> Outcome.success(acfPayload(""));
    }

    static String pngBase64(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(Color.WHITE);
        graphics.fillRect(0, 0, width, height);
        graphics.setColor(Color.BLUE);
        graphics.fillRect(10, 10, width / 2, height / 2);
        graphics.dispose();
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static boolean isPng(byte[] bytes) {
        return bytes.length > 8
            && (bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G';
    }
}
