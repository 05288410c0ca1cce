package report;

import analysis.AnalysisError;
import model.Outcome;
import org.junit.jupiter.api.Test;
import screen.ExportLayout;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class ResultsPageRendererTest {

    private ExportLayout layoutWithPlot(String plot) {
        return ExportLayout.builder("ACF/PACF Analysis Results")
            .section("Configuration")
            .row("Variable", "sales")
            .row("Lags", 20)
            .plot("ACF/PACF", plot)
            .build();
    }

    @Test
    void testLayoutWithoutPlotsRendersPng() throws RenderException {
        byte[] png = new ResultsPageRenderer().renderPng(layoutWithPlot(null));

        assertTrue(ExportFixtures.isPng(png));
    }

    @Test
    void testEmbeddedPngPlotIsRendered() throws RenderException {
        byte[] png = new ResultsPageRenderer().renderPng(layoutWithPlot(ExportFixtures.pngBase64(200, 120)));

        assertTrue(ExportFixtures.isPng(png));
    }

    @Test
    void testDataUrlPrefixIsAccepted() throws RenderException {
        String plot = "data:image/png;base64," + ExportFixtures.pngBase64(40, 40);

        assertEquals(40, ResultsPageRenderer.decodePlot("plot", plot).getWidth());
    }

    @Test
    void testRemotePlotCannotBeRendered() {
        RenderException e = assertThrows(RenderException.class,
            () -> new ResultsPageRenderer().renderPng(layoutWithPlot("https://example.com/plot.png")));

        assertTrue(e.getMessage().contains("remote"));
    }

    @Test
    void testUndecodablePlotFails() {
        String garbage = Base64.getEncoder().encodeToString("definitely not an image".getBytes());

        assertThrows(RenderException.class, () -> ResultsPageRenderer.decodePlot("plot", garbage));
        assertThrows(RenderException.class, () -> ResultsPageRenderer.decodePlot("plot", "%%%not-base64%%%"));
    }

    @Test
    void testImageExporterReportsRenderError() {
        ImageExporter exporter = new ImageExporter(Runnable::run);

        Outcome<byte[]> outcome = exporter.render(layoutWithPlot("http://example.com/plot.png"));

        assertTrue(outcome.isFailure());
        assertEquals(AnalysisError.Kind.RENDER, outcome.getError().getKind());
        assertEquals("Download failed", outcome.getError().getTitle());
    }
}
