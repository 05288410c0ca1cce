package screen;

import analysis.AnalysisResult;
import analysis.ResultSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import util.ResultFormats;
import validator.ValidationGate;

import java.util.ArrayList;
import java.util.List;

/**
 * Диагностика автокорреляции остатков регрессии: Дарбин-Уотсон, Льюнг-Бокс по лагам,
 * Бройш-Годфри.
 */
public final class AutocorrelationScreen extends AbstractAnalysisScreen<RegressionConfig> {
    public static final String SLUG = "autocorrelation";

    static final int MIN_OBSERVATIONS = 20;
    static final int OBSERVATIONS_PER_PARAMETER = 10;

    public AutocorrelationScreen() {
        super(SLUG, "Autocorrelation Test", "Autocorrelation", "/api/analysis/independence-test",
            "autocorrelation_test.py", RegressionConfig.class);
    }

    @Override
    protected ValidationGate<RegressionConfig> createGate() {
        return ValidationGate.<RegressionConfig>builder()
            .check("Dependent variable selected",
                ctx -> isSelected(ctx.config().dependent()),
                ctx -> isSelected(ctx.config().dependent()) ? ctx.config().dependent() : "Not selected")
            .check("At least 1 independent variable",
                ctx -> ctx.config().predictorCount() >= 1,
                ctx -> ctx.config().predictorCount() + " selected")
            .check("Adequate sample size",
                ctx -> ctx.dataset().rowCount() >= MIN_OBSERVATIONS,
                ctx -> "n = " + ctx.dataset().rowCount() + " (recommended: 20+)")
            .check("Sufficient observations per predictor",
                ctx -> ctx.dataset().rowCount() >= (ctx.config().predictorCount() + 1) * OBSERVATIONS_PER_PARAMETER,
                ctx -> ctx.dataset().rowCount() / Math.max(1, ctx.config().predictorCount() + 1) + " obs per parameter")
            .build();
    }

    @Override
    protected ResultSchema createSchema() {
        return ResultSchema.require(
            "/metrics/durbin_watson",
            "/metrics/dw_interpretation",
            "/metrics/first_order_autocorr",
            "/metrics/n_observations",
            "/metrics/r_squared",
            "/ljung_box",
            "/model_summary/dependent",
            "/model_summary/independents");
    }

    @Override
    public boolean canRun(Dataset dataset) {
        return !dataset.isEmpty() && dataset.getNumericColumns().size() >= 2;
    }

    @Override
    public RegressionConfig defaultConfig(Dataset dataset) {
        List<String> numeric = dataset.getNumericColumns();
        if (numeric.isEmpty()) {
            return new RegressionConfig(null, List.of());
        }
        return new RegressionConfig(numeric.get(0), numeric.size() > 1 ? List.of(numeric.get(1)) : List.of());
    }

    @Override
    public ExportLayout exportLayout(AnalysisResult<RegressionConfig> result, Dataset dataset) {
        JsonNode metrics = result.at("/metrics");
        JsonNode summary = result.at("/model_summary");

        List<List<String>> ljungBox = new ArrayList<>();
        for (JsonNode lag : result.at("/ljung_box")) {
            ljungBox.add(List.of(
                ResultFormats.text(lag.get("lag")),
                ResultFormats.fixed4(lag.get("q_statistic")),
                ResultFormats.fixed4(lag.get("p_value")),
                ResultFormats.yesNo(lag.get("significant"))));
        }

        ExportLayout.Builder layout = ExportLayout.builder("AUTOCORRELATION TEST RESULTS")
            .section(null)
            .row("Dependent Variable", ResultFormats.text(summary.get("dependent")))
            .row("Independent Variables", String.join("; ", ResultFormats.textList(summary.get("independents"))))
            .row("Observations", ResultFormats.text(metrics.get("n_observations")))
            .row("R-squared", ResultFormats.fixed4(metrics.get("r_squared")))
            .section("DURBIN-WATSON TEST")
            .row("DW Statistic", ResultFormats.fixed4(metrics.get("durbin_watson")))
            .row("Conclusion", ResultFormats.text(metrics.at("/dw_interpretation/description")))
            .row("First-Order Autocorr", ResultFormats.fixed4(metrics.get("first_order_autocorr")))
            .section("LJUNG-BOX TEST")
            .table(List.of("Lag", "Q_Statistic", "P_Value", "Significant"), ljungBox);

        JsonNode plots = result.at("/plots");
        layout.plot("Residual Sequence", plots.path("residual_sequence").asText(null))
            .plot("ACF", plots.path("acf").asText(null))
            .plot("Lagged Residuals", plots.path("lagged_residual").asText(null))
            .plot("PACF", plots.path("pacf").asText(null));
        return layout.build();
    }

    @Override
    public ObjectNode documentRequest(AnalysisResult<RegressionConfig> result, Dataset dataset) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("results", result.getPayload());
        body.put("dependentVar", result.getConfig().dependent());
        body.set("independentVars", MAPPER.valueToTree(result.getConfig().independents()));
        return body;
    }
}
