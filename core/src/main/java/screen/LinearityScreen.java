package screen;

import analysis.AnalysisResult;
import analysis.ResultSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import util.ResultFormats;
import validator.ValidationGate;

import java.util.List;

/**
 * Проверка линейности связи: корреляция остатков с прогнозом, тест серий,
 * тест кривизны и Rainbow-тест.
 */
public final class LinearityScreen extends AbstractAnalysisScreen<RegressionConfig> {
    public static final String SLUG = "linearity";

    static final int MIN_OBSERVATIONS = 20;
    static final int OBSERVATIONS_PER_PREDICTOR = 10;

    public LinearityScreen() {
        super(SLUG, "Linearity Check", "Linearity", "/api/analysis/linearity-test",
            "linearity_test.py", RegressionConfig.class);
    }

    @Override
    protected ValidationGate<RegressionConfig> createGate() {
        return ValidationGate.<RegressionConfig>builder()
            .check("Dependent variable selected",
                ctx -> isSelected(ctx.config().dependent()),
                ctx -> isSelected(ctx.config().dependent()) ? ctx.config().dependent() : "Not selected")
            .check("Independent variable(s) selected",
                ctx -> ctx.config().predictorCount() > 0,
                ctx -> ctx.config().predictorCount() + " variable(s)")
            .check("Adequate sample size",
                ctx -> ctx.dataset().rowCount() >= MIN_OBSERVATIONS,
                ctx -> "n = " + ctx.dataset().rowCount() + " (recommended: 20+)")
            .check("Minimum observations per predictor",
                ctx -> ctx.dataset().rowCount() >= (ctx.config().predictorCount() + 1) * OBSERVATIONS_PER_PREDICTOR,
                ctx -> ctx.dataset().rowCount() / Math.max(ctx.config().predictorCount() + 1, 1) + " per predictor")
            .build();
    }

    @Override
    protected ResultSchema createSchema() {
        return ResultSchema.require(
            "/metrics/residual_fitted_corr",
            "/metrics/residual_fitted_corr_pvalue",
            "/metrics/runs_z_statistic",
            "/metrics/runs_p_value",
            "/metrics/curvature_f_statistic",
            "/metrics/curvature_p_value",
            "/metrics/rainbow_f_statistic",
            "/metrics/rainbow_p_value",
            "/metrics/r_squared",
            "/metrics/n_observations",
            "/model_summary/dependent",
            "/model_summary/independents");
    }

    @Override
    public boolean canRun(Dataset dataset) {
        return !dataset.isEmpty() && dataset.getNumericColumns().size() >= 2;
    }

    /**
     * Переменные не выбираются автоматически: пользователь выбирает их на первом шаге.
     */
    @Override
    public RegressionConfig defaultConfig(Dataset dataset) {
        return new RegressionConfig(null, List.of());
    }

    @Override
    public ExportLayout exportLayout(AnalysisResult<RegressionConfig> result, Dataset dataset) {
        JsonNode metrics = result.at("/metrics");
        JsonNode summary = result.at("/model_summary");
        JsonNode plots = result.at("/plots");

        return ExportLayout.builder("LINEARITY CHECK SUMMARY")
            .section(null)
            .row("Dependent", ResultFormats.text(summary.get("dependent")))
            .row("Independents", String.join("; ", ResultFormats.textList(summary.get("independents"))))
            .row("R-squared", ResultFormats.fixed4(metrics.get("r_squared")))
            .row("n", ResultFormats.text(metrics.get("n_observations")))
            .section("DIAGNOSTIC TESTS")
            .table(List.of("Test", "Statistic", "PValue"), List.of(
                List.of("Residual-Fitted Corr",
                    ResultFormats.fixed4(metrics.get("residual_fitted_corr")),
                    ResultFormats.pValue(metrics.get("residual_fitted_corr_pvalue"))),
                List.of("Runs Test",
                    ResultFormats.fixed4(metrics.get("runs_z_statistic")),
                    ResultFormats.pValue(metrics.get("runs_p_value"))),
                List.of("Curvature Test",
                    ResultFormats.fixed4(metrics.get("curvature_f_statistic")),
                    ResultFormats.pValue(metrics.get("curvature_p_value"))),
                List.of("Rainbow Test",
                    ResultFormats.fixed4(metrics.get("rainbow_f_statistic")),
                    ResultFormats.pValue(metrics.get("rainbow_p_value")))))
            .plot("Residuals vs Fitted", plots.path("residual_vs_fitted").asText(null))
            .plot("Scale-Location", plots.path("scale_location").asText(null))
            .plot("Residual Histogram", plots.path("residual_histogram").asText(null))
            .build();
    }

    @Override
    public ObjectNode documentRequest(AnalysisResult<RegressionConfig> result, Dataset dataset) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("result", result.getPayload());
        body.put("dependentVar", result.getConfig().dependent());
        body.set("independentVars", MAPPER.valueToTree(result.getConfig().independents()));
        return body;
    }
}
