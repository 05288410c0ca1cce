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
 * Тест Льюнга-Бокса на отсутствие автокорреляции (белый шум).
 */
public final class LjungBoxScreen extends AbstractAnalysisScreen<LagConfig> {
    public static final String SLUG = "ljung-box";
    public static final String MAX_LAGS = "maxLags";

    static final int MIN_OBSERVATIONS = 30;
    static final int DEFAULT_LAGS = 10;

    public LjungBoxScreen() {
        super(SLUG, "Ljung-Box Test", "LjungBox_Results", "/api/analysis/ljung-box",
            "ljung_box_test.py", LagConfig.class);
    }

    @Override
    protected ValidationGate<LagConfig> createGate() {
        return ValidationGate.<LagConfig>builder()
            .bound(MAX_LAGS, (config, data) -> data.rowCount() - 1)
            .check("Variable selected",
                ctx -> isSelected(ctx.config().valueCol()),
                ctx -> isSelected(ctx.config().valueCol()) ? ctx.config().valueCol() : "Not selected")
            .check("Valid number of lags",
                ctx -> ctx.config().lags() >= 1,
                ctx -> ctx.config().lags() + " lag(s)")
            .check("Adequate sample size",
                ctx -> ctx.dataset().rowCount() >= MIN_OBSERVATIONS,
                ctx -> "n = " + ctx.dataset().rowCount() + " (recommended: 30+)")
            .check("Lags less than sample size",
                ctx -> ctx.config().lags() < ctx.dataset().rowCount(),
                ctx -> ctx.config().lags() + " < " + ctx.dataset().rowCount())
            .build();
    }

    @Override
    protected ResultSchema createSchema() {
        return ResultSchema.require(
            "/results/lb_statistic",
            "/results/p_value",
            "/results/lags",
            "/results/is_significant");
    }

    @Override
    public boolean canRun(Dataset dataset) {
        return !dataset.isEmpty() && !dataset.getNumericColumns().isEmpty();
    }

    @Override
    public LagConfig defaultConfig(Dataset dataset) {
        List<String> numeric = dataset.getNumericColumns();
        return new LagConfig(numeric.isEmpty() ? null : numeric.get(0), DEFAULT_LAGS);
    }

    @Override
    protected JsonNode requestData(LagConfig config, Dataset dataset) {
        return MAPPER.valueToTree(dataset.numericValues(config.valueCol()));
    }

    @Override
    public ExportLayout exportLayout(AnalysisResult<LagConfig> result, Dataset dataset) {
        JsonNode results = result.at("/results");
        return ExportLayout.builder("LJUNG-BOX TEST RESULTS")
            .section(null)
            .row("Variable", result.getConfig().valueCol())
            .row("Lags", result.getConfig().lags())
            .table(List.of("LB Statistic", "P-Value", "Lags", "Significant"),
                List.of(List.of(
                    ResultFormats.fixed4(results.get("lb_statistic")),
                    ResultFormats.fixed4(results.get("p_value")),
                    ResultFormats.text(results.get("lags")),
                    ResultFormats.yesNo(results.get("is_significant")))))
            .plot("Ljung-Box", result.at("/plot").asText(null))
            .build();
    }

    @Override
    public ObjectNode documentRequest(AnalysisResult<LagConfig> result, Dataset dataset) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("results", result.at("/results"));
        body.put("valueCol", result.getConfig().valueCol());
        body.put("lags", result.getConfig().lags());
        body.put("sampleSize", dataset.rowCount());
        return body;
    }
}
