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
 * Автокорреляционная (ACF) и частная автокорреляционная (PACF) функции одного ряда.
 *
 * <p>Максимальное число лагов - {@code floor(n/2) - 1}; рекомендуемый диапазон - от 10 до максимума.
 */
public final class AcfPacfScreen extends AbstractAnalysisScreen<LagConfig> {
    public static final String SLUG = "acf-pacf";
    public static final String MAX_LAGS = "maxLags";
    public static final String MIN_LAGS = "minLags";

    static final int MIN_OBSERVATIONS = 50;
    static final int RECOMMENDED_MIN_LAGS = 10;
    static final int DEFAULT_LAGS_CAP = 40;

    public AcfPacfScreen() {
        super(SLUG, "ACF/PACF Analysis", "ACF_PACF", "/api/analysis/acf-pacf",
            "acf_pacf_analysis.py", LagConfig.class);
    }

    public static int maxLags(Dataset dataset) {
        return dataset.rowCount() / 2 - 1;
    }

    @Override
    protected ValidationGate<LagConfig> createGate() {
        return ValidationGate.<LagConfig>builder()
            .bound(MAX_LAGS, (config, data) -> maxLags(data))
            .bound(MIN_LAGS, (config, data) -> RECOMMENDED_MIN_LAGS)
            .check("Value column selected",
                ctx -> isSelected(ctx.config().valueCol()),
                ctx -> isSelected(ctx.config().valueCol())
                    ? "Selected: " + ctx.config().valueCol()
                    : "Please select a variable to analyze")
            .check("Sufficient data",
                ctx -> ctx.dataset().rowCount() >= MIN_OBSERVATIONS,
                ctx -> ctx.dataset().rowCount() + " observations (50+ recommended)")
            .check("Appropriate lag count",
                ctx -> ctx.config().lags() >= ctx.bound(MIN_LAGS) && ctx.config().lags() <= ctx.bound(MAX_LAGS),
                ctx -> ctx.config().lags() + " lags (recommended: " + ctx.bound(MIN_LAGS) + "~" + ctx.bound(MAX_LAGS) + ")")
            .check("Lags < half of data",
                ctx -> ctx.config().lags() < ctx.dataset().rowCount() / 2.0,
                ctx -> ctx.config().lags() < ctx.dataset().rowCount() / 2.0
                    ? "Condition met"
                    : "Lags too large (max " + ctx.bound(MAX_LAGS) + ")")
            .build();
    }

    @Override
    protected ResultSchema createSchema() {
        return ResultSchema.require(
            "/results/acf",
            "/results/pacf",
            "/results/lags",
            "/results/significant_acf_lags",
            "/results/significant_pacf_lags",
            "/results/ar_order_suggestion",
            "/results/ma_order_suggestion");
    }

    @Override
    public boolean canRun(Dataset dataset) {
        return !dataset.isEmpty() && !dataset.getNumericColumns().isEmpty();
    }

    @Override
    public LagConfig defaultConfig(Dataset dataset) {
        List<String> numeric = dataset.getNumericColumns();
        String valueCol = numeric.stream()
            .filter(column -> !nameContains(column, "date"))
            .findFirst()
            .orElse(numeric.isEmpty() ? null : numeric.get(0));
        int lags = Math.min(DEFAULT_LAGS_CAP, Math.max(RECOMMENDED_MIN_LAGS, maxLags(dataset)));
        return new LagConfig(valueCol, lags);
    }

    @Override
    protected JsonNode requestData(LagConfig config, Dataset dataset) {
        return MAPPER.valueToTree(dataset.numericValues(config.valueCol()));
    }

    @Override
    public ExportLayout exportLayout(AnalysisResult<LagConfig> result, Dataset dataset) {
        JsonNode results = result.at("/results");
        return ExportLayout.builder("ACF/PACF Analysis Results")
            .section("Configuration")
            .row("Variable", result.getConfig().valueCol())
            .row("Lags", result.getConfig().lags())
            .row("Observations", dataset.rowCount())
            .section("Results")
            .row("AR Order (p)", ResultFormats.text(results.get("ar_order_suggestion")))
            .row("MA Order (q)", ResultFormats.text(results.get("ma_order_suggestion")))
            .row("Significant ACF Lags", ResultFormats.size(results.get("significant_acf_lags")))
            .row("Significant PACF Lags", ResultFormats.size(results.get("significant_pacf_lags")))
            .row("Model Recommendation", modelRecommendation(results))
            .plot("ACF/PACF", result.at("/plot").asText(null))
            .build();
    }

    /**
     * Рекомендация сервиса; если ее нет, ARIMA с предложенными порядками p и q.
     */
    static String modelRecommendation(JsonNode results) {
        JsonNode recommendation = results.get("model_recommendation");
        if (recommendation != null && recommendation.isTextual() && !recommendation.asText().isBlank()) {
            return recommendation.asText();
        }
        return "ARIMA(" + ResultFormats.text(results.get("ar_order_suggestion")) + ",d,"
            + ResultFormats.text(results.get("ma_order_suggestion")) + ")";
    }

    @Override
    public ObjectNode documentRequest(AnalysisResult<LagConfig> result, Dataset dataset) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("analysisResult", result.getPayload());
        body.set("plot", result.at("/plot"));
        body.put("valueCol", result.getConfig().valueCol());
        body.put("lags", result.getConfig().lags());
        body.put("sampleSize", dataset.rowCount());
        return body;
    }
}
