package screen;

import analysis.AnalysisResult;
import analysis.ResultSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Dataset;
import util.ResultFormats;
import validator.ValidationGate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Относительная важность предикторов (относительные веса, стандартизованные бета, semi-partial R²).
 */
public final class RelativeImportanceScreen extends AbstractAnalysisScreen<RegressionConfig> {
    public static final String SLUG = "relative-importance";

    static final int MIN_OBSERVATIONS = 30;
    static final int MIN_PREDICTORS = 2;
    static final int OBSERVATIONS_PER_PREDICTOR = 10;

    public RelativeImportanceScreen() {
        super(SLUG, "Relative Importance Analysis", "Relative_Importance_Results",
            "/api/analysis/relative-importance", "relative_importance.py", RegressionConfig.class);
    }

    @Override
    protected ValidationGate<RegressionConfig> createGate() {
        return ValidationGate.<RegressionConfig>builder()
            .check("Dependent variable selected",
                ctx -> isSelected(ctx.config().dependent()),
                ctx -> isSelected(ctx.config().dependent())
                    ? "Y: " + ctx.config().dependent()
                    : "Please select a dependent variable")
            .check("At least 2 predictors selected",
                ctx -> ctx.config().predictorCount() >= MIN_PREDICTORS,
                ctx -> ctx.config().predictorCount() >= MIN_PREDICTORS
                    ? ctx.config().predictorCount() + " predictors selected"
                    : "Need at least 2 predictors for relative importance")
            .check("Sufficient sample size",
                ctx -> ctx.dataset().rowCount() >= MIN_OBSERVATIONS,
                ctx -> "n = " + ctx.dataset().rowCount() + " observations (minimum: 30)")
            .check("Observations per predictor",
                ctx -> observationsPerPredictor(ctx.config(), ctx.dataset()) >= OBSERVATIONS_PER_PREDICTOR,
                ctx -> observationsPerPredictor(ctx.config(), ctx.dataset()) + " observations per predictor (recommended: 10+)")
            .build();
    }

    private static int observationsPerPredictor(RegressionConfig config, Dataset dataset) {
        return config.predictorCount() == 0 ? 0 : dataset.rowCount() / config.predictorCount();
    }

    @Override
    protected ResultSchema createSchema() {
        return ResultSchema.require("/results");
    }

    @Override
    public boolean canRun(Dataset dataset) {
        return !dataset.isEmpty() && dataset.getNumericColumns().size() >= 3;
    }

    /**
     * Зависимая переменная по умолчанию - последняя числовая колонка, предикторы - остальные.
     */
    @Override
    public RegressionConfig defaultConfig(Dataset dataset) {
        List<String> numeric = dataset.getNumericColumns();
        if (numeric.isEmpty()) {
            return new RegressionConfig(null, List.of());
        }
        String target = numeric.get(numeric.size() - 1);
        return new RegressionConfig(target,
            numeric.stream().filter(column -> !column.equals(target)).collect(Collectors.toList()));
    }

    @Override
    protected Map<String, Object> requestFields(RegressionConfig config) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("dependent_var", config.dependent());
        fields.put("independent_vars", config.independents());
        return fields;
    }

    @Override
    public ExportLayout exportLayout(AnalysisResult<RegressionConfig> result, Dataset dataset) {
        JsonNode results = result.at("/results");
        double totalVariance = 0;
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode row : results) {
            totalVariance += row.path("relative_weight_pct").asDouble(0);
            rows.add(List.of(
                ResultFormats.text(row.get("predictor")),
                ResultFormats.text(row.get("rank")),
                ResultFormats.text(row.get("relative_weight_pct")),
                ResultFormats.text(row.get("standardized_beta"))));
        }
        return ExportLayout.builder("RELATIVE IMPORTANCE ANALYSIS")
            .section(null)
            .row("Dependent", result.getConfig().dependent())
            .row("Total R²", String.format(Locale.ROOT, "%.1f%%", totalVariance))
            .section(null)
            .table(List.of("Predictor", "Rank", "Relative_Weight", "Std_Beta"), rows)
            .build();
    }

    @Override
    public ObjectNode documentRequest(AnalysisResult<RegressionConfig> result, Dataset dataset) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("results", result.at("/results"));
        body.put("dependentVar", result.getConfig().dependent());
        body.set("independentVars", MAPPER.valueToTree(result.getConfig().independents()));
        body.put("sampleSize", dataset.rowCount());
        return body;
    }
}
