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
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Инструментальные переменные (2SLS): сравнение оценок МНК и 2SLS, первый шаг, сила инструментов.
 */
public final class InstrumentalVariableScreen extends AbstractAnalysisScreen<InstrumentalConfig> {
    public static final String SLUG = "instrumental-variable";

    static final int MIN_OBSERVATIONS = 30;

    private static final List<String> COEFFICIENT_COLUMNS =
        List.of("instrument", "coefficient", "std_error", "t_value", "p_value", "significant");

    public InstrumentalVariableScreen() {
        super(SLUG, "Instrumental Variable Analysis", "IV", "/api/analysis/instrumental-variable",
            "instrumental_variable.py", InstrumentalConfig.class);
    }

    @Override
    protected ValidationGate<InstrumentalConfig> createGate() {
        return ValidationGate.<InstrumentalConfig>builder()
            .check("Outcome variable (Y)",
                ctx -> isSelected(ctx.config().outcome()),
                ctx -> isSelected(ctx.config().outcome()) ? ctx.config().outcome() : "Select outcome")
            .check("Endogenous variable (X)",
                ctx -> isSelected(ctx.config().endogenous()),
                ctx -> isSelected(ctx.config().endogenous()) ? ctx.config().endogenous() : "Select endogenous")
            .check("Instrument(s) (Z)",
                ctx -> !ctx.config().instruments().isEmpty(),
                ctx -> ctx.config().instruments().size() + " selected")
            .check("Sample size",
                ctx -> ctx.dataset().rowCount() >= MIN_OBSERVATIONS,
                ctx -> "n = " + ctx.dataset().rowCount())
            .build();
    }

    @Override
    protected ResultSchema createSchema() {
        return ResultSchema.require(
            "/ols_result/endogenous_effect",
            "/ols_result/endogenous_pvalue",
            "/iv_result/endogenous_effect",
            "/iv_result/endogenous_se",
            "/iv_result/endogenous_pvalue",
            "/iv_result/endogenous_ci",
            "/first_stage/instrument_coefficients",
            "/first_stage/f_statistic",
            "/first_stage/weak_instrument");
    }

    @Override
    public boolean canRun(Dataset dataset) {
        return dataset.rowCount() >= MIN_OBSERVATIONS && dataset.columnCount() >= 3;
    }

    /**
     * Роли переменных угадываются по именам колонок (outcome/wage, educ/treatment, instrument/distance).
     */
    @Override
    public InstrumentalConfig defaultConfig(Dataset dataset) {
        List<String> numeric = dataset.getNumericColumns();
        String outcome = firstMatching(numeric, column -> nameContains(column, "outcome")
            || column.equalsIgnoreCase("y") || nameContains(column, "wage") || nameContains(column, "earn"))
            .orElse(null);
        String endogenous = firstMatching(numeric, column -> nameContains(column, "educ")
            || column.equalsIgnoreCase("x") || nameContains(column, "treatment"))
            .orElse(null);
        List<String> instruments = numeric.stream()
            .filter(column -> nameContains(column, "instrument") || column.equalsIgnoreCase("z")
                || nameContains(column, "distance"))
            .limit(2)
            .collect(Collectors.toList());
        return new InstrumentalConfig(outcome, endogenous, instruments, List.of());
    }

    private static Optional<String> firstMatching(List<String> columns, Predicate<String> predicate) {
        return columns.stream().filter(predicate).findFirst();
    }

    @Override
    public ExportLayout exportLayout(AnalysisResult<InstrumentalConfig> result, Dataset dataset) {
        JsonNode ols = result.at("/ols_result");
        JsonNode iv = result.at("/iv_result");
        JsonNode firstStage = result.at("/first_stage");

        List<List<String>> coefficients = new ArrayList<>();
        for (JsonNode coefficient : firstStage.path("instrument_coefficients")) {
            List<String> row = new ArrayList<>();
            for (String column : COEFFICIENT_COLUMNS) {
                row.add(ResultFormats.text(coefficient.get(column)));
            }
            coefficients.add(row);
        }

        JsonNode ci = iv.path("endogenous_ci");
        String interval = "[" + ResultFormats.fixed(ci.get(0), 3) + ", " + ResultFormats.fixed(ci.get(1), 3) + "]";

        return ExportLayout.builder("INSTRUMENTAL VARIABLE ANALYSIS REPORT")
            .section(null)
            .row("Generated", result.getCompletedAt())
            .section("OLS ESTIMATE")
            .row("Effect", ResultFormats.fixed4(ols.get("endogenous_effect")))
            .row("p-value", ResultFormats.fixed4(ols.get("endogenous_pvalue")))
            .section("IV (2SLS) ESTIMATE")
            .row("Effect", ResultFormats.fixed4(iv.get("endogenous_effect")))
            .row("SE", ResultFormats.fixed4(iv.get("endogenous_se")))
            .row("p-value", ResultFormats.fixed4(iv.get("endogenous_pvalue")))
            .row("95% CI", interval)
            .section("FIRST STAGE")
            .row("F-statistic", ResultFormats.fixed(firstStage.get("f_statistic"), 2))
            .row("Weak Instrument", ResultFormats.text(firstStage.get("weak_instrument")))
            .section("INSTRUMENT COEFFICIENTS")
            .table(COEFFICIENT_COLUMNS, coefficients)
            .plot("OLS vs IV", result.at("/comparison_plot").asText(null))
            .plot("First Stage", result.at("/first_stage_plot").asText(null))
            .plot("Instrument Strength", result.at("/strength_plot").asText(null))
            .plot("Residuals", result.at("/residual_plot").asText(null))
            .build();
    }

    @Override
    public ObjectNode documentRequest(AnalysisResult<InstrumentalConfig> result, Dataset dataset) {
        InstrumentalConfig config = result.getConfig();
        ObjectNode body = MAPPER.createObjectNode();
        body.set("results", result.getPayload());
        body.put("outcomeVar", config.outcome());
        body.put("endogenousVar", config.endogenous());
        body.set("instrumentVars", MAPPER.valueToTree(config.instruments()));
        body.set("exogenousVars", MAPPER.valueToTree(config.exogenous()));
        body.put("sampleSize", dataset.rowCount());
        return body;
    }
}
