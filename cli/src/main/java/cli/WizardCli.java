package cli;

import analysis.AnalysisConfig;
import analysis.HttpComputationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import http.HttpClient;
import http.StandardHttpClient;
import model.Dataset;
import model.Outcome;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import report.DirectoryDownloadSink;
import report.DownloadStager;
import report.ExportArtifact;
import report.ExportKind;
import report.ExportPipeline;
import screen.AnalysisScreen;
import screen.InstrumentalConfig;
import screen.LagConfig;
import screen.RegressionConfig;
import screen.ScreenRegistry;
import validator.ValidationCheck;
import validator.ValidationReport;
import wizard.WizardProgress;
import wizard.WizardSession;
import wizard.WizardSettings;
import wizard.WizardStep;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Точка входа CLI мастера анализа. Проводит одну сессию мастера без интерфейса:
 * загружает CSV, применяет выбор переменных, проверяет готовность, запускает анализ
 * и сохраняет выбранные экспорты в каталог.
 *
 * <p>Коды завершения:
 * <ul>
 *   <li><b>0</b> - анализ выполнен, все экспорты сохранены</li>
 *   <li><b>1</b> - неверные аргументы или не удалось прочитать данные</li>
 *   <li><b>2</b> - проверки готовности не пройдены</li>
 *   <li><b>3</b> - анализ завершился ошибкой</li>
 *   <li><b>4</b> - хотя бы один экспорт не удался</li>
 *   <li><b>99</b> - непредвиденная ошибка</li>
 * </ul>
 *
 * <p>Примеры использования:
 * <pre>
 * # ACF/PACF по колонке sales с 24 лагами, CSV и PNG в каталог out
 * analysis-wizard -s acf-pacf --value-col sales --lags 24 -e TABULAR,IMAGE -o out data.csv
 *
 * # Относительная важность предикторов через удаленный вычислительный сервис
 * analysis-wizard -s relative-importance --dependent y --independents x1,x2,x3 \
 *   --compute-url https://stats.example.com data.csv
 * </pre>
 */
@Command(
    name = "analysis-wizard",
    description = "Run a guided statistical analysis on a CSV dataset and export the results",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT"
)
public class WizardCli implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(WizardCli.class.getName());

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Path to the CSV dataset (header row required)"
    )
    private Path dataFile;

    @Option(
        names = {"-s", "--screen"},
        description = "Analysis screen: acf-pacf, ljung-box, autocorrelation, linearity, relative-importance, instrumental-variable (default: acf-pacf)",
        defaultValue = "acf-pacf"
    )
    private String screenSlug;

    @Option(names = {"--list-screens"}, description = "List available analysis screens and exit")
    private boolean listScreens;

    @Option(names = {"--value-col"}, description = "Series column for ACF/PACF and Ljung-Box")
    private String valueCol;

    @Option(names = {"--lags"}, description = "Number of lags for ACF/PACF and Ljung-Box")
    private Integer lags;

    @Option(names = {"--dependent"}, description = "Dependent variable for regression diagnostics")
    private String dependent;

    @Option(names = {"--independents"}, split = ",", description = "Independent variables (comma separated)")
    private List<String> independents;

    @Option(names = {"--outcome"}, description = "Outcome variable (Y) for instrumental variables")
    private String outcome;

    @Option(names = {"--endogenous"}, description = "Endogenous variable (X) for instrumental variables")
    private String endogenous;

    @Option(names = {"--instruments"}, split = ",", description = "Instrument variables (Z), comma separated")
    private List<String> instruments;

    @Option(names = {"--exogenous"}, split = ",", description = "Exogenous control variables, comma separated")
    private List<String> exogenous;

    @Option(
        names = {"-e", "--export"},
        split = ",",
        description = "Export formats: ${COMPLETION-CANDIDATES} (default: TABULAR)",
        defaultValue = "TABULAR"
    )
    private List<ExportKind> exports;

    @Option(
        names = {"-o", "--output-dir"},
        description = "Directory for exported files (default: current directory)",
        defaultValue = "."
    )
    private Path outputDir;

    @Option(names = {"--compute-url"}, description = "Computation service base URL (default: " + WizardSettings.DEFAULT_COMPUTE_BASE_URL + ")")
    private String computeUrl;

    @Option(names = {"--document-url"}, description = "Document rendering service base URL (default: " + WizardSettings.DEFAULT_DOCUMENT_BASE_URL + ")")
    private String documentUrl;

    @Option(names = {"--script-url-template"}, description = "Analysis script URL template, {file} is replaced by the script name")
    private String scriptUrlTemplate;

    @Option(names = {"--connect-timeout"}, description = "HTTP connect timeout in seconds (default: 30)")
    private Integer connectTimeoutSeconds;

    @Option(names = {"--read-timeout"}, description = "HTTP read timeout in seconds (default: 120)")
    private Integer readTimeoutSeconds;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final ScreenRegistry registry;
    private final HttpClient injectedHttpClient;

    public WizardCli() {
        this(ScreenRegistry.withDefaults(), null);
    }

    WizardCli(ScreenRegistry registry, HttpClient httpClient) {
        this.registry = registry;
        this.injectedHttpClient = httpClient;
    }

    @Override
    public Integer call() {
        PrintWriter out = new PrintWriter(System.out, true);
        return run(out);
    }

    int run(PrintWriter out) {
        if (listScreens) {
            registry.getAllScreens().forEach(screen ->
                out.println(String.format("  %-24s %s", screen.getSlug(), screen.getDisplayName())));
            return 0;
        }
        if (dataFile == null) {
            out.println("ERROR: Dataset file is required.");
            out.println("Usage: analysis-wizard [OPTIONS] <data.csv>");
            return 1;
        }

        AnalysisScreen<?> screen = registry.getScreen(screenSlug).orElse(null);
        if (screen == null) {
            out.println("ERROR: Unknown screen: " + screenSlug);
            out.println("Valid screens: " + String.join(", ", registry.getSlugs()));
            return 1;
        }

        Dataset dataset;
        try {
            dataset = new CsvDatasetReader().read(dataFile);
        } catch (Exception e) {
            out.println("ERROR: Failed to read dataset " + dataFile + ": " + e.getMessage());
            return 1;
        }

        WizardSettings settings = buildSettings();
        if (verbose) {
            out.println("Configuration:");
            out.println("  Screen: " + screen.getDisplayName());
            out.println("  Dataset: " + dataset.getName() + " (" + dataset.rowCount() + " rows, " +
                dataset.getNumericColumns().size() + " numeric columns)");
            out.println("  Compute service: " + settings.getComputeBaseUrl());
            out.println("  Exports: " + exports);
            out.println();
        }

        ExecutorService executor = Executors.newCachedThreadPool();
        HttpClient httpClient = injectedHttpClient != null
            ? injectedHttpClient
            : new StandardHttpClient(settings.toHttpClientConfig());
        try {
            return runSession(screen, dataset, settings, httpClient, executor, out);
        } catch (Exception e) {
            out.println("ERROR: Unexpected error occurred: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(out);
            }
            return 99;
        } finally {
            executor.shutdownNow();
            if (injectedHttpClient == null) {
                httpClient.close();
            }
        }
    }

    private <C extends AnalysisConfig> int runSession(AnalysisScreen<C> screen, Dataset dataset,
                                                      WizardSettings settings, HttpClient httpClient,
                                                      ExecutorService executor, PrintWriter out) {
        ObjectMapper objectMapper = new ObjectMapper();
        WizardSession<C> session = new WizardSession<>(screen,
            new HttpComputationClient(httpClient, objectMapper, settings.getComputeBaseUrl()), executor, dataset);
        session.addListener(new ConsoleWizardListener(out, verbose));

        if (session.isIntroOnly()) {
            out.println("ERROR: Dataset does not have enough data or columns for " + screen.getDisplayName());
            return 1;
        }

        session.updateConfig(applyOverrides(screen, session.getConfig()));
        out.println("Variables: " + session.getConfig().selectedVariables());
        Map<String, Integer> bounds = session.getDerivedBounds();
        if (!bounds.isEmpty()) {
            out.println("Settings: " + session.getConfig().requestFields() + " " + bounds);
        }

        ValidationReport report = session.getValidationReport();
        out.println("Validation:");
        for (ValidationCheck check : report.checks()) {
            out.println("  [" + (check.passed() ? "x" : " ") + "] " + check.label() + " - " + check.detail());
        }
        if (!report.allPassed()) {
            out.println("ERROR: " + report.failedChecks().size() + " validation check(s) failed");
            return 2;
        }

        // Variables -> Settings -> Validation; "next" on the validation step runs the analysis.
        session.next().join();
        WizardProgress progress = session.next().join();
        if (progress.current() != WizardStep.VALIDATION) {
            logger.warning("Unexpected wizard step before analysis: " + progress.current());
        }
        progress = session.next().join();
        if (progress.current() != WizardStep.SUMMARY) {
            out.println("ERROR: Analysis did not complete");
            return 3;
        }
        out.println("Analysis complete");

        ExportPipeline pipeline = new ExportPipeline(settings, httpClient, objectMapper, executor, new DownloadStager());
        DirectoryDownloadSink sink = new DirectoryDownloadSink(outputDir);
        boolean allExported = true;
        for (ExportKind kind : exports) {
            Outcome<ExportArtifact> exported = pipeline.export(kind, session, sink).join();
            allExported &= exported.isSuccess();
        }
        if (verbose) {
            sink.getDelivered().forEach(path -> out.println("  Written: " + path));
        }
        return allExported ? 0 : 4;
    }

    private <C extends AnalysisConfig> C applyOverrides(AnalysisScreen<C> screen, C defaults) {
        Object config = defaults;
        if (defaults instanceof LagConfig lagConfig) {
            config = new LagConfig(
                valueCol != null ? valueCol : lagConfig.valueCol(),
                lags != null ? lags : lagConfig.lags());
        } else if (defaults instanceof RegressionConfig regression) {
            config = new RegressionConfig(
                dependent != null ? dependent : regression.dependent(),
                independents != null ? independents : regression.independents());
        } else if (defaults instanceof InstrumentalConfig iv) {
            config = new InstrumentalConfig(
                outcome != null ? outcome : iv.outcome(),
                endogenous != null ? endogenous : iv.endogenous(),
                instruments != null ? instruments : iv.instruments(),
                exogenous != null ? exogenous : iv.exogenous());
        }
        return screen.getConfigType().cast(config);
    }

    private WizardSettings buildSettings() {
        WizardSettings.Builder builder = WizardSettings.builder();
        if (computeUrl != null) {
            builder.computeBaseUrl(computeUrl);
        }
        if (documentUrl != null) {
            builder.documentBaseUrl(documentUrl);
        }
        if (scriptUrlTemplate != null) {
            builder.scriptUrlTemplate(scriptUrlTemplate);
        }
        if (connectTimeoutSeconds != null && connectTimeoutSeconds > 0) {
            builder.connectTimeout(Duration.ofSeconds(connectTimeoutSeconds));
        }
        if (readTimeoutSeconds != null && readTimeoutSeconds > 0) {
            builder.readTimeout(Duration.ofSeconds(readTimeoutSeconds));
        }
        return builder.build();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WizardCli()).execute(args);
        System.exit(exitCode);
    }
}
