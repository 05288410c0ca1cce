package webui.config;

import analysis.ComputationClient;
import analysis.HttpComputationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import http.HttpClient;
import http.StandardHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import report.DownloadStager;
import report.ExportPipeline;
import screen.ScreenRegistry;
import wizard.WizardSettings;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Бины ядра мастера: настройки внешних сервисов, HTTP-клиент, реестр экранов и конвейер экспорта.
 *
 * <p>Адреса и таймауты задаются свойствами {@code wizard.*} в application.properties.
 */
@Configuration
public class WizardConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(WizardConfiguration.class);

    @Bean
    public WizardSettings wizardSettings(
            @Value("${wizard.compute-base-url:" + WizardSettings.DEFAULT_COMPUTE_BASE_URL + "}") String computeBaseUrl,
            @Value("${wizard.document-base-url:" + WizardSettings.DEFAULT_DOCUMENT_BASE_URL + "}") String documentBaseUrl,
            @Value("${wizard.script-url-template:" + WizardSettings.DEFAULT_SCRIPT_URL_TEMPLATE + "}") String scriptUrlTemplate,
            @Value("${wizard.connect-timeout-seconds:30}") long connectTimeoutSeconds,
            @Value("${wizard.read-timeout-seconds:120}") long readTimeoutSeconds) {
        WizardSettings settings = WizardSettings.builder()
            .computeBaseUrl(computeBaseUrl)
            .documentBaseUrl(documentBaseUrl)
            .scriptUrlTemplate(scriptUrlTemplate)
            .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
            .readTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .build();
        logger.info("Wizard settings: {}", settings);
        return settings;
    }

    @Bean(destroyMethod = "close")
    public HttpClient wizardHttpClient(WizardSettings settings) {
        return new StandardHttpClient(settings.toHttpClientConfig());
    }

    @Bean
    public ComputationClient computationClient(HttpClient wizardHttpClient, ObjectMapper objectMapper,
                                               WizardSettings settings) {
        return new HttpComputationClient(wizardHttpClient, objectMapper, settings.getComputeBaseUrl());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService wizardExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public ScreenRegistry screenRegistry() {
        return ScreenRegistry.withDefaults();
    }

    @Bean
    public ExportPipeline exportPipeline(WizardSettings settings, HttpClient wizardHttpClient,
                                         ObjectMapper objectMapper, ExecutorService wizardExecutor) {
        return new ExportPipeline(settings, wizardHttpClient, objectMapper, wizardExecutor, new DownloadStager());
    }
}
