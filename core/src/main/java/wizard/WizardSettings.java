package wizard;

import http.HttpClientConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Адреса внешних сервисов и таймауты HTTP.
 */
public final class WizardSettings {
    public static final String DEFAULT_COMPUTE_BASE_URL = "http://localhost:8000";
    public static final String DEFAULT_DOCUMENT_BASE_URL = "http://localhost:3000";
    public static final String DEFAULT_SCRIPT_URL_TEMPLATE =
        "https://firebasestorage.googleapis.com/v0/b/restart2-98207181-3e3a5.firebasestorage.app/o/{file}?alt=media";

    private final String computeBaseUrl;
    private final String documentBaseUrl;
    private final String scriptUrlTemplate;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    private WizardSettings(Builder builder) {
        this.computeBaseUrl = stripSlash(Objects.requireNonNull(builder.computeBaseUrl, "computeBaseUrl"));
        this.documentBaseUrl = stripSlash(Objects.requireNonNull(builder.documentBaseUrl, "documentBaseUrl"));
        this.scriptUrlTemplate = Objects.requireNonNull(builder.scriptUrlTemplate, "scriptUrlTemplate");
        this.connectTimeout = Objects.requireNonNull(builder.connectTimeout, "connectTimeout");
        this.readTimeout = Objects.requireNonNull(builder.readTimeout, "readTimeout");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WizardSettings defaults() {
        return builder().build();
    }

    public String getComputeBaseUrl() {
        return computeBaseUrl;
    }

    public String getDocumentBaseUrl() {
        return documentBaseUrl;
    }

    public String getScriptUrlTemplate() {
        return scriptUrlTemplate;
    }

    /**
     * Адрес сервиса документов для экрана: {@code {documentBaseUrl}/api/export/{slug}-docx}.
     */
    public String documentUrl(String slug) {
        return documentBaseUrl + "/api/export/" + slug + "-docx";
    }

    /**
     * Адрес эталонного скрипта: шаблон с подставленным именем файла.
     */
    public String scriptUrl(String scriptFile) {
        return scriptUrlTemplate.replace("{file}", scriptFile);
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public HttpClientConfig toHttpClientConfig() {
        return HttpClientConfig.of(connectTimeout, readTimeout);
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "WizardSettings{compute=" + computeBaseUrl + ", document=" + documentBaseUrl +
            ", connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout + "}";
    }

    public static class Builder {
        private String computeBaseUrl = DEFAULT_COMPUTE_BASE_URL;
        private String documentBaseUrl = DEFAULT_DOCUMENT_BASE_URL;
        private String scriptUrlTemplate = DEFAULT_SCRIPT_URL_TEMPLATE;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(120);

        public Builder computeBaseUrl(String computeBaseUrl) {
            this.computeBaseUrl = computeBaseUrl;
            return this;
        }

        public Builder documentBaseUrl(String documentBaseUrl) {
            this.documentBaseUrl = documentBaseUrl;
            return this;
        }

        public Builder scriptUrlTemplate(String scriptUrlTemplate) {
            this.scriptUrlTemplate = scriptUrlTemplate;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public WizardSettings build() {
            return new WizardSettings(this);
        }
    }
}
