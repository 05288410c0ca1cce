package http;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Таймауты и заголовки клиента внешних сервисов.
 *
 * @param connectTimeout таймаут установки соединения
 * @param readTimeout    таймаут чтения ответа; вычисления и рендеринг документов бывают долгими
 * @param userAgent      значение заголовка User-Agent
 */
public record HttpClientConfig(Duration connectTimeout, Duration readTimeout, String userAgent) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(120);
    public static final String DEFAULT_USER_AGENT = "analysis-wizard/1.0";

    public HttpClientConfig {
        Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
        Objects.requireNonNull(readTimeout, "readTimeout cannot be null");
        if (connectTimeout.isNegative() || readTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must not be negative");
        }
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static HttpClientConfig defaults() {
        return of(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    public static HttpClientConfig of(Duration connectTimeout, Duration readTimeout) {
        return new HttpClientConfig(connectTimeout, readTimeout, DEFAULT_USER_AGENT);
    }

    /**
     * Заголовки, которые клиент добавляет к каждому запросу; заголовки запроса их переопределяют.
     */
    public Map<String, String> defaultHeaders() {
        return Map.of("User-Agent", userAgent, "Accept", "application/json, */*");
    }
}
