package http;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * HTTP-запрос к внешнему сервису (вычисления, рендеринг документов, скрипты).
 */
public final class ServiceRequest {
    private final String url;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final String bodyContentType;
    private final int timeoutMs;

    private ServiceRequest(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url cannot be null");
        this.method = Objects.requireNonNull(builder.method, "method cannot be null").toUpperCase();
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        this.body = builder.body;
        this.bodyContentType = builder.bodyContentType;
        this.timeoutMs = Math.max(builder.timeoutMs, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServiceRequest postJson(String url, String json) {
        return builder()
            .url(url)
            .method("POST")
            .body(json)
            .bodyContentType("application/json")
            .build();
    }

    public static ServiceRequest get(String url) {
        return builder().url(url).method("GET").build();
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public String getBodyContentType() {
        return bodyContentType;
    }

    /**
     * @return таймаут запроса в миллисекундах; 0 означает таймауты из {@link HttpClientConfig}
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String toString() {
        return "ServiceRequest{" + method + " " + url +
               ", bodyLength=" + (body != null ? body.length : 0) + "}";
    }

    public static class Builder {
        private String url;
        private String method = "GET";
        private Map<String, String> headers;
        private byte[] body;
        private String bodyContentType;
        private int timeoutMs;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder addHeader(String key, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(key, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder bodyContentType(String bodyContentType) {
            this.bodyContentType = bodyContentType;
            return this;
        }

        public Builder timeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public ServiceRequest build() {
            return new ServiceRequest(this);
        }
    }
}
