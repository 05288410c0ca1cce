package http;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Ответ внешнего сервиса.
 * Содержит код статуса, заголовки, тело ответа (в байтах), время ответа и возможную ошибку транспорта.
 */
public final class ServiceResponse {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final long responseTimeMs;
    private final Optional<Exception> error;

    private ServiceResponse(Builder builder) {
        this.statusCode = builder.statusCode;
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        this.body = builder.body != null ? builder.body : new byte[0];
        this.responseTimeMs = builder.responseTimeMs;
        this.error = Optional.ofNullable(builder.error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public long getResponseTimeMs() {
        return responseTimeMs;
    }

    public Optional<Exception> getError() {
        return error;
    }

    public boolean isSuccessful() {
        return !hasError() && statusCode >= 200 && statusCode < 300;
    }

    public boolean hasError() {
        return error.isPresent();
    }

    public Optional<String> getHeader(String name) {
        List<String> values = headers.get(name);
        return values != null && !values.isEmpty()
            ? Optional.of(values.get(0))
            : Optional.empty();
    }

    @Override
    public String toString() {
        if (hasError()) {
            return "ServiceResponse{error=" + error.get().getMessage() + "}";
        }
        return "ServiceResponse{statusCode=" + statusCode +
               ", responseTime=" + responseTimeMs + "ms" +
               ", bodyLength=" + body.length + "}";
    }

    public static class Builder {
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private long responseTimeMs;
        private Exception error;

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder headers(Map<String, List<String>> headers) {
            this.headers = headers;
            return this;
        }

        public Builder addHeader(String key, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
            return this;
        }

        public Builder responseTimeMs(long responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
            return this;
        }

        public Builder error(Exception error) {
            this.error = error;
            return this;
        }

        public ServiceResponse build() {
            return new ServiceResponse(this);
        }
    }
}
