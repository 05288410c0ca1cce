package http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Стандартная реализация HTTP клиента на базе java.net.HttpURLConnection.
 * Эта реализация не требует внешних зависимостей.
 *
 * <p>Основные возможности:
 * <ul>
 *   <li>Поддержка HTTP/HTTPS протоколов</li>
 *   <li>Таймауты и заголовки по умолчанию из {@link HttpClientConfig}</li>
 *   <li>Чтение тела ответа как для успешных ответов, так и для ошибок</li>
 *   <li>Бинарное тело ответа (документы DOCX, скрипты)</li>
 * </ul>
 */
public final class StandardHttpClient implements HttpClient {
    private static final Logger logger = Logger.getLogger(StandardHttpClient.class.getName());

    private final HttpClientConfig config;

    public StandardHttpClient(HttpClientConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    @Override
    public ServiceResponse execute(ServiceRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            URL url = new URL(request.getUrl());
            HttpURLConnection connection = (HttpURLConnection) url.openConnection();

            configureConnection(connection, request);
            connection.setRequestMethod(request.getMethod());

            config.defaultHeaders().forEach(connection::setRequestProperty);
            request.getHeaders().forEach(connection::setRequestProperty);

            if (request.hasBody()) {
                connection.setDoOutput(true);
                if (request.getBodyContentType() != null) {
                    connection.setRequestProperty("Content-Type", request.getBodyContentType());
                }

                try (OutputStream os = connection.getOutputStream()) {
                    os.write(request.getBody());
                    os.flush();
                }
            }

            int statusCode = connection.getResponseCode();
            byte[] body = readResponseBody(connection, statusCode);
            long responseTime = System.currentTimeMillis() - startTime;

            Map<String, List<String>> headers = new LinkedHashMap<>(connection.getHeaderFields());
            headers.remove(null); // Remove status line

            connection.disconnect();

            logger.fine(() -> request.getMethod() + " " + request.getUrl() + " -> " + statusCode +
                " (" + responseTime + "ms)");

            return ServiceResponse.builder()
                .statusCode(statusCode)
                .headers(headers)
                .body(body)
                .responseTimeMs(responseTime)
                .build();

        } catch (IOException | IllegalArgumentException e) {
            long responseTime = System.currentTimeMillis() - startTime;

            String errorMsg = "Request failed: " + request.getMethod() + " " + request.getUrl();
            if (e.getMessage() != null) {
                errorMsg += " - " + e.getMessage();
            }
            logger.log(Level.WARNING, errorMsg, e);

            return ServiceResponse.builder()
                .statusCode(0)
                .responseTimeMs(responseTime)
                .error(e)
                .build();
        }
    }

    @Override
    public boolean supports(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    @Override
    public void close() {
        // HttpURLConnection doesn't maintain persistent connections that need cleanup
    }

    private void configureConnection(HttpURLConnection connection, ServiceRequest request) {
        connection.setConnectTimeout((int) config.connectTimeout().toMillis());
        connection.setReadTimeout((int) config.readTimeout().toMillis());
        // script storage answers with redirects to the media host
        connection.setInstanceFollowRedirects(true);

        if (request.getTimeoutMs() > 0) {
            connection.setConnectTimeout(request.getTimeoutMs());
            connection.setReadTimeout(request.getTimeoutMs());
        }
    }

    private byte[] readResponseBody(HttpURLConnection connection, int statusCode) throws IOException {
        try (InputStream inputStream = statusCode >= 400
            ? connection.getErrorStream()
            : connection.getInputStream()) {

            if (inputStream == null) {
                return new byte[0];
            }

            return inputStream.readAllBytes();
        }
    }
}
