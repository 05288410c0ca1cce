package analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import http.HttpClient;
import http.ServiceRequest;
import http.ServiceResponse;
import model.Outcome;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Клиент вычислительного сервиса поверх {@link HttpClient}.
 *
 * <p>Правила преобразования ответа:
 * <ul>
 *   <li>ошибка транспорта - NETWORK с текстом исключения</li>
 *   <li>статус не 2xx - NETWORK с полем {@code error} или {@code detail} тела,
 *       иначе {@code HTTP error! status: N}</li>
 *   <li>тело 2xx не является JSON - SCHEMA</li>
 *   <li>тело 2xx содержит поле {@code error} - NETWORK с его текстом</li>
 * </ul>
 */
public final class HttpComputationClient implements ComputationClient {
    private static final Logger logger = Logger.getLogger(HttpComputationClient.class.getName());

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public HttpComputationClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.baseUrl = trimTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl cannot be null"));
    }

    @Override
    public Outcome<JsonNode> compute(String endpoint, JsonNode body) {
        String url = baseUrl + endpoint;
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            logger.warning("Failed to serialize request for " + endpoint + ": " + e.getMessage());
            return Outcome.failure(AnalysisError.validation("Request could not be serialized: " + e.getOriginalMessage()));
        }

        logger.info("POST " + url);
        ServiceResponse response = httpClient.execute(ServiceRequest.postJson(url, json));

        if (response.hasError()) {
            String message = response.getError().map(Throwable::getMessage).orElse("unknown error");
            logger.warning("Computation service unreachable at " + url + ": " + message);
            return Outcome.failure(AnalysisError.network(message));
        }

        int status = response.getStatusCode();
        if (status < 200 || status >= 300) {
            String description = errorMessage(response.getBodyAsString())
                .orElse("HTTP error! status: " + status);
            logger.warning("Computation service returned " + status + " for " + endpoint + ": " + description);
            return Outcome.failure(AnalysisError.network(description));
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(response.getBody());
        } catch (Exception e) {
            logger.warning("Computation service returned non-JSON body for " + endpoint + ": " + e.getMessage());
            return Outcome.failure(AnalysisError.schema("Response is not valid JSON"));
        }
        if (payload == null || payload.isMissingNode()) {
            return Outcome.failure(AnalysisError.schema("Response body is empty"));
        }

        JsonNode error = payload.get("error");
        if (error != null && !error.isNull()) {
            logger.warning("Computation service reported error for " + endpoint + ": " + error.asText());
            return Outcome.failure(AnalysisError.network(error.asText()));
        }

        logger.fine("Computation " + endpoint + " completed in " + response.getResponseTimeMs() + "ms");
        return Outcome.success(payload);
    }

    private Optional<String> errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            for (String field : new String[]{"error", "detail"}) {
                JsonNode value = node.get(field);
                if (value != null && !value.isNull()) {
                    return Optional.of(value.isTextual() ? value.asText() : value.toString());
                }
            }
        } catch (Exception e) {
            logger.fine("Error body is not JSON: " + e.getMessage());
        }
        return Optional.empty();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
