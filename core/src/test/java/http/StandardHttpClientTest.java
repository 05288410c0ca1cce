package http;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StandardHttpClient that do not need a live server.
 */
class StandardHttpClientTest {

    @Test
    void testHttpClientCreation() {
        HttpClientConfig config = HttpClientConfig.of(Duration.ofSeconds(5), Duration.ofSeconds(5));

        StandardHttpClient httpClient = new StandardHttpClient(config);

        assertTrue(httpClient.supports("http://example.com"));
        assertTrue(httpClient.supports("https://example.com"));
        assertFalse(httpClient.supports("ftp://example.com"));
        assertFalse(httpClient.supports(null));

        httpClient.close();
    }

    @Test
    void testPostJsonRequest() {
        ServiceRequest request = ServiceRequest.postJson("http://localhost:8000/api/analysis/acf-pacf", "{\"lags\":10}");

        assertEquals("POST", request.getMethod());
        assertTrue(request.hasBody());
        assertEquals("{\"lags\":10}", new String(request.getBody(), StandardCharsets.UTF_8));
        assertEquals("application/json", request.getBodyContentType());
    }

    @Test
    void testGetRequestHasNoBody() {
        ServiceRequest request = ServiceRequest.get("http://example.com/script.py");

        assertEquals("GET", request.getMethod());
        assertFalse(request.hasBody());
    }

    @Test
    void testConfigDefaults() {
        HttpClientConfig config = new HttpClientConfig(Duration.ofSeconds(1), Duration.ofSeconds(3), " ");

        assertEquals(HttpClientConfig.DEFAULT_USER_AGENT, config.userAgent());
        assertEquals(HttpClientConfig.DEFAULT_USER_AGENT, config.defaultHeaders().get("User-Agent"));
        assertEquals(Duration.ofSeconds(120), HttpClientConfig.defaults().readTimeout());
        assertThrows(IllegalArgumentException.class,
            () -> HttpClientConfig.of(Duration.ofSeconds(-1), Duration.ofSeconds(1)));
    }

    @Test
    void testInvalidUrlHandling() {
        StandardHttpClient httpClient = new StandardHttpClient(HttpClientConfig.defaults());

        ServiceResponse response = httpClient.execute(ServiceRequest.get("invalid-url"));

        assertTrue(response.hasError());
        assertEquals(0, response.getStatusCode());
        assertFalse(response.isSuccessful());

        httpClient.close();
    }

    @Test
    void testConnectionRefusedIsReportedAsError() {
        HttpClientConfig config = HttpClientConfig.of(Duration.ofSeconds(2), Duration.ofSeconds(2));
        StandardHttpClient httpClient = new StandardHttpClient(config);

        // port 1 is reserved and normally closed
        ServiceResponse response = httpClient.execute(ServiceRequest.postJson("http://127.0.0.1:1/api", "{}"));

        assertTrue(response.hasError());
        assertTrue(response.getError().isPresent());
    }
}
