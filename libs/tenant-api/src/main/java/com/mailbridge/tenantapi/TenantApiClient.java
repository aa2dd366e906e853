package com.mailbridge.tenantapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.security.DashboardOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GraphQL client bound to one tenant: its API URL, the app token of the installation, and
 * the dashboard origin the tenant expects on every request.
 * <p>
 * Instances are cheap and immutable; they share the {@link RestClient} of the
 * {@link TenantApiClientFactory} that created them.
 */
public class TenantApiClient {

    private static final Logger log = LoggerFactory.getLogger(TenantApiClient.class);

    static final String APP_INFO_QUERY = "query AppInfo { app { id } shop { version } }";
    static final String API_VERSION_QUERY = "query ApiVersion { shop { version } }";

    private final RestClient restClient;
    private final ObjectMapper mapper;
    private final String tenantApiUrl;
    private final String appToken;
    private final DashboardOrigin origin;

    TenantApiClient(RestClient restClient, ObjectMapper mapper, String tenantApiUrl, String appToken,
                    DashboardOrigin origin) {
        this.restClient = restClient;
        this.mapper = mapper;
        this.tenantApiUrl = tenantApiUrl;
        this.appToken = appToken;
        this.origin = origin;
    }

    public String tenantApiUrl() {
        return tenantApiUrl;
    }

    public DashboardOrigin origin() {
        return origin;
    }

    /**
     * Runs a query or mutation.
     *
     * @return the {@code data} node of the response
     * @throws TenantApiException on transport failure, error status, or GraphQL errors
     */
    public JsonNode execute(String document, Map<String, ?> variables) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", document);
        payload.put("variables", variables == null ? Map.of() : variables);

        String body;
        try {
            body = restClient.post()
                    .uri(tenantApiUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        headers.setBearerAuth(appToken);
                        origin.applyTo(headers);
                    })
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new TenantApiException("Tenant API " + tenantApiUrl + " answered " + e.getStatusCode().value(),
                    e.getStatusCode().value(), List.of(), e);
        } catch (RestClientException e) {
            throw new TenantApiException("Tenant API " + tenantApiUrl + " unreachable: " + e.getMessage(),
                    null, List.of(), e);
        }
        return dataOf(body);
    }

    /** Id of this installation and version of the tenant API. */
    public AppInfo fetchAppInfo() {
        JsonNode data = execute(APP_INFO_QUERY, Map.of());
        return new AppInfo(textAt(data.path("app").path("id")), textAt(data.path("shop").path("version")));
    }

    /** Version string of the tenant API, null when the tenant does not report one. */
    public String fetchApiVersion() {
        return textAt(execute(API_VERSION_QUERY, Map.of()).path("shop").path("version"));
    }

    private JsonNode dataOf(String body) {
        if (body == null || body.isBlank()) {
            throw new TenantApiException("Tenant API " + tenantApiUrl + " returned an empty response", List.of());
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TenantApiException("Tenant API " + tenantApiUrl + " returned invalid JSON", null, List.of(), e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText("unknown error")));
            log.debug("GraphQL errors from {}: {}", tenantApiUrl, messages);
            throw new TenantApiException("Tenant API " + tenantApiUrl + " returned errors: " + messages, messages);
        }
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new TenantApiException("Tenant API " + tenantApiUrl + " returned no data", List.of());
        }
        return data;
    }

    static String textAt(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    @Override
    public String toString() {
        return "TenantApiClient[" + tenantApiUrl + ", origin=" + origin + "]";
    }
}
