package com.mailbridge.tenantapi.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.mailbridge.tenantapi.TenantApiClient;
import com.mailbridge.tenantapi.TenantApiException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value settings kept in the private metadata of the installed app on the tenant.
 * Only the app itself (and staff with app management rights) can read them.
 */
public class AppPrivateMetadata {

    static final String READ_QUERY = "query AppPrivateMetadata { app { id privateMetadata { key value } } }";

    static final String UPDATE_MUTATION =
            "mutation UpdateAppPrivateMetadata($id: ID!, $input: [MetadataInput!]!) {"
                    + " updatePrivateMetadata(id: $id, input: $input) { errors { field message } } }";

    private final TenantApiClient client;
    private final String appId;

    public AppPrivateMetadata(TenantApiClient client, String appId) {
        this.client = client;
        this.appId = appId;
    }

    public Optional<String> get(String key) {
        JsonNode entries = client.execute(READ_QUERY, Map.of()).path("app").path("privateMetadata");
        for (JsonNode entry : entries) {
            if (key.equals(entry.path("key").asText())) {
                return Optional.ofNullable(entry.path("value").textValue());
            }
        }
        return Optional.empty();
    }

    /**
     * @throws TenantApiException if the tenant refuses the update
     */
    public void set(String key, String value) {
        Map<String, Object> variables = Map.of(
                "id", appId,
                "input", List.of(Map.of("key", key, "value", value)));
        JsonNode errors = client.execute(UPDATE_MUTATION, variables).path("updatePrivateMetadata").path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(e -> messages.add(e.path("message").asText()));
            throw new TenantApiException("Could not update app metadata '" + key + "': " + messages, messages);
        }
    }
}
