package com.mailbridge.webhooks.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.mailbridge.tenantapi.TenantApiClient;
import com.mailbridge.tenantapi.TenantApiException;
import com.mailbridge.webhooks.manifest.DeliveryMode;
import com.mailbridge.webhooks.manifest.RemoteWebhook;
import com.mailbridge.webhooks.manifest.WebhookManifestEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link WebhookRegistry} backed by the tenant's GraphQL API, acting as the installed app.
 */
public class GraphQlWebhookRegistry implements WebhookRegistry {

    private static final String WEBHOOK_FIELDS =
            "id name targetUrl isActive asyncEvents { eventType } syncEvents { eventType }";

    static final String LIST_QUERY = "query AppWebhooks { app { webhooks { " + WEBHOOK_FIELDS + " } } }";

    static final String CREATE_MUTATION = "mutation WebhookCreate($input: WebhookCreateInput!) {"
            + " webhookCreate(input: $input) { webhook { " + WEBHOOK_FIELDS + " } errors { field message } } }";

    static final String UPDATE_MUTATION = "mutation WebhookUpdate($id: ID!, $input: WebhookUpdateInput!) {"
            + " webhookUpdate(id: $id, input: $input) { webhook { " + WEBHOOK_FIELDS + " } errors { field message } } }";

    static final String DELETE_MUTATION = "mutation WebhookDelete($id: ID!) {"
            + " webhookDelete(id: $id) { errors { field message } } }";

    private final TenantApiClient client;

    public GraphQlWebhookRegistry(TenantApiClient client) {
        this.client = client;
    }

    @Override
    public List<RemoteWebhook> list() {
        JsonNode webhooks = client.execute(LIST_QUERY, Map.of()).path("app").path("webhooks");
        List<RemoteWebhook> result = new ArrayList<>();
        for (JsonNode node : webhooks) {
            result.add(toRemote(node));
        }
        return result;
    }

    @Override
    public RemoteWebhook create(WebhookManifestEntry entry) {
        JsonNode payload = client.execute(CREATE_MUTATION, Map.of("input", input(entry))).path("webhookCreate");
        failOnErrors("webhookCreate " + entry.name(), payload);
        return toRemote(payload.path("webhook"));
    }

    @Override
    public RemoteWebhook update(String remoteId, WebhookManifestEntry entry) {
        JsonNode payload = client.execute(UPDATE_MUTATION, Map.of("id", remoteId, "input", input(entry)))
                .path("webhookUpdate");
        failOnErrors("webhookUpdate " + remoteId, payload);
        return toRemote(payload.path("webhook"));
    }

    @Override
    public void delete(String remoteId) {
        JsonNode payload = client.execute(DELETE_MUTATION, Map.of("id", remoteId)).path("webhookDelete");
        failOnErrors("webhookDelete " + remoteId, payload);
    }

    /** Full input: both event lists are always sent so an update never leaves stale events behind. */
    static Map<String, Object> input(WebhookManifestEntry entry) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", entry.name());
        input.put("targetUrl", entry.targetUrl());
        input.put("isActive", entry.isActive());
        input.put("asyncEvents", entry.delivery() == DeliveryMode.ASYNC ? entry.eventTypes() : List.of());
        input.put("syncEvents", entry.delivery() == DeliveryMode.SYNC ? entry.eventTypes() : List.of());
        return input;
    }

    private static RemoteWebhook toRemote(JsonNode node) {
        if (!node.hasNonNull("id")) {
            throw new TenantApiException("Tenant returned a webhook without id", List.of());
        }
        List<String> sync = eventTypes(node.path("syncEvents"));
        List<String> async = eventTypes(node.path("asyncEvents"));
        DeliveryMode delivery = sync.isEmpty() ? DeliveryMode.ASYNC : DeliveryMode.SYNC;
        List<String> events = new ArrayList<>(async);
        events.addAll(sync);
        return new RemoteWebhook(
                node.path("id").asText(),
                node.path("name").asText(null),
                node.path("targetUrl").asText(null),
                events,
                node.path("isActive").asBoolean(false),
                delivery);
    }

    private static List<String> eventTypes(JsonNode events) {
        List<String> types = new ArrayList<>();
        for (JsonNode event : events) {
            types.add(event.path("eventType").asText());
        }
        return types;
    }

    private static void failOnErrors(String operation, JsonNode payload) {
        JsonNode errors = payload.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(e -> messages.add(e.path("field").asText("") + ": " + e.path("message").asText()));
            throw new TenantApiException(operation + " failed: " + messages, messages);
        }
    }
}
