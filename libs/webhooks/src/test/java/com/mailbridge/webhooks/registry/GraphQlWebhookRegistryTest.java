package com.mailbridge.webhooks.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.tenantapi.TenantApiClient;
import com.mailbridge.tenantapi.TenantApiException;
import com.mailbridge.webhooks.manifest.DeliveryMode;
import com.mailbridge.webhooks.manifest.RemoteWebhook;
import com.mailbridge.webhooks.manifest.WebhookManifestEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GraphQlWebhookRegistry")
class GraphQlWebhookRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private TenantApiClient client;

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private static final WebhookManifestEntry ENTRY = new WebhookManifestEntry(
            "order-created", "https://app/api/webhooks/order-created", List.of("ORDER_CREATED"), true, DeliveryMode.ASYNC);

    @Test
    @DisplayName("lists the app webhooks with delivery mode derived from the event lists")
    void list() throws Exception {
        when(client.execute(eq(GraphQlWebhookRegistry.LIST_QUERY), anyMap())).thenReturn(json("{\"app\":{\"webhooks\":["
                + "{\"id\":\"1\",\"name\":\"order-created\",\"targetUrl\":\"https://app/wh\",\"isActive\":true,"
                + "\"asyncEvents\":[{\"eventType\":\"ORDER_CREATED\"}],\"syncEvents\":[]},"
                + "{\"id\":\"2\",\"name\":\"checkout\",\"targetUrl\":\"https://app/sync\",\"isActive\":false,"
                + "\"asyncEvents\":[],\"syncEvents\":[{\"eventType\":\"CHECKOUT_CALCULATE_TAXES\"}]}"
                + "]}}"));

        List<RemoteWebhook> webhooks = new GraphQlWebhookRegistry(client).list();

        assertThat(webhooks).containsExactly(
                new RemoteWebhook("1", "order-created", "https://app/wh", List.of("ORDER_CREATED"), true, DeliveryMode.ASYNC),
                new RemoteWebhook("2", "checkout", "https://app/sync", List.of("CHECKOUT_CALCULATE_TAXES"), false, DeliveryMode.SYNC));
    }

    @Test
    @DisplayName("create sends the complete input")
    void create() throws Exception {
        when(client.execute(eq(GraphQlWebhookRegistry.CREATE_MUTATION), anyMap())).thenReturn(json("{\"webhookCreate\":{\"webhook\":{\"id\":\"9\",\"name\":\"order-created\","
                + "\"targetUrl\":\"https://app/api/webhooks/order-created\",\"isActive\":true,"
                + "\"asyncEvents\":[{\"eventType\":\"ORDER_CREATED\"}],\"syncEvents\":[]},\"errors\":[]}}"));

        RemoteWebhook created = new GraphQlWebhookRegistry(client).create(ENTRY);

        assertThat(created.remoteId()).isEqualTo("9");
        assertThat(created.matches(ENTRY)).isTrue();
        verify(client).execute(GraphQlWebhookRegistry.CREATE_MUTATION, Map.of("input", GraphQlWebhookRegistry.input(ENTRY)));
    }

    @Test
    @DisplayName("input clears the event list of the other delivery mode")
    void inputReplacesBothLists() {
        Map<String, Object> input = GraphQlWebhookRegistry.input(ENTRY);

        assertThat(input)
                .containsEntry("name", "order-created")
                .containsEntry("isActive", true)
                .containsEntry("asyncEvents", List.of("ORDER_CREATED"))
                .containsEntry("syncEvents", List.of());
    }

    @Test
    @DisplayName("mutation errors become TenantApiException")
    void mutationErrors() throws Exception {
        when(client.execute(eq(GraphQlWebhookRegistry.DELETE_MUTATION), anyMap())).thenReturn(json(
                "{\"webhookDelete\":{\"errors\":[{\"field\":\"id\",\"message\":\"Couldn't resolve id\"}]}}"));

        assertThatThrownBy(() -> new GraphQlWebhookRegistry(client).delete("404"))
                .isInstanceOf(TenantApiException.class)
                .hasMessageContaining("Couldn't resolve id");
    }

    @Test
    @DisplayName("update addresses the remote id")
    void update() throws Exception {
        when(client.execute(eq(GraphQlWebhookRegistry.UPDATE_MUTATION), anyMap())).thenReturn(json("{\"webhookUpdate\":{\"webhook\":{\"id\":\"3\",\"name\":\"order-created\","
                + "\"targetUrl\":\"https://app/api/webhooks/order-created\",\"isActive\":true,"
                + "\"asyncEvents\":[{\"eventType\":\"ORDER_CREATED\"}],\"syncEvents\":[]},\"errors\":[]}}"));

        assertThat(new GraphQlWebhookRegistry(client).update("3", ENTRY).remoteId()).isEqualTo("3");
        verify(client).execute(GraphQlWebhookRegistry.UPDATE_MUTATION,
                Map.of("id", "3", "input", GraphQlWebhookRegistry.input(ENTRY)));
    }
}
