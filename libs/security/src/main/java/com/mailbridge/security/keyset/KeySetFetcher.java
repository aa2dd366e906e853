package com.mailbridge.security.keyset;

import com.mailbridge.security.DashboardOrigin;
import com.nimbusds.jose.jwk.JWKSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.text.ParseException;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the public keys a tenant signs dashboard tokens with.
 * <p>
 * The document lives at {@value #WELL_KNOWN_PATH} on the origin of the tenant API URL. The
 * endpoint is referrer-gated: every fetch carries {@code Origin} and {@code Referer} built
 * from the tenant's dashboard URL, see {@link DashboardOrigin}.
 */
public class KeySetFetcher {

    private static final Logger log = LoggerFactory.getLogger(KeySetFetcher.class);

    public static final String WELL_KNOWN_PATH = "/.well-known/jwks.json";

    private final RestClient restClient;
    private final KeySetCache cache;
    private final Clock clock;
    private final Set<String> storedDocumentUsed = ConcurrentHashMap.newKeySet();

    /**
     * Key set returned by {@link #lookup}.
     *
     * @param keySet  keys of the tenant
     * @param fetched whether the set was fetched from the endpoint during this lookup
     */
    public record Lookup(KeySet keySet, boolean fetched) {
    }

    public KeySetFetcher(RestClient restClient, KeySetCache cache) {
        this(restClient, cache, Clock.systemUTC());
    }

    public KeySetFetcher(RestClient restClient, KeySetCache cache, Clock clock) {
        this.restClient = restClient;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Cached key set of the tenant, fetching it on a miss.
     *
     * @throws KeySetUnavailableException if the endpoint cannot provide a key set
     */
    public KeySet resolveKeySet(String tenantApiUrl, String dashboardUrl) {
        return resolveKeySet(tenantApiUrl, dashboardUrl, null);
    }

    /**
     * Like {@link #resolveKeySet(String, String)}, but a stored JWKS document (saved with the
     * installation) may stand in for the first fetch. See {@link #lookup}.
     */
    public KeySet resolveKeySet(String tenantApiUrl, String dashboardUrl, String storedJwks) {
        return lookup(tenantApiUrl, dashboardUrl, storedJwks).keySet();
    }

    /**
     * Cached key set of the tenant, or a new one on a miss.
     * <p>
     * The stored document seeds the cache only on the first lookup of the tenant in this
     * process. Once that entry expires the key set always comes from the endpoint. An
     * unparsable stored document is ignored.
     *
     * @throws KeySetUnavailableException if the endpoint cannot provide a key set
     */
    public Lookup lookup(String tenantApiUrl, String dashboardUrl, String storedJwks) {
        Optional<KeySet> cached = cache.get(tenantApiUrl);
        if (cached.isPresent()) {
            return new Lookup(cached.get(), false);
        }
        if (storedJwks != null && !storedJwks.isBlank() && storedDocumentUsed.add(tenantApiUrl)) {
            try {
                KeySet seeded = new KeySet(tenantApiUrl, JWKSet.parse(storedJwks), clock.instant());
                cache.put(seeded);
                log.debug("Seeded key set of {} from stored document ({} keys)", tenantApiUrl, seeded.size());
                return new Lookup(seeded, false);
            } catch (ParseException e) {
                log.warn("Ignoring unparsable stored key set of {}: {}", tenantApiUrl, e.getMessage());
            }
        }
        return new Lookup(fetch(tenantApiUrl, dashboardUrl), true);
    }

    /**
     * Drops the cached entry and fetches the key set from the endpoint, ignoring any stored
     * document. Called when a token names a key the cached set does not contain.
     */
    public KeySet refresh(String tenantApiUrl, String dashboardUrl) {
        cache.invalidate(tenantApiUrl);
        return fetch(tenantApiUrl, dashboardUrl);
    }

    /**
     * Key-set endpoint for a tenant: scheme, host and port of the API URL plus the well-known path.
     *
     * @throws IllegalArgumentException if the URL is not absolute
     */
    public static URI endpointFor(String tenantApiUrl) {
        URI api = URI.create(tenantApiUrl);
        if (api.getScheme() == null || api.getHost() == null) {
            throw new IllegalArgumentException("tenantApiUrl must be an absolute URL: " + tenantApiUrl);
        }
        String port = api.getPort() == -1 ? "" : ":" + api.getPort();
        return URI.create(api.getScheme() + "://" + api.getHost() + port + WELL_KNOWN_PATH);
    }

    private KeySet fetch(String tenantApiUrl, String dashboardUrl) {
        URI endpoint = endpointFor(tenantApiUrl);
        DashboardOrigin origin = DashboardOrigin.of(dashboardUrl);
        log.debug("Fetching key set from {} with origin {}", endpoint, origin);

        String body;
        try {
            body = restClient.get()
                    .uri(endpoint)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(origin::applyTo)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new KeySetUnavailableException(endpoint, e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new KeySetUnavailableException(endpoint, "empty response", null);
        }

        JWKSet jwks;
        try {
            jwks = JWKSet.parse(body);
        } catch (ParseException e) {
            throw new KeySetUnavailableException(endpoint, "response is not a JWK set", e);
        }
        KeySet keySet = new KeySet(tenantApiUrl, jwks, clock.instant());
        cache.put(keySet);
        log.info("Fetched key set of {} ({} keys)", tenantApiUrl, keySet.size());
        return keySet;
    }
}
