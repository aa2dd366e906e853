package com.mailbridge.security.keyset;

import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKMatcher;
import com.nimbusds.jose.jwk.JWKSelector;
import com.nimbusds.jose.jwk.JWKSet;

import java.time.Instant;
import java.util.List;

/**
 * Public verification keys of one tenant, as last fetched.
 *
 * @param tenantApiUrl tenant the keys belong to
 * @param keys         public keys from the key-set document
 * @param fetchedAt    when the document was obtained
 */
public record KeySet(String tenantApiUrl, JWKSet keys, Instant fetchedAt) {

    public KeySet {
        if (tenantApiUrl == null || tenantApiUrl.isBlank()) {
            throw new IllegalArgumentException("tenantApiUrl must not be null or blank");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys must not be null");
        }
        keys = keys.toPublicJWKSet();
    }

    /**
     * Keys usable for a token with the given header: same key id (when the header names one),
     * a key type fitting the algorithm, and signature use. Empty when the algorithm is unsupported.
     */
    public List<JWK> matching(JWSHeader header) {
        JWKMatcher matcher = JWKMatcher.forJWSHeader(header);
        if (matcher == null) {
            return List.of();
        }
        return new JWKSelector(matcher).select(keys);
    }

    public int size() {
        return keys.getKeys().size();
    }
}
