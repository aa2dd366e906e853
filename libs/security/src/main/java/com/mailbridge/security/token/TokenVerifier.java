package com.mailbridge.security.token;

import com.mailbridge.security.AuthRecord;
import com.mailbridge.security.keyset.KeySetFetcher;
import com.mailbridge.security.keyset.KeySetUnavailableException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyConverter;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.security.PrivateKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Verifies dashboard bearer tokens against the key set of the tenant that issued them.
 * <p>
 * Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>decode the claims without looking at the signature ({@code malformed})</li>
 *   <li>compare the decoded {@code app} claim with the expected app id ({@code app-mismatch}),
 *       so tokens of other apps are refused whatever their signature</li>
 *   <li>verify the signature with the tenant key set, then the validity window
 *       ({@code bad-signature})</li>
 *   <li>check the granted permissions ({@code insufficient-permission})</li>
 * </ol>
 * When the cached key set has no key matching the token header, the set is fetched again
 * once before the token is rejected, so key rotation on the tenant side needs no manual
 * eviction. A set that was just fetched for this verification is not fetched a second time.
 */
public class TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(TokenVerifier.class);

    /** Allowed clock difference for {@code exp} and {@code nbf}. */
    public static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

    private final KeySetFetcher keySetFetcher;
    private final Clock clock;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    public TokenVerifier(KeySetFetcher keySetFetcher) {
        this(keySetFetcher, Clock.systemUTC());
    }

    public TokenVerifier(KeySetFetcher keySetFetcher, Clock clock) {
        this.keySetFetcher = keySetFetcher;
        this.clock = clock;
    }

    /**
     * Verifies a token for an installation, seeding the key set from the stored document when
     * the record carries one.
     */
    public VerifiedClaims verify(String token, AuthRecord record, Set<String> requiredPermissions) {
        return verify(token, record.tenantApiUrl(), record.appId(), record.dashboardUrl(),
                record.keySetOverride(), requiredPermissions);
    }

    /**
     * @param requiredPermissions the full set the token must grant, baseline included
     *                            (see {@link AppPermissions#required})
     * @return the decoded claim set, unchanged
     * @throws TokenVerificationException if any check fails
     * @throws KeySetUnavailableException if the tenant key set cannot be obtained
     */
    public VerifiedClaims verify(String token, String tenantApiUrl, String appId, String dashboardUrl,
                                 Set<String> requiredPermissions) {
        return verify(token, tenantApiUrl, appId, dashboardUrl, null, requiredPermissions);
    }

    private VerifiedClaims verify(String token, String tenantApiUrl, String appId, String dashboardUrl,
                                  String storedJwks, Set<String> requiredPermissions) {
        SignedJWT jwt = decode(token);
        JWTClaimsSet claims = claimsOf(jwt);

        String tokenApp = VerifiedClaims.stringClaim(claims, VerifiedClaims.APP_CLAIM);
        if (appId == null || !appId.equals(tokenApp)) {
            throw new TokenVerificationException(VerificationFailureReason.APP_MISMATCH,
                    "token app '" + tokenApp + "' does not match app id '" + appId + "'");
        }

        verifySignature(jwt, tenantApiUrl, dashboardUrl, storedJwks);
        verifyValidityWindow(claims);

        Set<String> missing = new TreeSet<>(requiredPermissions == null ? Set.of() : requiredPermissions);
        missing.removeAll(VerifiedClaims.permissionsOf(claims));
        if (!missing.isEmpty()) {
            throw new TokenVerificationException(VerificationFailureReason.INSUFFICIENT_PERMISSION,
                    "missing permissions " + missing);
        }
        return new VerifiedClaims(claims);
    }

    private SignedJWT decode(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(VerificationFailureReason.MALFORMED, "token is empty");
        }
        try {
            return SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new TokenVerificationException(VerificationFailureReason.MALFORMED,
                    "could not decode token: " + e.getMessage(), e);
        }
    }

    private JWTClaimsSet claimsOf(SignedJWT jwt) {
        try {
            return jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new TokenVerificationException(VerificationFailureReason.MALFORMED,
                    "could not decode claims: " + e.getMessage(), e);
        }
    }

    private void verifySignature(SignedJWT jwt, String tenantApiUrl, String dashboardUrl, String storedJwks) {
        KeySetFetcher.Lookup lookup = keySetFetcher.lookup(tenantApiUrl, dashboardUrl, storedJwks);
        List<JWK> candidates = lookup.keySet().matching(jwt.getHeader());
        if (candidates.isEmpty() && !lookup.fetched()) {
            log.info("No key for kid '{}' in cached key set of {}, refreshing", jwt.getHeader().getKeyID(), tenantApiUrl);
            candidates = keySetFetcher.refresh(tenantApiUrl, dashboardUrl).matching(jwt.getHeader());
        }
        if (candidates.isEmpty()) {
            throw new TokenVerificationException(VerificationFailureReason.BAD_SIGNATURE,
                    "no key in the key set of " + tenantApiUrl + " matches kid '" + jwt.getHeader().getKeyID() + "'");
        }
        for (Key key : KeyConverter.toJavaKeys(candidates)) {
            if (key instanceof PrivateKey) {
                continue;
            }
            if (verifiesWith(jwt, key)) {
                return;
            }
        }
        throw new TokenVerificationException(VerificationFailureReason.BAD_SIGNATURE, "signature verification failed");
    }

    private boolean verifiesWith(SignedJWT jwt, Key key) {
        try {
            JWSVerifier verifier = verifierFactory.createJWSVerifier(jwt.getHeader(), key);
            return jwt.verify(verifier);
        } catch (JOSEException e) {
            log.debug("Key of type {} cannot verify {}: {}", key.getAlgorithm(), jwt.getHeader().getAlgorithm(), e.getMessage());
            return false;
        }
    }

    private void verifyValidityWindow(JWTClaimsSet claims) {
        Instant now = clock.instant();
        Date exp = claims.getExpirationTime();
        if (exp != null && exp.toInstant().plus(CLOCK_SKEW).isBefore(now)) {
            throw new TokenVerificationException(VerificationFailureReason.BAD_SIGNATURE, "token expired at " + exp.toInstant());
        }
        Date nbf = claims.getNotBeforeTime();
        if (nbf != null && nbf.toInstant().minus(CLOCK_SKEW).isAfter(now)) {
            throw new TokenVerificationException(VerificationFailureReason.BAD_SIGNATURE, "token not valid before " + nbf.toInstant());
        }
    }
}
