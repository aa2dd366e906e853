package com.mailbridge.security.token;

import com.nimbusds.jwt.JWTClaimsSet;

import java.text.ParseException;
import java.util.List;
import java.util.Set;

/**
 * Claim set of a token that passed every check of {@link TokenVerifier}, exactly as decoded.
 *
 * @param claims the decoded claims
 */
public record VerifiedClaims(JWTClaimsSet claims) {

    /** Claim holding the id of the application the token was issued for. */
    public static final String APP_CLAIM = "app";

    /** Claim holding the dashboard user's e-mail, when present. */
    public static final String EMAIL_CLAIM = "email";

    public VerifiedClaims {
        if (claims == null) {
            throw new IllegalArgumentException("claims must not be null");
        }
    }

    public String appId() {
        return stringClaim(claims, APP_CLAIM);
    }

    public String userEmail() {
        return stringClaim(claims, EMAIL_CLAIM);
    }

    public Set<String> permissions() {
        return permissionsOf(claims);
    }

    static String stringClaim(JWTClaimsSet claims, String name) {
        try {
            return claims.getStringClaim(name);
        } catch (ParseException e) {
            return null;
        }
    }

    static Set<String> permissionsOf(JWTClaimsSet claims) {
        try {
            List<String> granted = claims.getStringListClaim(AppPermissions.CLAIM);
            return granted == null ? Set.of() : Set.copyOf(granted);
        } catch (ParseException e) {
            return Set.of();
        }
    }
}
