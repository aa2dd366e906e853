package com.mailbridge.tenantapi.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a tenant API version is supported by this app.
 */
public class VersionCompatibilityValidator {

    private static final Logger log = LoggerFactory.getLogger(VersionCompatibilityValidator.class);

    private final VersionRange required;

    public VersionCompatibilityValidator(String requiredRange) {
        this.required = VersionRange.parse(requiredRange);
    }

    /**
     * @return false for versions outside the range and for unparsable version strings
     */
    public boolean isValid(String version) {
        if (version == null || version.isBlank()) {
            return false;
        }
        try {
            return required.includes(ApiVersion.parse(version));
        } catch (IllegalArgumentException e) {
            log.warn("Cannot compare tenant API version '{}' with {}: {}", version, required, e.getMessage());
            return false;
        }
    }

    public VersionRange required() {
        return required;
    }
}
