package com.mailbridge.smtpapp.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SmtpAppProperties")
class SmtpAppPropertiesTest {

    @Test
    @DisplayName("fills every optional section with defaults")
    void defaults() {
        var props = new SmtpAppProperties("smtp-app", null, "https://smtp.example.com", null, null, null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.authStore().type()).isEqualTo(SmtpAppProperties.AuthStoreType.FILE);
        assertThat(props.authStore().filePath()).isEqualTo(".auth-data.json");
        assertThat(props.requiredApiVersion()).isEqualTo(">=3.11.7 <4");
        assertThat(props.keySet().cacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(props.webhooks().maxConcurrency()).isEqualTo(4);
        assertThat(props.webhooks().maxAttempts()).isEqualTo(2);
        assertThat(props.webhooks().retryBackoff()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("strips trailing slashes from the base URL")
    void stripsTrailingSlash() {
        var props = new SmtpAppProperties("smtp-app", "prod", "https://smtp.example.com//", null, null, null, null, null);

        assertThat(props.baseUrl()).isEqualTo("https://smtp.example.com");
    }

    @Test
    @DisplayName("keeps explicit values")
    void keepsExplicitValues() {
        var props = new SmtpAppProperties(
                "smtp-app",
                "prod",
                "https://smtp.example.com",
                new SmtpAppProperties.AuthStore(SmtpAppProperties.AuthStoreType.MEMORY, null),
                "^https://.*$",
                ">=3.20 <4",
                new SmtpAppProperties.KeySet(Duration.ZERO, null, null),
                new SmtpAppProperties.Webhooks("smtp-", 8, 3, Duration.ofSeconds(2)));

        assertThat(props.authStore().type()).isEqualTo(SmtpAppProperties.AuthStoreType.MEMORY);
        assertThat(props.requiredApiVersion()).isEqualTo(">=3.20 <4");
        assertThat(props.keySet().cacheTtl()).isZero();
        assertThat(props.webhooks().namePrefix()).isEqualTo("smtp-");
        assertThat(props.webhooks().maxConcurrency()).isEqualTo(8);
        assertThat(props.webhooks().retryBackoff()).isEqualTo(Duration.ofSeconds(2));
    }
}
