package com.mailbridge.smtpapp.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.security.keyset.InMemoryKeySetCache;
import com.mailbridge.security.keyset.KeySetCache;
import com.mailbridge.security.keyset.KeySetFetcher;
import com.mailbridge.security.store.AuthDataStore;
import com.mailbridge.security.store.FileAuthDataStore;
import com.mailbridge.security.store.InMemoryAuthDataStore;
import com.mailbridge.security.token.TokenVerifier;
import com.mailbridge.smtpapp.registration.RegistrationService;
import com.mailbridge.tenantapi.TenantApiClientFactory;
import com.mailbridge.tenantapi.version.VersionCompatibilityValidator;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Auth data store, key-set resolution, token verification and the outbound tenant clients.
 * Everything is built once from {@link SmtpAppProperties} at start-up.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public AuthDataStore authDataStore(SmtpAppProperties properties, ObjectMapper mapper) {
        SmtpAppProperties.AuthStore config = properties.authStore();
        AuthDataStore store = switch (config.type()) {
            case MEMORY -> new InMemoryAuthDataStore();
            case FILE -> new FileAuthDataStore(Path.of(config.filePath()), mapper);
        };
        log.info("Using {} auth data store", config.type());
        return store;
    }

    @Bean
    public KeySetCache keySetCache(SmtpAppProperties properties) {
        return new InMemoryKeySetCache(properties.keySet().cacheTtl());
    }

    @Bean
    public KeySetFetcher keySetFetcher(
            RestClient.Builder restClientBuilder, KeySetCache cache, SmtpAppProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.keySet().connectTimeout());
        requestFactory.setReadTimeout(properties.keySet().readTimeout());
        return new KeySetFetcher(restClientBuilder.requestFactory(requestFactory).build(), cache);
    }

    @Bean
    public TokenVerifier tokenVerifier(KeySetFetcher keySetFetcher) {
        return new TokenVerifier(keySetFetcher);
    }

    @Bean
    public TenantApiClientFactory tenantApiClientFactory(RestClient.Builder restClientBuilder, ObjectMapper mapper) {
        return new TenantApiClientFactory(restClientBuilder, mapper);
    }

    @Bean
    public RegistrationService registrationService(
            AuthDataStore store,
            TenantApiClientFactory clients,
            KeySetFetcher keySetFetcher,
            SmtpAppProperties properties) {
        String pattern = properties.allowedApiUrlPattern();
        return new RegistrationService(
                store,
                clients,
                keySetFetcher,
                new VersionCompatibilityValidator(properties.requiredApiVersion()),
                pattern == null || pattern.isBlank() ? null : Pattern.compile(pattern));
    }
}
