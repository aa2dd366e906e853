package com.mailbridge.smtpapp.smtp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.tenantapi.metadata.AppPrivateMetadata;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the configurations as one JSON document in the app's private metadata on the tenant.
 */
public class MetadataSmtpConfigurationRepository implements SmtpConfigurationRepository {

    static final String METADATA_KEY = "smtp-configuration";

    private final AppPrivateMetadata metadata;
    private final ObjectMapper mapper;

    public MetadataSmtpConfigurationRepository(AppPrivateMetadata metadata, ObjectMapper mapper) {
        this.metadata = metadata;
        this.mapper = mapper;
    }

    @Override
    public List<SmtpConfiguration> findAll() {
        Optional<String> stored = metadata.get(METADATA_KEY);
        if (stored.isEmpty() || stored.get().isBlank()) {
            return List.of();
        }
        try {
            Document document = mapper.readValue(stored.get(), Document.class);
            return document.configurations() == null ? List.of() : document.configurations();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored SMTP configuration is not valid JSON", e);
        }
    }

    @Override
    public void saveAll(List<SmtpConfiguration> configurations) {
        try {
            metadata.set(METADATA_KEY, mapper.writeValueAsString(new Document(configurations)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise SMTP configuration", e);
        }
    }

    record Document(List<SmtpConfiguration> configurations) {}
}
