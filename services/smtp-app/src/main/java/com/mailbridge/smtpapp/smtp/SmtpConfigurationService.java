package com.mailbridge.smtpapp.smtp;

import com.mailbridge.tenantapi.version.FeatureFlagService;
import com.mailbridge.tenantapi.version.FeatureFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * SMTP configuration operations of one tenant. Instances are bound to a single request.
 * <p>
 * Every change rewrites the full configuration list. Callers flagged to update webhooks
 * reconcile them after the change succeeds.
 */
public class SmtpConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(SmtpConfigurationService.class);

    private final SmtpConfigurationRepository repository;
    private final FeatureFlagService featureFlags;
    private final Supplier<String> idGenerator;

    public SmtpConfigurationService(SmtpConfigurationRepository repository, FeatureFlagService featureFlags) {
        this(repository, featureFlags, () -> UUID.randomUUID().toString());
    }

    SmtpConfigurationService(SmtpConfigurationRepository repository, FeatureFlagService featureFlags,
                             Supplier<String> idGenerator) {
        this.repository = repository;
        this.featureFlags = featureFlags;
        this.idGenerator = idGenerator;
    }

    public List<SmtpConfiguration> list() {
        return repository.findAll();
    }

    /**
     * @throws ConfigurationNotFoundException if no configuration has the id
     */
    public SmtpConfiguration get(String id) {
        return repository.findAll().stream()
                .filter(c -> c.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new ConfigurationNotFoundException(id));
    }

    /**
     * Creates a configuration with every event enabled that the tenant supports.
     */
    public SmtpConfiguration create(SmtpConfigurationInput input) {
        FeatureFlags flags = featureFlags.getFeatureFlags();
        List<EventConfiguration> events = Arrays.stream(EmailEvent.values())
                .map(event -> new EventConfiguration(event, event.isAvailable(flags), event.defaultSubject(), ""))
                .toList();
        SmtpConfiguration created = new SmtpConfiguration(
                idGenerator.get(), input.name(), input.active(), input.senderName(), input.senderEmail(),
                input.smtpHost(), input.smtpPort(), input.smtpUser(), input.smtpPassword(),
                input.encryption(), events);

        List<SmtpConfiguration> all = new ArrayList<>(repository.findAll());
        all.add(created);
        repository.saveAll(all);
        log.info("Created SMTP configuration {}", created.id());
        return created;
    }

    /**
     * @throws ConfigurationNotFoundException if no configuration has the id
     */
    public SmtpConfiguration update(String id, SmtpConfigurationInput input) {
        SmtpConfiguration existing = get(id);
        String password = input.smtpPassword() != null ? input.smtpPassword() : existing.smtpPassword();
        SmtpConfiguration updated = new SmtpConfiguration(
                id, input.name(), input.active(), input.senderName(), input.senderEmail(),
                input.smtpHost(), input.smtpPort(), input.smtpUser(), password,
                input.encryption(), existing.events());
        replace(updated);
        log.info("Updated SMTP configuration {}", id);
        return updated;
    }

    /**
     * @throws ConfigurationNotFoundException if no configuration has the id
     */
    public void delete(String id) {
        List<SmtpConfiguration> all = repository.findAll();
        List<SmtpConfiguration> remaining = all.stream().filter(c -> !c.id().equals(id)).toList();
        if (remaining.size() == all.size()) {
            throw new ConfigurationNotFoundException(id);
        }
        repository.saveAll(remaining);
        log.info("Deleted SMTP configuration {}", id);
    }

    /**
     * @throws ConfigurationNotFoundException if no configuration has the id
     * @throws IllegalArgumentException when activating an event the tenant's API version lacks
     */
    public SmtpConfiguration updateEvent(String id, EmailEvent event, EventConfigurationInput input) {
        SmtpConfiguration existing = get(id);
        if (input.active() && !event.isAvailable(featureFlags.getFeatureFlags())) {
            throw new IllegalArgumentException(
                    "Event " + event + " is not supported by the tenant's API version");
        }
        EventConfiguration current = existing.event(event);
        EventConfiguration changed = new EventConfiguration(
                event,
                input.active(),
                input.subject() != null ? input.subject() : current.subject(),
                input.template() != null ? input.template() : current.template());
        SmtpConfiguration updated = existing.withEvent(changed);
        replace(updated);
        log.info("Set event {} of SMTP configuration {} to active={}", event, id, input.active());
        return updated;
    }

    private void replace(SmtpConfiguration updated) {
        List<SmtpConfiguration> all = repository.findAll().stream()
                .map(c -> c.id().equals(updated.id()) ? updated : c)
                .toList();
        repository.saveAll(all);
    }
}
