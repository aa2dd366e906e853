package com.mailbridge.smtpapp.smtp;

import java.util.ArrayList;
import java.util.List;

/**
 * One SMTP account with its per-event settings. A tenant can keep several; each can be switched
 * off as a whole.
 */
public record SmtpConfiguration(
        String id,
        String name,
        boolean active,
        String senderName,
        String senderEmail,
        String smtpHost,
        int smtpPort,
        String smtpUser,
        String smtpPassword,
        SmtpEncryption encryption,
        List<EventConfiguration> events) {

    public SmtpConfiguration {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (encryption == null) {
            encryption = SmtpEncryption.NONE;
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    /** Settings of the event, or the defaults when the configuration predates the event. */
    public EventConfiguration event(EmailEvent eventType) {
        return events.stream()
                .filter(e -> e.eventType() == eventType)
                .findFirst()
                .orElse(EventConfiguration.defaultFor(eventType));
    }

    /** True when this configuration is active and sends e-mails for the event. */
    public boolean sends(EmailEvent eventType) {
        return active && event(eventType).active();
    }

    public SmtpConfiguration withEvent(EventConfiguration updated) {
        List<EventConfiguration> merged = new ArrayList<>();
        boolean replaced = false;
        for (EventConfiguration existing : events) {
            if (existing.eventType() == updated.eventType()) {
                merged.add(updated);
                replaced = true;
            } else {
                merged.add(existing);
            }
        }
        if (!replaced) {
            merged.add(updated);
        }
        return new SmtpConfiguration(id, name, active, senderName, senderEmail, smtpHost, smtpPort,
                smtpUser, smtpPassword, encryption, merged);
    }
}
