package com.mailbridge.smtpapp.api;

import com.mailbridge.smtpapp.smtp.EventConfiguration;
import com.mailbridge.smtpapp.smtp.SmtpConfiguration;
import com.mailbridge.smtpapp.smtp.SmtpEncryption;
import java.util.List;

/**
 * SMTP configuration as returned to the dashboard. The password never leaves the service;
 * {@code passwordSet} tells whether one is stored.
 */
public record ConfigurationResponse(
        String id,
        String name,
        boolean active,
        String senderName,
        String senderEmail,
        String smtpHost,
        int smtpPort,
        String smtpUser,
        boolean passwordSet,
        SmtpEncryption encryption,
        List<EventConfiguration> events) {

    public static ConfigurationResponse from(SmtpConfiguration configuration) {
        return new ConfigurationResponse(
                configuration.id(),
                configuration.name(),
                configuration.active(),
                configuration.senderName(),
                configuration.senderEmail(),
                configuration.smtpHost(),
                configuration.smtpPort(),
                configuration.smtpUser(),
                configuration.smtpPassword() != null && !configuration.smtpPassword().isEmpty(),
                configuration.encryption(),
                configuration.events());
    }
}
