package com.mailbridge.smtpapp.smtp;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Editable fields of an SMTP configuration. On update a null password keeps the stored one.
 */
public record SmtpConfigurationInput(
        @NotBlank String name,
        boolean active,
        String senderName,
        @Email String senderEmail,
        @NotBlank String smtpHost,
        @Min(1) @Max(65535) int smtpPort,
        String smtpUser,
        String smtpPassword,
        SmtpEncryption encryption) {}
