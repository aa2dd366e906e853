package com.mailbridge.smtpapp.smtp;

/** Transport security towards the SMTP server. */
public enum SmtpEncryption {
    NONE,
    SSL,
    TLS
}
