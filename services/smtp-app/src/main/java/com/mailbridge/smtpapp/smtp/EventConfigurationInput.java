package com.mailbridge.smtpapp.smtp;

/** Editable fields of one event; a null subject or template keeps the stored value. */
public record EventConfigurationInput(boolean active, String subject, String template) {}
