package com.mailbridge.smtpapp.smtp;

/** No SMTP configuration with the given id exists for the tenant. */
public class ConfigurationNotFoundException extends RuntimeException {

    private final String configurationId;

    public ConfigurationNotFoundException(String configurationId) {
        super("SMTP configuration not found: " + configurationId);
        this.configurationId = configurationId;
    }

    public String configurationId() {
        return configurationId;
    }
}
