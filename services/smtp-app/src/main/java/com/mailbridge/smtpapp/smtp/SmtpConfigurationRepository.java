package com.mailbridge.smtpapp.smtp;

import java.util.List;

/**
 * Storage of a tenant's SMTP configurations. The whole list is read and written at once.
 */
public interface SmtpConfigurationRepository {

    List<SmtpConfiguration> findAll();

    void saveAll(List<SmtpConfiguration> configurations);
}
