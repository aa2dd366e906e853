package com.mailbridge.smtpapp;

import com.mailbridge.smtpapp.config.SmtpAppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * SMTP app back end.
 *
 * <p>Dashboard requests to {@code /api/v1/configurations} pass through the protected procedure
 * pipeline (tenant identity, bearer token, tenant-bound client). Operations that change the
 * configuration then reconcile the app's webhooks on the tenant. {@code /api/register} installs
 * the app on a tenant.
 */
@SpringBootApplication
@EnableConfigurationProperties(SmtpAppProperties.class)
public class SmtpAppApplication {

    private static final Logger log = LoggerFactory.getLogger(SmtpAppApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SmtpAppApplication.class, args);
        log.info("SMTP app started");
    }
}
