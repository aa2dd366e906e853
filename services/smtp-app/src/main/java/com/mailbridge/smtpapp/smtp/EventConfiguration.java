package com.mailbridge.smtpapp.smtp;

/**
 * E-mail settings of one event within a configuration.
 *
 * @param eventType the event
 * @param active whether e-mails are sent for it
 * @param subject subject template
 * @param template body template
 */
public record EventConfiguration(EmailEvent eventType, boolean active, String subject, String template) {

    public EventConfiguration {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        if (subject == null) {
            subject = eventType.defaultSubject();
        }
        if (template == null) {
            template = "";
        }
    }

    static EventConfiguration defaultFor(EmailEvent event) {
        return new EventConfiguration(event, true, event.defaultSubject(), "");
    }
}
