package com.mailbridge.smtpapp.smtp;

import com.mailbridge.tenantapi.version.FeatureFlags;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Events the app can send e-mails for, with the tenant webhook that delivers each one.
 *
 * <p>Account events all arrive through the single {@code NOTIFY_USER} webhook. Some events
 * exist only on newer tenant API versions and are gated by a {@link FeatureFlags} entry.
 */
public enum EmailEvent {
    ORDER_CREATED("order-created", "ORDER_CREATED", "Order {{order.number}} has been created"),
    ORDER_CONFIRMED("order-confirmed", "ORDER_CONFIRMED", "Order {{order.number}} has been confirmed"),
    ORDER_FULFILLED("order-fulfilled", "ORDER_FULFILLED", "Order {{order.number}} has been fulfilled"),
    ORDER_FULLY_PAID("order-fully-paid", "ORDER_FULLY_PAID", "Order {{order.number}} has been fully paid"),
    ORDER_CANCELLED("order-cancelled", "ORDER_CANCELLED", "Order {{order.number}} has been cancelled"),
    ORDER_REFUNDED("order-refunded", "ORDER_REFUNDED", "Order {{order.number}} has been refunded",
            FeatureFlags::orderRefundedEvent),
    INVOICE_SENT("invoice-sent", "INVOICE_SENT", "New invoice has been created"),
    GIFT_CARD_SENT("gift-card-sent", "GIFT_CARD_SENT", "Gift card has been sent",
            FeatureFlags::giftCardSentEvent),
    ACCOUNT_CONFIRMATION("notify-user", "NOTIFY_USER", "Account activation"),
    ACCOUNT_PASSWORD_RESET("notify-user", "NOTIFY_USER", "Password reset request"),
    ACCOUNT_CHANGE_EMAIL_REQUEST("notify-user", "NOTIFY_USER", "Email change request"),
    ACCOUNT_CHANGE_EMAIL_CONFIRM("notify-user", "NOTIFY_USER", "Email change confirmation"),
    ACCOUNT_DELETE("notify-user", "NOTIFY_USER", "Account deletion");

    private final String webhookName;
    private final String webhookEvent;
    private final String defaultSubject;
    private final Predicate<FeatureFlags> availability;

    EmailEvent(String webhookName, String webhookEvent, String defaultSubject) {
        this(webhookName, webhookEvent, defaultSubject, flags -> true);
    }

    EmailEvent(
            String webhookName,
            String webhookEvent,
            String defaultSubject,
            Predicate<FeatureFlags> availability) {
        this.webhookName = webhookName;
        this.webhookEvent = webhookEvent;
        this.defaultSubject = defaultSubject;
        this.availability = availability;
    }

    public String webhookName() {
        return webhookName;
    }

    public String webhookEvent() {
        return webhookEvent;
    }

    public String defaultSubject() {
        return defaultSubject;
    }

    public boolean isAvailable(FeatureFlags flags) {
        return availability.test(flags);
    }

    /** Every webhook name this app can ever register. */
    public static Set<String> webhookNames() {
        return Arrays.stream(values()).map(EmailEvent::webhookName).collect(Collectors.toSet());
    }

    /**
     * Accepts the enum name in any case, with dashes or underscores.
     *
     * @throws IllegalArgumentException for unknown events
     */
    public static EmailEvent fromPath(String value) {
        String normalised = value == null ? "" : value.strip().replace('-', '_').toUpperCase(Locale.ROOT);
        for (EmailEvent event : values()) {
            if (event.name().equals(normalised)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown email event: " + value);
    }
}
