package com.mailbridge.tenantapi.version;

/**
 * Capabilities of a tenant that depend on its API version.
 *
 * @param giftCardSentEvent  tenant emits {@code GIFT_CARD_SENT}
 * @param orderRefundedEvent tenant emits {@code ORDER_REFUNDED}
 */
public record FeatureFlags(boolean giftCardSentEvent, boolean orderRefundedEvent) {

    static final ApiVersion GIFT_CARD_SENT_SINCE = new ApiVersion(3, 13, 0);
    static final ApiVersion ORDER_REFUNDED_SINCE = new ApiVersion(3, 14, 0);

    public static final FeatureFlags NONE = new FeatureFlags(false, false);

    public static FeatureFlags forVersion(ApiVersion version) {
        if (version == null) {
            return NONE;
        }
        return new FeatureFlags(
                version.isAtLeast(GIFT_CARD_SENT_SINCE),
                version.isAtLeast(ORDER_REFUNDED_SINCE));
    }
}
